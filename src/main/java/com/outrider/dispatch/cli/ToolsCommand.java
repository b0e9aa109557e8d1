package com.outrider.dispatch.cli;

import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.ToolCallbackProvider;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;

/**
 * CLI command: outrider tools
 * <p>
 * Lists the MCP tools this server registers.
 */
@Command(name = "tools", mixinStandardHelpOptions = true, description = "List the MCP tools Outrider exposes")
@Component
public class ToolsCommand implements Runnable {

    @Option(names = {"--schema", "-s"}, description = "Also print each tool's input schema")
    private boolean schema;

    private final List<ToolCallbackProvider> providers;

    public ToolsCommand(List<ToolCallbackProvider> providers) {
        this.providers = providers;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        int count = 0;
        for (ToolCallbackProvider provider : providers) {
            for (ToolCallback tool : provider.getToolCallbacks()) {
                var definition = tool.getToolDefinition();
                ConsoleOutput.tool(definition.name(), definition.description());
                if (schema) {
                    System.out.println(definition.inputSchema().strip().indent(4));
                }
                count++;
            }
        }
        System.out.println();
        ConsoleOutput.info(count + " tool" + (count != 1 ? "s" : ""));
    }
}
