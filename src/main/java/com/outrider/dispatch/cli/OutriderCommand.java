package com.outrider.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Outrider.
 * Routes to subcommands: serve, run, tools.
 */
@Command(
        name = "outrider",
        mixinStandardHelpOptions = true,
        version = "Outrider 0.1.0",
        description = "Background agent manager exposed as MCP tools",
        subcommands = {
                ServeCommand.class,
                RunCommand.class,
                ToolsCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class OutriderCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
