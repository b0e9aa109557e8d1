package com.outrider;

import com.outrider.dispatch.cli.ServeCommand;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ConfigurableApplicationContext;

import java.util.Arrays;

@SpringBootApplication
public class OutriderApplication {

    public static void main(String[] args) throws InterruptedException {
        boolean serveMode = Arrays.asList(args).contains("serve");

        SpringApplicationBuilder builder = new SpringApplicationBuilder(OutriderApplication.class)
                .web(WebApplicationType.NONE);

        if (serveMode) {
            // stdout belongs to the MCP stdio transport
            builder.properties(
                    "spring.main.banner-mode=off",
                    "spring.ai.mcp.server.stdio=true"
            );
        } else {
            // CLI-only: no MCP server
            builder.properties(
                    "spring.main.banner-mode=off",
                    "spring.ai.mcp.server.enabled=false",
                    "spring.ai.mcp.server.stdio=false"
            );
        }

        ConfigurableApplicationContext ctx = builder.run(args);

        if (serveMode) {
            ctx.getBean(ServeCommand.class).awaitShutdown();
            return;
        }
        ExitCodeGenerator exitCodeGen = ctx.getBean(ExitCodeGenerator.class);
        int exitCode = SpringApplication.exit(ctx, exitCodeGen);
        System.exit(exitCode);
    }
}
