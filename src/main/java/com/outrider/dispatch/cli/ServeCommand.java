package com.outrider.dispatch.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.concurrent.CountDownLatch;

/**
 * CLI command: outrider serve
 * <p>
 * Runs Outrider as an MCP server on stdio. The transport is enabled by
 * {@link com.outrider.OutriderApplication#main} detecting "serve" in args, and
 * {@link CliRunner} skips picocli so nothing but protocol messages reaches stdout.
 * The main thread parks in {@link #awaitShutdown()} until the context closes.
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the Outrider MCP server on stdio")
@Component
public class ServeCommand implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(ServeCommand.class);

    private final CountDownLatch closed = new CountDownLatch(1);

    @Override
    public void run() {
        // Only reached through picocli (e.g. --help paths); serve mode bypasses it.
        ConsoleOutput.info("Run 'outrider serve' directly to start the MCP stdio server.");
    }

    @EventListener
    public void onReady(ApplicationReadyEvent event) {
        log.info("Outrider MCP server ready on stdio");
    }

    @EventListener
    public void onClosed(ContextClosedEvent event) {
        closed.countDown();
    }

    public void awaitShutdown() throws InterruptedException {
        closed.await();
    }
}
