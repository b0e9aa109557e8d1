package com.outrider.executor;

import com.outrider.core.agent.AgentExecution;
import com.outrider.core.agent.AgentExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Runs each agent as a child process of a configurable CLI.
 *
 * <p>Stdout and stderr are merged and streamed into the agent line by line. Exit code 0
 * completes the agent with the streamed output, any other code fails it. Cancellation
 * destroys the process tree.
 */
@Component
public class ProcessAgentExecutor implements AgentExecutor {

    private static final Logger log = LoggerFactory.getLogger(ProcessAgentExecutor.class);

    static final Duration DESTROY_GRACE = Duration.ofSeconds(2);

    private final ExecutorProperties properties;

    public ProcessAgentExecutor(ExecutorProperties properties) {
        this.properties = properties;
    }

    @Override
    public void execute(AgentExecution execution) throws IOException, InterruptedException {
        List<String> command = buildCommand(execution);
        log.debug("Starting agent process (deadline {}): {}",
                execution.getDeadline(), command.subList(0, command.size() - 1));

        var builder = new ProcessBuilder(command)
                .directory(Path.of(properties.getWorkingDirectory()).toFile())
                .redirectErrorStream(true);
        builder.environment().putAll(properties.getEnvironment());
        Process process = builder.start();
        execution.onCancel(() -> destroy(process));

        String lastLine = null;
        int exitCode;
        boolean exited = false;
        try {
            try (var reader = new BufferedReader(
                    new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    execution.appendOutput(line + "\n");
                    if (!line.isBlank()) {
                        lastLine = line;
                    }
                }
            } catch (IOException e) {
                // stream closes underneath us when the process is destroyed
                if (!execution.isCancelled()) {
                    throw e;
                }
            }
            exitCode = process.waitFor();
            exited = true;
        } finally {
            if (!exited) {
                destroy(process);
            }
        }

        if (execution.isCancelled()) {
            log.debug("Agent process ended after cancellation ({})", execution.getCancellationReason());
            return;
        }
        log.debug("Agent process exited with code {}", exitCode);
        if (exitCode == 0) {
            execution.complete();
        } else {
            execution.fail(new ProcessExitException(exitCode, lastLine));
        }
    }

    List<String> buildCommand(AgentExecution execution) {
        List<String> template = properties.getCommand();
        if (template == null || template.isEmpty()) {
            throw new IllegalStateException("outrider.executor.command is empty");
        }
        List<String> command = new ArrayList<>(template.size() + 1);
        for (String arg : template) {
            command.add(arg
                    .replace("{model}", execution.getModel().value())
                    .replace("{role}", execution.getRole().value()));
        }
        command.add(execution.getTask());
        return command;
    }

    /**
     * Sends SIGTERM to the process tree, then kills whatever is still alive after
     * {@link #DESTROY_GRACE}. Does not block the caller.
     */
    static void destroy(Process process) {
        List<ProcessHandle> descendants = process.descendants().collect(Collectors.toList());
        descendants.forEach(ProcessHandle::destroy);
        process.destroy();
        process.onExit()
                .orTimeout(DESTROY_GRACE.toMillis(), TimeUnit.MILLISECONDS)
                .whenComplete((exited, timeout) -> {
                    if (timeout != null) {
                        log.warn("Agent process {} ignored termination, killing it", process.pid());
                        process.descendants().forEach(ProcessHandle::destroyForcibly);
                        process.destroyForcibly();
                    }
                    descendants.stream().filter(ProcessHandle::isAlive).forEach(ProcessHandle::destroyForcibly);
                });
    }
}
