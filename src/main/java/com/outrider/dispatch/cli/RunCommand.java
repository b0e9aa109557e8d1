package com.outrider.dispatch.cli;

import com.outrider.core.agent.AgentManager;
import com.outrider.core.agent.AgentProperties;
import com.outrider.core.agent.AgentValidationException;
import com.outrider.core.model.AgentModel;
import com.outrider.core.model.AgentRole;
import com.outrider.core.model.AgentSnapshot;
import com.outrider.core.model.AgentStatus;
import com.outrider.core.model.SpawnOptions;
import com.outrider.core.output.OutputFilter;
import com.outrider.core.output.OutputPatternException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: outrider run &lt;task&gt;
 * <p>
 * Spawns one background agent, waits for it to finish and prints its output.
 * Exit code 0 when the agent completed, 1 when it failed or was killed, 2 when the
 * request was rejected.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Run a task as a background agent and wait for it")
@Component
public class RunCommand implements Callable<Integer> {

    /** Extra wait beyond the agent deadline for the timeout to be recorded. */
    private static final Duration GRACE = Duration.ofSeconds(5);

    @Spec
    private CommandSpec spec;

    @Parameters(arity = "1..*", paramLabel = "TASK", description = "Task description")
    private List<String> taskWords;

    @Option(names = {"--role", "-r"}, description = "Role: architect, senior, developer, ops, reviewer")
    private String role;

    @Option(names = {"--model", "-m"}, description = "Model: opus, sonnet, haiku")
    private String model;

    @Option(names = {"--timeout", "-t"}, description = "Timeout in seconds (default: configured)")
    private Integer timeoutSeconds;

    @Option(names = {"--filter", "-f"}, description = "Only print output lines matching this regex")
    private String filter;

    private final AgentManager manager;
    private final AgentProperties properties;

    public RunCommand(AgentManager manager, AgentProperties properties) {
        this.manager = manager;
        this.properties = properties;
    }

    @Override
    public Integer call() throws Exception {
        String task = String.join(" ", taskWords);
        AgentRole parsedRole = role == null ? null : AgentRole.fromValue(role)
                .orElseThrow(() -> new ParameterException(spec.commandLine(), "Unknown role: " + role));
        AgentModel parsedModel = model == null ? null : AgentModel.fromValue(model)
                .orElseThrow(() -> new ParameterException(spec.commandLine(), "Unknown model: " + model));
        if (filter != null) {
            try {
                OutputFilter.compile(filter);
            } catch (OutputPatternException e) {
                throw new ParameterException(spec.commandLine(), e.getMessage());
            }
        }

        AgentSnapshot spawned;
        try {
            spawned = manager.spawn(task, new SpawnOptions(parsedRole, parsedModel, timeoutSeconds)).snapshot();
        } catch (AgentValidationException e) {
            ConsoleOutput.error(e.getMessage());
            return 2;
        }
        ConsoleOutput.agent(spawned);

        int timeout = timeoutSeconds != null ? timeoutSeconds : properties.getDefaultTimeoutSeconds();
        AgentSnapshot done = manager.awaitTerminal(spawned.id(), Duration.ofSeconds(timeout).plus(GRACE));
        ConsoleOutput.agent(done);

        String output = OutputFilter.filter(done, filter);
        if (!output.isEmpty()) {
            System.out.println();
            System.out.println(output);
        }
        return done.status() == AgentStatus.COMPLETED ? 0 : 1;
    }
}
