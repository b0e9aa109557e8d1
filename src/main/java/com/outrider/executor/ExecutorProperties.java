package com.outrider.executor;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Settings for {@link ProcessAgentExecutor}.
 *
 * <p>{@code command} is the argument list of the agent CLI. The placeholders {@code {model}}
 * and {@code {role}} are substituted per agent, and the task text is appended as the last
 * argument.
 */
@Component
@ConfigurationProperties(prefix = "outrider.executor")
public class ExecutorProperties {

    private List<String> command = new ArrayList<>(List.of("claude", "--print", "--model", "{model}"));
    private String workingDirectory = ".";
    private Map<String, String> environment = new LinkedHashMap<>();

    public List<String> getCommand() { return command; }
    public void setCommand(List<String> command) { this.command = command; }
    public String getWorkingDirectory() { return workingDirectory; }
    public void setWorkingDirectory(String workingDirectory) { this.workingDirectory = workingDirectory; }
    public Map<String, String> getEnvironment() { return environment; }
    public void setEnvironment(Map<String, String> environment) { this.environment = environment; }
}
