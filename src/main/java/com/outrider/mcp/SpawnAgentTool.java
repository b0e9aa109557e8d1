package com.outrider.mcp;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.outrider.core.agent.AgentManager;
import com.outrider.core.model.AgentSnapshot;
import com.outrider.core.model.SpawnOptions;

/**
 * {@code agent_spawn}: starts a background agent and returns immediately.
 */
public class SpawnAgentTool extends AgentTool<SpawnAgentTool.Input> {

    static final String NAME = "agent_spawn";

    private static final String SCHEMA = """
            {
              "type": "object",
              "properties": {
                "task": {"type": "string", "description": "Task description for the agent to execute"},
                "role": {"type": "string", "description": "Optional role override: architect, senior, developer, ops, reviewer"},
                "model": {"type": "string", "description": "Optional model override: opus, sonnet, haiku"},
                "timeout_seconds": {"type": "integer", "minimum": 1, "description": "Optional maximum execution time in seconds"}
              },
              "required": ["task"]
            }
            """;

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Input(
        String task,
        String role,
        String model,
        @JsonProperty("timeout_seconds") Integer timeoutSeconds
    ) {}

    private final AgentManager manager;

    public SpawnAgentTool(AgentManager manager, ObjectMapper objectMapper) {
        super(objectMapper, Input.class, NAME,
                "Spawn a background agent to execute a task asynchronously", SCHEMA);
        this.manager = manager;
    }

    @Override
    protected String handle(Input input) {
        var options = new SpawnOptions(
                ToolArguments.role(input.role()),
                ToolArguments.model(input.model()),
                input.timeoutSeconds());
        AgentSnapshot snap = manager.spawn(input.task(), options).snapshot();

        var response = new AgentToolResponses.SpawnResponse(snap.id(), snap.role().value(),
                snap.model().value(), snap.task(), snap.status().value(),
                AgentToolResponses.iso(snap.createdAt()),
                String.format("Agent %s spawned with role %s and model %s",
                        snap.id(), snap.role().value(), snap.model().value()));

        String markdown = "# Background Agent Spawned ✅\n\n"
                + "- **Agent ID**: `" + snap.id() + "`\n"
                + "- **Status**: " + snap.status().value() + "\n"
                + "- **Role**: " + snap.role().value() + "\n"
                + "- **Model**: " + snap.model().value() + "\n\n"
                + "Use `" + AgentStatusTool.NAME + "` or `" + ListAgentsTool.NAME + "` to monitor progress.\n";
        return AgentToolResponses.render(objectMapper, markdown, response);
    }
}
