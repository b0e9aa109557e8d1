package com.outrider.mcp;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.outrider.core.agent.AgentManager;
import com.outrider.core.model.AgentSnapshot;

/**
 * {@code agent_status}: full state of one agent, including its output so far.
 */
public class AgentStatusTool extends AgentTool<AgentStatusTool.Input> {

    static final String NAME = "agent_status";

    private static final String SCHEMA = """
            {
              "type": "object",
              "properties": {
                "agent_id": {"type": "string", "description": "ID of the agent to inspect"}
              },
              "required": ["agent_id"]
            }
            """;

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Input(@JsonProperty("agent_id") String agentId) {}

    private final AgentManager manager;

    public AgentStatusTool(AgentManager manager, ObjectMapper objectMapper) {
        super(objectMapper, Input.class, NAME,
                "Get the status, timeline, output and error of a background agent", SCHEMA);
        this.manager = manager;
    }

    @Override
    protected String handle(Input input) {
        AgentSnapshot snap = manager.get(requireAgentId(input.agentId())).snapshot();
        var response = AgentToolResponses.StatusResponse.of(snap, true);

        StringBuilder md = new StringBuilder();
        md.append("# Background Agent Status ").append(AgentToolResponses.icon(snap.status())).append("\n\n");
        md.append("**Agent ID**: `").append(snap.id()).append("`\n\n");
        md.append("**Status**: ").append(snap.status().value()).append('\n');
        md.append("**Role**: ").append(snap.role().value()).append('\n');
        md.append("**Model**: ").append(snap.model().value()).append('\n');
        md.append("**Duration**: ").append(response.duration()).append("\n\n");
        md.append("## Task\n\n").append(snap.task()).append("\n\n");
        md.append("## Timeline\n\n");
        md.append("- **Created**: ").append(response.createdAt()).append('\n');
        if (response.startedAt() != null) {
            md.append("- **Started**: ").append(response.startedAt()).append('\n');
        }
        if (response.finishedAt() != null) {
            md.append("- **Finished**: ").append(response.finishedAt()).append('\n');
        }
        if (!snap.output().isEmpty()) {
            md.append("\n## Output\n\n```\n").append(snap.output()).append("\n```\n");
        }
        if (snap.failureReason() != null) {
            md.append("\n## Error\n\n```\n").append(snap.failureReason()).append("\n```\n");
        }
        return AgentToolResponses.render(objectMapper, md.toString(), response);
    }
}
