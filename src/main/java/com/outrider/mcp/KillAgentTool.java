package com.outrider.mcp;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.outrider.core.agent.AgentManager;
import com.outrider.core.model.AgentSnapshot;
import com.outrider.core.model.AgentStatus;

/**
 * {@code agent_kill}: stops a background agent. Killing a finished agent is a no-op.
 */
public class KillAgentTool extends AgentTool<KillAgentTool.Input> {

    static final String NAME = "agent_kill";

    private static final String SCHEMA = """
            {
              "type": "object",
              "properties": {
                "agent_id": {"type": "string", "description": "ID of the agent to kill"}
              },
              "required": ["agent_id"]
            }
            """;

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Input(@JsonProperty("agent_id") String agentId) {}

    private final AgentManager manager;

    public KillAgentTool(AgentManager manager, ObjectMapper objectMapper) {
        super(objectMapper, Input.class, NAME, "Kill a running or pending background agent", SCHEMA);
        this.manager = manager;
    }

    @Override
    protected String handle(Input input) {
        String id = requireAgentId(input.agentId());
        boolean wasTerminal = manager.get(id).isTerminal();
        AgentSnapshot snap = manager.kill(id);

        String message = !wasTerminal && snap.status() == AgentStatus.KILLED
                ? "Agent " + id + " killed"
                : "Agent " + id + " already finished as " + snap.status().value();
        var response = new AgentToolResponses.KillResponse(snap.id(), snap.role().value(),
                snap.model().value(), snap.task(), snap.status().value(), message);

        String markdown = "# Background Agent Kill " + AgentToolResponses.icon(snap.status()) + "\n\n"
                + message + "\n\n"
                + "- **Agent ID**: `" + snap.id() + "`\n"
                + "- **Status**: " + snap.status().value() + "\n"
                + "- **Role**: " + snap.role().value() + "\n"
                + "- **Model**: " + snap.model().value() + "\n";
        return AgentToolResponses.render(objectMapper, markdown, response);
    }
}
