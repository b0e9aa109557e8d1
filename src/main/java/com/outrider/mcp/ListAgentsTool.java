package com.outrider.mcp;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.outrider.core.agent.AgentManager;
import com.outrider.core.model.AgentSnapshot;
import com.outrider.core.model.AgentStatus;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@code agent_list}: every agent, oldest first, optionally filtered by status.
 */
public class ListAgentsTool extends AgentTool<ListAgentsTool.Input> {

    static final String NAME = "agent_list";

    private static final String SCHEMA = """
            {
              "type": "object",
              "properties": {
                "status": {
                  "type": "string",
                  "enum": ["pending", "running", "completed", "failed", "killed"],
                  "description": "Only list agents in this status. Leave empty to list all agents."
                }
              }
            }
            """;

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Input(String status) {}

    private final AgentManager manager;

    public ListAgentsTool(AgentManager manager, ObjectMapper objectMapper) {
        super(objectMapper, Input.class, NAME,
                "List background agents with their status, optionally filtered by status", SCHEMA);
        this.manager = manager;
    }

    @Override
    protected String handle(Input input) {
        AgentStatus filter = ToolArguments.status(input.status());
        List<AgentSnapshot> all = manager.list();

        Map<String, Integer> counts = new LinkedHashMap<>();
        for (AgentStatus status : AgentStatus.values()) {
            counts.put(status.value(), 0);
        }
        all.forEach(s -> counts.merge(s.status().value(), 1, Integer::sum));

        List<AgentSnapshot> shown = filter == null ? all
                : all.stream().filter(s -> s.status() == filter).toList();
        var response = new AgentToolResponses.ListResponse(
                shown.stream().map(s -> AgentToolResponses.StatusResponse.of(s, false)).toList(),
                shown.size(),
                filter == null ? null : filter.value(),
                counts);

        StringBuilder md = new StringBuilder("# Background Agents\n\n");
        if (filter != null) {
            md.append("Showing ").append(shown.size()).append(" agent(s) with status: **")
                    .append(filter.value()).append("**\n\n");
        } else {
            md.append("Showing ").append(shown.size()).append(" total agent(s)\n\n");
        }
        md.append("## Summary\n\n");
        counts.forEach((status, count) -> md.append("- **").append(status).append("**: ").append(count).append('\n'));

        if (shown.isEmpty()) {
            md.append("\nNo agents found.\n");
        } else {
            md.append("\n## Agents\n\n");
            for (var agent : response.agents()) {
                md.append("### ").append(AgentToolResponses.icon(AgentStatus.fromValue(agent.status()).orElseThrow()))
                        .append(' ').append(agent.agentId()).append("\n\n");
                md.append("- **Status**: ").append(agent.status()).append('\n');
                md.append("- **Role**: ").append(agent.role()).append('\n');
                md.append("- **Model**: ").append(agent.model()).append('\n');
                md.append("- **Duration**: ").append(agent.duration()).append('\n');
                md.append("- **Created**: ").append(agent.createdAt()).append('\n');
                if (agent.error() != null) {
                    md.append("- **Error**: ").append(agent.error()).append('\n');
                }
                md.append('\n');
            }
        }
        return AgentToolResponses.render(objectMapper, md.toString(), response);
    }
}
