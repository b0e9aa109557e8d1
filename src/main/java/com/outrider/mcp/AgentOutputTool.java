package com.outrider.mcp;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.outrider.core.agent.AgentManager;
import com.outrider.core.model.AgentSnapshot;
import com.outrider.core.output.OutputFilter;

/**
 * {@code agent_output}: an agent's captured output, optionally reduced to the lines
 * matching a regex.
 */
public class AgentOutputTool extends AgentTool<AgentOutputTool.Input> {

    static final String NAME = "agent_output";

    private static final String SCHEMA = """
            {
              "type": "object",
              "properties": {
                "agent_id": {"type": "string", "description": "ID of the agent"},
                "filter_pattern": {"type": "string", "description": "Optional regular expression; only lines containing a match are returned. Use (?i) for case-insensitive matching."}
              },
              "required": ["agent_id"]
            }
            """;

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Input(
        @JsonProperty("agent_id") String agentId,
        @JsonProperty("filter_pattern") String filterPattern
    ) {}

    private final AgentManager manager;

    public AgentOutputTool(AgentManager manager, ObjectMapper objectMapper) {
        super(objectMapper, Input.class, NAME,
                "Get the output of a background agent, optionally filtered by a regex", SCHEMA);
        this.manager = manager;
    }

    @Override
    protected String handle(Input input) {
        AgentSnapshot snap = manager.get(requireAgentId(input.agentId())).snapshot();
        String pattern = input.filterPattern();
        String output = OutputFilter.filter(snap, pattern);
        boolean filtered = pattern != null && !pattern.isEmpty();

        var response = new AgentToolResponses.OutputResponse(snap.id(), snap.status().value(),
                filtered ? pattern : null, output);

        StringBuilder md = new StringBuilder();
        md.append("# Agent Output ").append(AgentToolResponses.icon(snap.status())).append("\n\n");
        md.append("**Agent ID**: `").append(snap.id()).append("`\n\n");
        md.append("**Status**: ").append(snap.status().value()).append('\n');
        if (filtered) {
            md.append("**Filter Pattern**: `").append(pattern).append("`\n");
        }
        md.append("\n## Output\n\n");
        if (output.isEmpty()) {
            md.append(filtered ? "_No lines matched the filter._\n" : "_No output yet._\n");
        } else {
            md.append("```\n").append(output).append("\n```\n");
        }
        return AgentToolResponses.render(objectMapper, md.toString(), response);
    }
}
