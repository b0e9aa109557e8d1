package com.outrider.mcp;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.outrider.core.agent.AgentValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.definition.DefaultToolDefinition;
import org.springframework.ai.tool.definition.ToolDefinition;

/**
 * Base for the agent tools exposed over MCP. Parses the JSON arguments into {@code I},
 * delegates to {@link #handle} and returns its rendered text.
 *
 * <p>Exceptions propagate; the MCP server turns them into tool errors.
 *
 * @param <I> argument record type
 */
public abstract class AgentTool<I> implements ToolCallback {

    private static final Logger log = LoggerFactory.getLogger(AgentTool.class);

    protected final ObjectMapper objectMapper;
    private final Class<I> inputType;
    private final ToolDefinition definition;

    protected AgentTool(ObjectMapper objectMapper, Class<I> inputType,
                        String name, String description, String inputSchema) {
        this.objectMapper = objectMapper;
        this.inputType = inputType;
        this.definition = DefaultToolDefinition.builder()
                .name(name)
                .description(description)
                .inputSchema(inputSchema)
                .build();
    }

    @Override
    public ToolDefinition getToolDefinition() {
        return definition;
    }

    @Override
    public String call(String toolInput) {
        log.debug("Tool {} called with {}", definition.name(), toolInput);
        I input = parse(toolInput);
        return handle(input);
    }

    protected abstract String handle(I input);

    I parse(String toolInput) {
        String json = toolInput == null || toolInput.isBlank() ? "{}" : toolInput;
        try {
            return objectMapper.readValue(json, inputType);
        } catch (JsonProcessingException e) {
            throw new AgentValidationException("invalid arguments for " + definition.name()
                    + ": " + e.getOriginalMessage(), e);
        }
    }

    protected static String requireAgentId(String agentId) {
        if (agentId == null || agentId.isBlank()) {
            throw new AgentValidationException("agent_id is required");
        }
        return agentId.trim();
    }
}
