package com.outrider.mcp;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.outrider.core.agent.AgentManager;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.ToolCallbackProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Registers the agent tools with the MCP server.
 */
@Configuration
public class AgentToolsConfig {

    @Bean
    public ToolCallbackProvider agentTools(AgentManager manager, ObjectMapper objectMapper) {
        return ToolCallbackProvider.from(tools(manager, objectMapper));
    }

    static List<ToolCallback> tools(AgentManager manager, ObjectMapper objectMapper) {
        return List.of(
                new SpawnAgentTool(manager, objectMapper),
                new AgentStatusTool(manager, objectMapper),
                new ListAgentsTool(manager, objectMapper),
                new KillAgentTool(manager, objectMapper),
                new AgentOutputTool(manager, objectMapper));
    }
}
