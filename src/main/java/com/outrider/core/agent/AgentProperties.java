package com.outrider.core.agent;

import com.outrider.core.model.AgentModel;
import com.outrider.core.model.AgentRole;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Background agent defaults and limits.
 *
 * <pre>
 * outrider:
 *   agents:
 *     default-role: developer
 *     default-model: haiku
 *     default-timeout-seconds: 300
 *     max-concurrent-agents: 5
 *     model-tier:
 *       exploration: haiku
 *       complexity: sonnet
 *       critical: opus
 * </pre>
 */
@Component
@ConfigurationProperties(prefix = "outrider.agents")
public class AgentProperties {

    private AgentRole defaultRole = AgentRole.DEVELOPER;
    private AgentModel defaultModel = AgentModel.HAIKU;
    private int defaultTimeoutSeconds = 300;
    /** 0 or negative means unlimited. */
    private int maxConcurrentAgents = 0;
    private ModelTier modelTier = new ModelTier();

    public AgentRole getDefaultRole() { return defaultRole; }
    public void setDefaultRole(AgentRole defaultRole) { this.defaultRole = defaultRole; }
    public AgentModel getDefaultModel() { return defaultModel; }
    public void setDefaultModel(AgentModel defaultModel) { this.defaultModel = defaultModel; }
    public int getDefaultTimeoutSeconds() { return defaultTimeoutSeconds; }
    public void setDefaultTimeoutSeconds(int defaultTimeoutSeconds) { this.defaultTimeoutSeconds = defaultTimeoutSeconds; }
    public int getMaxConcurrentAgents() { return maxConcurrentAgents; }
    public void setMaxConcurrentAgents(int maxConcurrentAgents) { this.maxConcurrentAgents = maxConcurrentAgents; }
    public ModelTier getModelTier() { return modelTier; }
    public void setModelTier(ModelTier modelTier) { this.modelTier = modelTier; }

    /**
     * Model to use per task tier when the caller leaves the model unset.
     * A null entry falls back to the default model.
     */
    public static class ModelTier {
        private AgentModel exploration = AgentModel.HAIKU;
        private AgentModel complexity = AgentModel.SONNET;
        private AgentModel critical = AgentModel.OPUS;

        public AgentModel getExploration() { return exploration; }
        public void setExploration(AgentModel exploration) { this.exploration = exploration; }
        public AgentModel getComplexity() { return complexity; }
        public void setComplexity(AgentModel complexity) { this.complexity = complexity; }
        public AgentModel getCritical() { return critical; }
        public void setCritical(AgentModel critical) { this.critical = critical; }
    }
}
