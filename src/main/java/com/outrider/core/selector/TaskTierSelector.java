package com.outrider.core.selector;

import com.outrider.core.agent.AgentProperties;
import com.outrider.core.model.AgentModel;
import com.outrider.core.model.AgentRole;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Keyword-based selector. The task tier decides the model (via
 * {@code outrider.agents.model-tier}); the task's subject decides the role.
 */
@Component
public class TaskTierSelector implements AgentSelector {

    private static final Logger log = LoggerFactory.getLogger(TaskTierSelector.class);

    private static final List<String> ARCHITECTURE_WORDS = List.of("architecture", "architect", "design");
    private static final List<String> REVIEW_WORDS = List.of("review", "audit");
    private static final List<String> OPS_WORDS = List.of("deploy", "infra", "pipeline", "kubernetes", "docker", "ci/cd");

    private final AgentProperties properties;

    public TaskTierSelector(AgentProperties properties) {
        this.properties = properties;
    }

    @Override
    public Selection select(SelectionRequest request) {
        TaskTier tier = TaskTier.classify(request.task());
        AgentRole role = roleFor(request.task(), tier, request.defaultRole());
        AgentModel model = modelFor(tier, request.defaultModel());
        String reason = String.format("%s task, %s role", tier.name().toLowerCase(Locale.ROOT), role.value());
        log.debug("Selected {}/{} ({})", role.value(), model.value(), reason);
        return new Selection(role, model, reason);
    }

    AgentRole roleFor(String task, TaskTier tier, AgentRole fallback) {
        String lower = task == null ? "" : task.toLowerCase(Locale.ROOT);
        if (containsAny(lower, ARCHITECTURE_WORDS)) {
            return AgentRole.ARCHITECT;
        }
        if (containsAny(lower, REVIEW_WORDS)) {
            return AgentRole.REVIEWER;
        }
        if (containsAny(lower, OPS_WORDS)) {
            return AgentRole.OPS;
        }
        if (tier == TaskTier.CRITICAL) {
            return AgentRole.SENIOR;
        }
        return fallback != null ? fallback : AgentRole.DEVELOPER;
    }

    AgentModel modelFor(TaskTier tier, AgentModel fallback) {
        var tiers = properties.getModelTier();
        AgentModel configured = tiers == null ? null : switch (tier) {
            case CRITICAL -> tiers.getCritical();
            case COMPLEXITY -> tiers.getComplexity();
            case EXPLORATION -> tiers.getExploration();
        };
        if (configured != null) {
            return configured;
        }
        return fallback != null ? fallback : AgentModel.HAIKU;
    }

    private static boolean containsAny(String text, List<String> words) {
        for (String word : words) {
            if (text.contains(word)) {
                return true;
            }
        }
        return false;
    }
}
