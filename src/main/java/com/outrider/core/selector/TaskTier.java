package com.outrider.core.selector;

import java.util.List;
import java.util.Locale;

/**
 * Coarse task classification driving model choice.
 * Tiers are checked in declaration order; the first keyword hit wins.
 */
public enum TaskTier {

    CRITICAL(List.of("critical", "important", "decision", "approve", "security",
            "breaking", "delete", "remove", "dangerous", "production")),

    COMPLEXITY(List.of("implement", "refactor", "optimize", "design", "architect",
            "solve", "debug", "write", "create", "build", "integrate",
            "migrate", "transform", "restructure")),

    EXPLORATION(List.of("explore", "analyze", "find", "search", "list", "check",
            "investigate", "read", "view", "examine", "review", "inspect"));

    private final List<String> keywords;

    TaskTier(List<String> keywords) {
        this.keywords = keywords;
    }

    /**
     * Classifies task text by substring match, case-insensitive.
     * Text matching nothing is EXPLORATION.
     */
    public static TaskTier classify(String task) {
        if (task == null || task.isBlank()) {
            return EXPLORATION;
        }
        String lower = task.toLowerCase(Locale.ROOT);
        for (TaskTier tier : values()) {
            for (String keyword : tier.keywords) {
                if (lower.contains(keyword)) {
                    return tier;
                }
            }
        }
        return EXPLORATION;
    }
}
