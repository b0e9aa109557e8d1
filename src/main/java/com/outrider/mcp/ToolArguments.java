package com.outrider.mcp;

import com.outrider.core.agent.AgentValidationException;
import com.outrider.core.model.AgentModel;
import com.outrider.core.model.AgentRole;
import com.outrider.core.model.AgentStatus;

import java.util.Arrays;

/**
 * Parses optional enum-valued tool arguments. Blank means "not given"; anything else must
 * name a known value, case-insensitively.
 */
final class ToolArguments {

    private ToolArguments() {}

    static AgentRole role(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return AgentRole.fromValue(value).orElseThrow(() -> new AgentValidationException(
                "invalid role '" + value + "'. Valid values: "
                        + join(Arrays.stream(AgentRole.values()).map(AgentRole::value).toArray(String[]::new))));
    }

    static AgentModel model(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return AgentModel.fromValue(value).orElseThrow(() -> new AgentValidationException(
                "invalid model '" + value + "'. Valid values: "
                        + join(Arrays.stream(AgentModel.values()).map(AgentModel::value).toArray(String[]::new))));
    }

    static AgentStatus status(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return AgentStatus.fromValue(value).orElseThrow(() -> new AgentValidationException(
                "invalid status '" + value + "'. Valid values: "
                        + join(Arrays.stream(AgentStatus.values()).map(AgentStatus::value).toArray(String[]::new))));
    }

    private static String join(String[] values) {
        return String.join(", ", values);
    }
}
