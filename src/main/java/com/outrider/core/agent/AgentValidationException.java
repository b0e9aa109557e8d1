package com.outrider.core.agent;

/**
 * Thrown when a request is rejected before any agent state is touched:
 * blank task, unknown role or model, non-positive timeout, or capacity reached.
 */
public class AgentValidationException extends RuntimeException {
    public AgentValidationException(String message) {
        super(message);
    }

    public AgentValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
