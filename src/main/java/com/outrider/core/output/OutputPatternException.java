package com.outrider.core.output;

import com.outrider.core.agent.AgentValidationException;

import java.util.regex.PatternSyntaxException;

/**
 * Thrown when an output filter pattern does not compile.
 */
public class OutputPatternException extends AgentValidationException {

    private final String pattern;

    public OutputPatternException(String pattern, PatternSyntaxException cause) {
        super("invalid filter pattern: " + cause.getDescription()
                + (cause.getIndex() >= 0 ? " near index " + cause.getIndex() : ""), cause);
        this.pattern = pattern;
    }

    public String getPattern() {
        return pattern;
    }
}
