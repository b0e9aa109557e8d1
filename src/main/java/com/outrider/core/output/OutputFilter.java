package com.outrider.core.output;

import com.outrider.core.model.AgentSnapshot;

import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Line-oriented regex selection over an agent's captured output.
 *
 * <p>Output is split on {@code "\n"} and every line in which the pattern is found is kept.
 * Kept lines are joined with no separator, so the newlines themselves are dropped.
 */
public final class OutputFilter {

    private OutputFilter() {}

    /**
     * @param snapshot agent state to read output from
     * @param pattern  regex; null or empty returns the output unchanged
     * @return the selected lines, or {@code ""} when nothing matches
     * @throws OutputPatternException if the pattern does not compile
     */
    public static String filter(AgentSnapshot snapshot, String pattern) {
        return filter(snapshot.output(), pattern);
    }

    public static String filter(String output, String pattern) {
        String text = output == null ? "" : output;
        if (pattern == null || pattern.isEmpty()) {
            return text;
        }
        Pattern compiled = compile(pattern);
        StringBuilder kept = new StringBuilder();
        for (String line : text.split("\n", -1)) {
            if (compiled.matcher(line).find()) {
                kept.append(line);
            }
        }
        return kept.toString();
    }

    /**
     * Compiles a filter pattern, mapping syntax errors to {@link OutputPatternException}.
     */
    public static Pattern compile(String pattern) {
        try {
            return Pattern.compile(pattern);
        } catch (PatternSyntaxException e) {
            throw new OutputPatternException(pattern, e);
        }
    }
}
