package com.outrider.mcp;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.outrider.core.model.AgentSnapshot;
import com.outrider.core.model.AgentStatus;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * JSON payloads returned by the agent tools, and the markdown-plus-JSON rendering they share.
 */
public final class AgentToolResponses {

    private AgentToolResponses() {}

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record SpawnResponse(String agentId, String role, String model, String task,
                                String status, String createdAt, String message) {}

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record StatusResponse(String agentId, String role, String model, String task, String status,
                                 String createdAt, String startedAt, String finishedAt,
                                 String duration, String output, String error) {

        static StatusResponse of(AgentSnapshot snapshot, boolean includeOutput) {
            return new StatusResponse(snapshot.id(), snapshot.role().value(), snapshot.model().value(),
                    snapshot.task(), snapshot.status().value(),
                    iso(snapshot.createdAt()), iso(snapshot.startedAt()), iso(snapshot.finishedAt()),
                    formatDuration(snapshot.duration()),
                    includeOutput && !snapshot.output().isEmpty() ? snapshot.output() : null,
                    snapshot.failureReason());
        }
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ListResponse(List<StatusResponse> agents, int totalCount, String statusFilter,
                               Map<String, Integer> counts) {}

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record KillResponse(String agentId, String role, String model, String task,
                               String status, String message) {}

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record OutputResponse(String agentId, String status, String filter, String output) {}

    /**
     * Markdown body followed by the payload as a fenced JSON block.
     */
    static String render(ObjectMapper objectMapper, String markdown, Object payload) {
        String json;
        try {
            json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("failed to serialise tool response", e);
        }
        StringBuilder sb = new StringBuilder(markdown);
        if (!markdown.endsWith("\n")) {
            sb.append('\n');
        }
        sb.append("\n```json\n").append(json).append("\n```\n");
        return sb.toString();
    }

    static String iso(Instant instant) {
        return instant == null ? null : instant.toString();
    }

    static String formatDuration(Duration duration) {
        long millis = duration.toMillis();
        if (millis < 1000) {
            return millis + "ms";
        }
        return String.format("%d.%03ds", millis / 1000, millis % 1000);
    }

    static String icon(AgentStatus status) {
        return switch (status) {
            case PENDING -> "⏳";
            case RUNNING -> "🔄";
            case COMPLETED -> "✅";
            case FAILED -> "❌";
            case KILLED -> "🛑";
        };
    }
}
