package io.taskwire.agent;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

public record AgentContext(
        String taskId,
        String taskType,
        JsonNode parameters,
        String traceId,
        String spanId,
        String traceParent,
        Map<String, String> metadata
) {
    public AgentContext {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }
}
