package io.taskwire.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.util.Map;
import java.util.UUID;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskRequest(
        String taskId,
        String taskType,
        JsonNode parameters,
        Map<String, String> metadata,
        Integer priority
) {
    public TaskRequest {
        parameters = parameters == null ? JsonNodeFactory.instance.objectNode() : parameters;
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static TaskRequest of(String taskType, JsonNode parameters) {
        return new TaskRequest(UUID.randomUUID().toString(), taskType, parameters, Map.of(), null);
    }
}
