package io.taskwire.agent;

import com.fasterxml.jackson.databind.JsonNode;

public record AgentResult(
        boolean success,
        JsonNode output,
        String errorCode,
        String error
) {
    public static AgentResult ok(JsonNode output) {
        return new AgentResult(true, output, null, null);
    }

    public static AgentResult fail(String errorCode, String error) {
        return new AgentResult(false, null, errorCode, error);
    }
}
