package io.taskwire.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskResponse(
        String taskId,
        TaskStatus status,
        JsonNode result,
        String errorCode,
        String errorMessage,
        TaskMetrics metrics
) {
    public TaskResponse {
        metrics = metrics == null ? TaskMetrics.none() : metrics;
    }

    public static TaskResponse completed(String taskId, JsonNode result, TaskMetrics metrics) {
        return new TaskResponse(taskId, TaskStatus.COMPLETED, result, null, null, metrics);
    }

    public static TaskResponse failed(String taskId, String errorCode, String errorMessage, TaskMetrics metrics) {
        return new TaskResponse(taskId, TaskStatus.FAILED, null, errorCode, errorMessage, metrics);
    }

    public static TaskResponse timeout(String taskId, long timeoutMs) {
        return new TaskResponse(
                taskId,
                TaskStatus.TIMEOUT,
                null,
                "task_timeout",
                "Task request timeout after " + timeoutMs + "ms",
                TaskMetrics.elapsed(timeoutMs)
        );
    }

    public static TaskResponse cancelled(String taskId, String reason) {
        return new TaskResponse(taskId, TaskStatus.CANCELLED, null, "task_cancelled", reason, TaskMetrics.none());
    }
}
