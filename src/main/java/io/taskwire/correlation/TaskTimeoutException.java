package io.taskwire.correlation;

import io.taskwire.transport.TransportException;

public final class TaskTimeoutException extends TransportException {
    private final String taskId;
    private final long timeoutMs;

    public TaskTimeoutException(String taskId, long timeoutMs) {
        super("Task request timeout after " + timeoutMs + "ms: " + taskId);
        this.taskId = taskId;
        this.timeoutMs = timeoutMs;
    }

    public String taskId() {
        return taskId;
    }

    public long timeoutMs() {
        return timeoutMs;
    }
}
