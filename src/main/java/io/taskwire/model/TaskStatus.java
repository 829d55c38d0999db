package io.taskwire.model;

public enum TaskStatus {
    COMPLETED,
    FAILED,
    TIMEOUT,
    CANCELLED
}
