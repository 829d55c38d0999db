package io.taskwire.correlation;

/**
 * A task request reused the id of a request that is still awaiting its response.
 */
public final class DuplicateTaskException extends RuntimeException {
    private final String taskId;

    public DuplicateTaskException(String taskId) {
        super("Task already in flight: " + taskId);
        this.taskId = taskId;
    }

    public String taskId() {
        return taskId;
    }
}
