package io.taskwire.model;

public record TaskMetrics(
        long processingTimeMs,
        long tokensUsed,
        double costUsd
) {
    public static TaskMetrics none() {
        return new TaskMetrics(0L, 0L, 0.0d);
    }

    public static TaskMetrics elapsed(long processingTimeMs) {
        return new TaskMetrics(processingTimeMs, 0L, 0.0d);
    }
}
