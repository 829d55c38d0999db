package io.taskwire.observability;

import java.util.Map;

/**
 * Counter sink the transports report to. Implementations must be thread-safe.
 */
@FunctionalInterface
public interface TransportMetrics {
    String MESSAGE_SENT = "message_sent";
    String MESSAGE_RECEIVED = "message_received";
    String MESSAGE_DROPPED = "message_dropped";
    String MESSAGE_ERROR = "message_error";
    String TASK_TIMEOUT = "task_timeout";
    String HANDSHAKE_TIMEOUT = "handshake_timeout";

    void increment(String name, Map<String, String> labels);

    default void increment(String name) {
        increment(name, Map.of());
    }

    default void dropped(String reason) {
        increment(MESSAGE_DROPPED, Map.of("reason", reason));
    }

    static TransportMetrics noop() {
        return (name, labels) -> {
        };
    }
}
