package io.taskwire.transport;

/**
 * Handle for one handler registration. Unsubscribing twice is a no-op.
 */
@FunctionalInterface
public interface Subscription extends AutoCloseable {
    void unsubscribe();

    @Override
    default void close() {
        unsubscribe();
    }
}
