package io.taskwire.transport.socket;

import io.taskwire.transport.TransportException;

/**
 * The client sent {@code HELLO} but no {@code ACK} arrived in time.
 */
public final class NoAckException extends TransportException {
    public NoAckException(String socketPath, long timeoutMs) {
        super("No ACK from " + socketPath + " within " + timeoutMs + "ms");
    }
}
