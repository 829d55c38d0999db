package io.taskwire.transport.socket;

import io.taskwire.transport.TransportException;

/**
 * The server gave up waiting for {@code HELLO} and closed the connection.
 */
public final class HandshakeTimeoutException extends TransportException {
    public HandshakeTimeoutException(String socketPath, long timeoutMs) {
        super("Handshake timed out after " + timeoutMs + "ms on " + socketPath);
    }
}
