package io.taskwire.transport.socket;

import io.taskwire.model.MessageEnvelope;

/**
 * Server-side handler; receives the connection so it can reply with
 * {@link UnixSocketServer#send(SocketConnection, MessageEnvelope)}.
 */
@FunctionalInterface
public interface ConnectionMessageHandler {
    void onMessage(MessageEnvelope envelope, SocketConnection connection) throws Exception;
}
