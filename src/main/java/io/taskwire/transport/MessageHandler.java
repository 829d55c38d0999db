package io.taskwire.transport;

import io.taskwire.model.MessageEnvelope;

@FunctionalInterface
public interface MessageHandler {
    void onMessage(MessageEnvelope envelope) throws Exception;
}
