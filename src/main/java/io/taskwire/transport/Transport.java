package io.taskwire.transport;

import io.taskwire.model.MessageEnvelope;

/**
 * Moves envelopes from senders to the handlers subscribed for their recipient.
 */
public interface Transport extends AutoCloseable {
    /**
     * Validates and hands the envelope to the transport for delivery.
     *
     * @throws io.taskwire.envelope.ValidationException if the envelope is malformed
     * @throws QueueFullException if the recipient's bounded queue is full
     */
    void send(MessageEnvelope envelope);

    Subscription subscribe(String recipient, MessageHandler handler);

    @Override
    void close();
}
