package io.taskwire.transport;

/**
 * A handler failed while processing a delivered envelope. Recorded at the transport boundary;
 * never thrown back to the publisher.
 */
public final class DeliveryException extends TransportException {
    private final String recipient;
    private final String messageId;

    public DeliveryException(String recipient, String messageId, Throwable cause) {
        super("Handler failed for recipient " + recipient + " message " + messageId, cause);
        this.recipient = recipient;
        this.messageId = messageId;
    }

    public String recipient() {
        return recipient;
    }

    public String messageId() {
        return messageId;
    }
}
