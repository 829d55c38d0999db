package io.taskwire.transport;

public final class QueueFullException extends TransportException {
    private final String recipient;
    private final int maxQueueSize;

    public QueueFullException(String recipient, int maxQueueSize) {
        super("Queue full for recipient " + recipient + " (max " + maxQueueSize + ")");
        this.recipient = recipient;
        this.maxQueueSize = maxQueueSize;
    }

    public String recipient() {
        return recipient;
    }

    public int maxQueueSize() {
        return maxQueueSize;
    }
}
