package io.taskwire.transport;

/**
 * Root of the transport error taxonomy. All transport errors are unchecked.
 */
public class TransportException extends RuntimeException {
    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
