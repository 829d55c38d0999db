package io.taskwire.envelope;

import io.taskwire.transport.TransportException;

import java.util.List;

public final class ValidationException extends TransportException {
    private final List<String> fields;

    public ValidationException(List<String> fields) {
        super("Message validation failed: " + String.join(", ", fields));
        this.fields = List.copyOf(fields);
    }

    public List<String> fields() {
        return fields;
    }
}
