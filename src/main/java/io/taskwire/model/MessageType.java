package io.taskwire.model;

public enum MessageType {
    TASK_REQUEST,
    TASK_RESPONSE,
    HELLO,
    ACK,
    PING,
    PONG;

    public boolean isControl() {
        return this == HELLO || this == ACK || this == PING || this == PONG;
    }

    public static MessageType fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Message type cannot be empty");
        }
        for (MessageType value : values()) {
            if (value.name().equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown message type: " + raw);
    }
}
