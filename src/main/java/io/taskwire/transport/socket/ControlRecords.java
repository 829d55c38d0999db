package io.taskwire.transport.socket;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.taskwire.model.MessageType;

import java.util.List;
import java.util.Optional;

/**
 * Handshake, heartbeat and error records. They carry a {@code type} or {@code error} key and
 * never a {@code messageType}, which is how they are told apart from envelopes.
 */
public final class ControlRecords {
    public static final String TYPE = "type";
    public static final String ERROR = "error";
    public static final String HANDSHAKE_TIMEOUT = "handshake_timeout";
    public static final String INVALID_MESSAGE = "invalid_message";

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private ControlRecords() {
    }

    public static ObjectNode hello(String client) {
        ObjectNode node = typed(MessageType.HELLO);
        node.put("client", client);
        return node;
    }

    public static ObjectNode ack(String version) {
        ObjectNode node = typed(MessageType.ACK);
        node.put("version", version);
        return node;
    }

    public static ObjectNode ping() {
        return typed(MessageType.PING);
    }

    public static ObjectNode pong() {
        return typed(MessageType.PONG);
    }

    public static ObjectNode handshakeTimeout() {
        ObjectNode node = NODES.objectNode();
        node.put(ERROR, HANDSHAKE_TIMEOUT);
        return node;
    }

    public static ObjectNode invalidMessage(List<String> details) {
        ObjectNode node = NODES.objectNode();
        node.put(ERROR, INVALID_MESSAGE);
        ArrayNode fields = node.putArray("details");
        details.forEach(fields::add);
        return node;
    }

    /**
     * Control type of {@code record}, empty for envelopes and error records.
     */
    public static Optional<MessageType> controlType(JsonNode record) {
        if (record.has("messageType")) {
            return Optional.empty();
        }
        JsonNode type = record.get(TYPE);
        if (type == null || !type.isTextual()) {
            return Optional.empty();
        }
        try {
            MessageType parsed = MessageType.fromString(type.asText());
            return parsed.isControl() ? Optional.of(parsed) : Optional.empty();
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    public static Optional<String> errorCode(JsonNode record) {
        if (record.has("messageType")) {
            return Optional.empty();
        }
        JsonNode error = record.get(ERROR);
        return error != null && error.isTextual() ? Optional.of(error.asText()) : Optional.empty();
    }

    private static ObjectNode typed(MessageType type) {
        ObjectNode node = NODES.objectNode();
        node.put(TYPE, type.name());
        node.put("ts", System.currentTimeMillis());
        return node;
    }
}
