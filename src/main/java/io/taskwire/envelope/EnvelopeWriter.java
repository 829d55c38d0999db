package io.taskwire.envelope;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.taskwire.model.DeliveryPolicy;
import io.taskwire.model.MessageEnvelope;
import io.taskwire.model.PropagationContext;

import java.util.List;
import java.util.Map;

/**
 * Inverse of {@link EnvelopeValidator}: renders an envelope as the wire tree. Null fields are
 * omitted and {@code createdAt} is written as epoch milliseconds.
 */
public final class EnvelopeWriter {
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private EnvelopeWriter() {
    }

    public static ObjectNode toTree(MessageEnvelope envelope) {
        ObjectNode root = NODES.objectNode();
        for (Map.Entry<String, JsonNode> extra : envelope.extensions().entrySet()) {
            if (!EnvelopeValidator.KNOWN_FIELDS.contains(extra.getKey())) {
                root.set(extra.getKey(), extra.getValue().deepCopy());
            }
        }
        root.put("id", envelope.id());
        putIfPresent(root, "correlationId", envelope.correlationId());
        putIfPresent(root, "traceId", envelope.traceId());
        putIfPresent(root, "spanId", envelope.spanId());
        root.put("sender", envelope.sender());
        root.put("recipient", envelope.recipient());
        root.put("messageType", envelope.messageType() == null ? null : envelope.messageType().name());
        if (envelope.payload() != null) {
            root.set("payload", envelope.payload().deepCopy());
        }
        root.set("delivery", delivery(envelope.delivery()));
        root.set("context", context(envelope.context()));
        if (envelope.createdAt() != null) {
            root.put("createdAt", envelope.createdAt().toEpochMilli());
        }
        root.set("permissions", textArray(envelope.permissions()));
        root.set("tags", textArray(envelope.tags()));
        return root;
    }

    private static ObjectNode delivery(DeliveryPolicy policy) {
        ObjectNode node = NODES.objectNode();
        node.put("guarantee", policy.guarantee().name());
        node.put("retryCount", policy.retryCount());
        node.put("retryDelayMs", policy.retryDelayMs());
        node.put("requireAck", policy.requireAck());
        node.put("priority", policy.priority());
        return node;
    }

    private static ObjectNode context(PropagationContext context) {
        ObjectNode node = NODES.objectNode();
        putIfPresent(node, "traceId", context.traceId());
        putIfPresent(node, "spanId", context.spanId());
        node.set("baggage", textMap(context.baggage()));
        putIfPresent(node, "requestId", context.requestId());
        if (context.timeoutMs() != null) {
            node.put("timeoutMs", context.timeoutMs());
        }
        node.set("metadata", textMap(context.metadata()));
        return node;
    }

    private static ObjectNode textMap(Map<String, String> values) {
        ObjectNode node = NODES.objectNode();
        values.forEach(node::put);
        return node;
    }

    private static ArrayNode textArray(List<String> values) {
        ArrayNode node = NODES.arrayNode();
        values.forEach(node::add);
        return node;
    }

    private static void putIfPresent(ObjectNode node, String field, String value) {
        if (value != null) {
            node.put(field, value);
        }
    }
}
