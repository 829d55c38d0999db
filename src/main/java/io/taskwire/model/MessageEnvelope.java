package io.taskwire.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Unit of transport. Immutable once built; {@code extensions} holds top-level wire fields this
 * version does not interpret so they survive a pass through the transport.
 */
public record MessageEnvelope(
        String id,
        String correlationId,
        String traceId,
        String spanId,
        String sender,
        String recipient,
        MessageType messageType,
        JsonNode payload,
        DeliveryPolicy delivery,
        PropagationContext context,
        Instant createdAt,
        List<String> permissions,
        List<String> tags,
        Map<String, JsonNode> extensions
) {
    public MessageEnvelope {
        delivery = delivery == null ? DeliveryPolicy.defaults() : delivery;
        context = context == null ? PropagationContext.empty() : context;
        permissions = permissions == null ? List.of() : List.copyOf(permissions);
        tags = tags == null ? List.of() : List.copyOf(tags);
        extensions = extensions == null ? Map.of() : Map.copyOf(extensions);
    }

    public MessageEnvelope withId(String newId) {
        return new MessageEnvelope(newId, correlationId, traceId, spanId, sender, recipient, messageType,
                payload, delivery, context, createdAt, permissions, tags, extensions);
    }

    public MessageEnvelope withRecipient(String newRecipient) {
        return new MessageEnvelope(id, correlationId, traceId, spanId, sender, newRecipient, messageType,
                payload, delivery, context, createdAt, permissions, tags, extensions);
    }
}
