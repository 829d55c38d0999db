package io.taskwire.envelope;

import com.fasterxml.jackson.databind.JsonNode;
import io.taskwire.model.DeliveryGuarantee;
import io.taskwire.model.DeliveryPolicy;
import io.taskwire.model.MessageEnvelope;
import io.taskwire.model.MessageType;
import io.taskwire.model.PropagationContext;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns raw wire trees into envelopes. Every problem is collected before throwing so the
 * caller gets the complete list of offending fields.
 */
public final class EnvelopeValidator {
    static final Set<String> KNOWN_FIELDS = Set.of(
            "id", "correlationId", "traceId", "spanId", "sender", "recipient", "messageType",
            "payload", "delivery", "context", "createdAt", "permissions", "tags"
    );

    public MessageEnvelope validate(JsonNode raw) {
        if (raw == null || !raw.isObject()) {
            throw new ValidationException(List.of("<root>"));
        }
        List<String> errors = new ArrayList<>();
        String id = requiredText(raw, "id", errors);
        String sender = requiredText(raw, "sender", errors);
        String recipient = requiredText(raw, "recipient", errors);
        MessageType messageType = messageType(raw, errors);
        String correlationId = optionalText(raw, "correlationId", errors);
        String traceId = optionalText(raw, "traceId", errors);
        String spanId = optionalText(raw, "spanId", errors);
        DeliveryPolicy delivery = delivery(raw.get("delivery"), errors);
        PropagationContext context = context(raw.get("context"), errors);
        Instant createdAt = createdAt(raw.get("createdAt"), errors);
        List<String> permissions = textList(raw, "permissions", errors);
        List<String> tags = textList(raw, "tags", errors);
        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }
        JsonNode payload = raw.get("payload");
        return new MessageEnvelope(
                id,
                correlationId,
                traceId,
                spanId,
                sender,
                recipient,
                messageType,
                payload == null || payload.isNull() ? null : payload.deepCopy(),
                delivery,
                context,
                createdAt,
                permissions,
                tags,
                extensions(raw)
        );
    }

    /**
     * Re-checks an envelope built in code. Returns the same instance when it is well formed.
     */
    public MessageEnvelope validate(MessageEnvelope envelope) {
        if (envelope == null) {
            throw new ValidationException(List.of("<root>"));
        }
        List<String> errors = new ArrayList<>();
        if (isBlank(envelope.id())) {
            errors.add("id");
        }
        if (isBlank(envelope.sender())) {
            errors.add("sender");
        }
        if (isBlank(envelope.recipient())) {
            errors.add("recipient");
        }
        if (envelope.messageType() == null) {
            errors.add("messageType");
        }
        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }
        return envelope;
    }

    private static String requiredText(JsonNode raw, String field, List<String> errors) {
        JsonNode node = raw.get(field);
        if (node == null || !node.isTextual() || node.asText().isBlank()) {
            errors.add(field);
            return null;
        }
        return node.asText();
    }

    private static String optionalText(JsonNode raw, String field, List<String> errors) {
        JsonNode node = raw.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isTextual()) {
            errors.add(field);
            return null;
        }
        return node.asText();
    }

    private static MessageType messageType(JsonNode raw, List<String> errors) {
        String value = requiredText(raw, "messageType", errors);
        if (value == null) {
            return null;
        }
        try {
            return MessageType.fromString(value);
        } catch (IllegalArgumentException e) {
            errors.add("messageType");
            return null;
        }
    }

    private static DeliveryPolicy delivery(JsonNode node, List<String> errors) {
        if (node == null || node.isNull()) {
            return DeliveryPolicy.defaults();
        }
        if (!node.isObject()) {
            errors.add("delivery");
            return null;
        }
        DeliveryGuarantee guarantee;
        JsonNode rawGuarantee = node.get("guarantee");
        try {
            guarantee = DeliveryGuarantee.fromString(rawGuarantee == null || rawGuarantee.isNull() ? null : rawGuarantee.asText());
        } catch (IllegalArgumentException e) {
            errors.add("delivery.guarantee");
            return null;
        }
        DeliveryPolicy defaults = DeliveryPolicy.defaults();
        return new DeliveryPolicy(
                guarantee,
                node.path("retryCount").asInt(defaults.retryCount()),
                node.path("retryDelayMs").asLong(defaults.retryDelayMs()),
                node.path("requireAck").asBoolean(defaults.requireAck()),
                node.path("priority").asInt(defaults.priority())
        );
    }

    private static PropagationContext context(JsonNode node, List<String> errors) {
        if (node == null || node.isNull()) {
            return PropagationContext.empty();
        }
        if (!node.isObject()) {
            errors.add("context");
            return null;
        }
        JsonNode timeout = node.get("timeoutMs");
        return new PropagationContext(
                textOrNull(node.get("traceId")),
                textOrNull(node.get("spanId")),
                stringMap(node.get("baggage"), "context.baggage", errors),
                textOrNull(node.get("requestId")),
                timeout == null || !timeout.canConvertToLong() ? null : timeout.asLong(),
                stringMap(node.get("metadata"), "context.metadata", errors)
        );
    }

    private static Instant createdAt(JsonNode node, List<String> errors) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isIntegralNumber()) {
            return Instant.ofEpochMilli(node.asLong());
        }
        if (node.isTextual()) {
            try {
                return Instant.parse(node.asText()).truncatedTo(ChronoUnit.MILLIS);
            } catch (DateTimeParseException e) {
                errors.add("createdAt");
                return null;
            }
        }
        errors.add("createdAt");
        return null;
    }

    private static List<String> textList(JsonNode raw, String field, List<String> errors) {
        JsonNode node = raw.get(field);
        if (node == null || node.isNull()) {
            return List.of();
        }
        if (!node.isArray()) {
            errors.add(field);
            return List.of();
        }
        List<String> values = new ArrayList<>(node.size());
        for (JsonNode item : node) {
            if (!item.isTextual()) {
                errors.add(field);
                return List.of();
            }
            values.add(item.asText());
        }
        return values;
    }

    private static Map<String, String> stringMap(JsonNode node, String field, List<String> errors) {
        if (node == null || node.isNull()) {
            return Map.of();
        }
        if (!node.isObject()) {
            errors.add(field);
            return Map.of();
        }
        Map<String, String> values = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = node.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            if (!entry.getValue().isNull()) {
                values.put(entry.getKey(), entry.getValue().asText());
            }
        }
        return values;
    }

    private static Map<String, JsonNode> extensions(JsonNode raw) {
        Map<String, JsonNode> extras = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = raw.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            if (!KNOWN_FIELDS.contains(entry.getKey())) {
                extras.put(entry.getKey(), entry.getValue().deepCopy());
            }
        }
        return extras;
    }

    private static String textOrNull(JsonNode node) {
        return node == null || node.isNull() ? null : node.asText();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
