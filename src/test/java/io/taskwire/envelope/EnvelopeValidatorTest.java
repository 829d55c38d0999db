package io.taskwire.envelope;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.taskwire.model.DeliveryGuarantee;
import io.taskwire.model.MessageEnvelope;
import io.taskwire.model.MessageType;
import io.taskwire.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

final class EnvelopeValidatorTest {
    private final EnvelopeValidator validator = new EnvelopeValidator();

    @Test
    void acceptsMinimalEnvelopeWithDefaults() throws Exception {
        JsonNode raw = Jsons.mapper().readTree("""
                {"id":"m-1","sender":"router","recipient":"echo","messageType":"TASK_REQUEST","payload":{"value":42}}
                """);

        MessageEnvelope envelope = validator.validate(raw);

        Assertions.assertEquals("m-1", envelope.id());
        Assertions.assertEquals(MessageType.TASK_REQUEST, envelope.messageType());
        Assertions.assertEquals(DeliveryGuarantee.AT_LEAST_ONCE, envelope.delivery().guarantee());
        Assertions.assertEquals(5, envelope.delivery().priority());
        Assertions.assertEquals(42, envelope.payload().path("value").asInt());
        Assertions.assertTrue(envelope.permissions().isEmpty());
        Assertions.assertNull(envelope.createdAt());
    }

    @Test
    void collectsEveryOffendingField() throws Exception {
        JsonNode raw = Jsons.mapper().readTree("""
                {"id":"","sender":7,"messageType":"BOGUS","tags":"not-a-list","delivery":{"guarantee":"SOMETIMES"}}
                """);

        ValidationException error = Assertions.assertThrows(ValidationException.class, () -> validator.validate(raw));

        Assertions.assertTrue(error.fields().containsAll(
                List.of("id", "sender", "recipient", "messageType", "tags", "delivery.guarantee")),
                "fields=" + error.fields());
    }

    @Test
    void rejectsNonObjectRoot() throws Exception {
        ValidationException error = Assertions.assertThrows(
                ValidationException.class,
                () -> validator.validate(Jsons.mapper().readTree("[1,2]"))
        );
        Assertions.assertEquals(List.of("<root>"), error.fields());
    }

    @Test
    void keepsUnknownFieldsAsExtensions() throws Exception {
        JsonNode raw = Jsons.mapper().readTree("""
                {"id":"m-2","sender":"a","recipient":"b","messageType":"PING","x-route":{"hop":3}}
                """);

        MessageEnvelope envelope = validator.validate(raw);

        Assertions.assertEquals(3, envelope.extensions().get("x-route").path("hop").asInt());
        Assertions.assertEquals(3, EnvelopeWriter.toTree(envelope).path("x-route").path("hop").asInt());
    }

    @Test
    void validationIsIdempotentAndLeavesInputUntouched() throws Exception {
        ObjectNode raw = (ObjectNode) Jsons.mapper().readTree("""
                {
                  "id":"m-3",
                  "correlationId":"task-3",
                  "sender":"router",
                  "recipient":"echo",
                  "messageType":"TASK_RESPONSE",
                  "payload":{"nested":{"list":[1,2,3]}},
                  "delivery":{"guarantee":"EXACTLY_ONCE","retryCount":2,"retryDelayMs":500,"requireAck":true,"priority":9},
                  "context":{"traceId":"t","baggage":{"traceparent":"00-aa-bb-01"},"timeoutMs":1500,"metadata":{"k":"v"}},
                  "createdAt":"2024-05-01T10:15:30.123456Z",
                  "permissions":["task:run"],
                  "tags":["blue"]
                }
                """);
        JsonNode before = raw.deepCopy();

        MessageEnvelope first = validator.validate(raw);
        MessageEnvelope second = validator.validate(EnvelopeWriter.toTree(first));

        Assertions.assertEquals(first, second);
        Assertions.assertEquals(before, raw);
        Assertions.assertEquals(Instant.parse("2024-05-01T10:15:30.123Z"), first.createdAt());
        Assertions.assertEquals(1500L, first.context().timeoutMs());
    }

    @Test
    void typedEnvelopeMissingRecipientIsRejected() {
        MessageEnvelope envelope = Envelopes.create(MessageType.TASK_REQUEST, "router", "echo", null)
                .withRecipient(" ");

        ValidationException error = Assertions.assertThrows(ValidationException.class, () -> validator.validate(envelope));
        Assertions.assertEquals(List.of("recipient"), error.fields());
    }

    @Test
    void factoryEnvelopesCarryTraceparentBaggage() {
        MessageEnvelope envelope = Envelopes.create(MessageType.TASK_REQUEST, "router", "echo", null);

        Assertions.assertSame(envelope, validator.validate(envelope));
        String traceparent = envelope.context().baggage().get("traceparent");
        Assertions.assertNotNull(traceparent);
        Assertions.assertTrue(traceparent.contains(envelope.traceId()));
    }
}
