package io.taskwire.envelope;

import com.fasterxml.jackson.databind.JsonNode;
import io.taskwire.model.DeliveryPolicy;
import io.taskwire.model.MessageEnvelope;
import io.taskwire.model.MessageType;
import io.taskwire.model.PropagationContext;
import io.taskwire.model.TaskRequest;
import io.taskwire.model.TaskResponse;
import io.taskwire.observability.TraceContext;
import io.taskwire.util.Jsons;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Factories for envelopes built at call time. Each one gets a fresh id and carries the active
 * trace context (or a new root) in its propagation baggage.
 */
public final class Envelopes {
    private Envelopes() {
    }

    public static MessageEnvelope create(MessageType type, String sender, String recipient, JsonNode payload) {
        TraceContext trace = TraceContext.childOfCurrent();
        return new MessageEnvelope(
                newId(),
                null,
                trace.traceId(),
                trace.spanId(),
                sender,
                recipient,
                type,
                payload,
                DeliveryPolicy.defaults(),
                new PropagationContext(trace.traceId(), trace.spanId(), trace.inject(), null, null, Map.of()),
                now(),
                List.of(),
                List.of(),
                Map.of()
        );
    }

    public static MessageEnvelope taskRequest(TaskRequest request, String sender, String recipient, long timeoutMs) {
        TraceContext trace = TraceContext.childOfCurrent();
        return new MessageEnvelope(
                newId(),
                request.taskId(),
                trace.traceId(),
                trace.spanId(),
                sender,
                recipient,
                MessageType.TASK_REQUEST,
                Jsons.toTree(request),
                DeliveryPolicy.forTaskRequest(request.priority()),
                new PropagationContext(
                        trace.traceId(),
                        trace.spanId(),
                        trace.inject(),
                        request.taskId(),
                        timeoutMs,
                        request.metadata()
                ),
                now(),
                List.of(),
                List.of(),
                Map.of()
        );
    }

    /**
     * Reply to {@code request}, addressed back to its sender under the request's correlation id.
     */
    public static MessageEnvelope taskResponse(MessageEnvelope request, String sender, TaskResponse response) {
        String correlationId = request.correlationId() == null ? request.id() : request.correlationId();
        TraceContext trace = TraceContext.extract(request.context().baggage())
                .map(TraceContext::child)
                .orElseGet(TraceContext::childOfCurrent);
        return new MessageEnvelope(
                newId(),
                correlationId,
                trace.traceId(),
                trace.spanId(),
                sender,
                request.sender(),
                MessageType.TASK_RESPONSE,
                Jsons.toTree(response),
                new DeliveryPolicy(
                        request.delivery().guarantee(),
                        0,
                        0L,
                        false,
                        request.delivery().priority()
                ),
                new PropagationContext(
                        trace.traceId(),
                        trace.spanId(),
                        trace.inject(),
                        correlationId,
                        null,
                        Map.of()
                ),
                now(),
                request.permissions(),
                List.of(),
                Map.of()
        );
    }

    public static String newId() {
        return UUID.randomUUID().toString();
    }

    private static Instant now() {
        return Instant.ofEpochMilli(System.currentTimeMillis());
    }
}
