package io.taskwire.model;

import java.util.Map;

/**
 * Tracing state carried across the transport boundary. {@code baggage} is the opaque carrier
 * written by the propagator; {@code metadata} is free-form.
 */
public record PropagationContext(
        String traceId,
        String spanId,
        Map<String, String> baggage,
        String requestId,
        Long timeoutMs,
        Map<String, String> metadata
) {
    public PropagationContext {
        baggage = baggage == null ? Map.of() : Map.copyOf(baggage);
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static PropagationContext empty() {
        return new PropagationContext(null, null, Map.of(), null, null, Map.of());
    }
}
