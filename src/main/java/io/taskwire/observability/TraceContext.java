package io.taskwire.observability;

import org.slf4j.MDC;

import java.security.SecureRandom;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Thread-bound trace state. Crosses the transport boundary as a W3C {@code traceparent} entry
 * in the envelope baggage and is mirrored into the logging MDC while active.
 */
public record TraceContext(String traceId, String spanId, Map<String, String> baggage) {
    public static final String TRACEPARENT = "traceparent";
    public static final String MDC_TRACE_ID = "traceId";
    public static final String MDC_SPAN_ID = "spanId";

    private static final SecureRandom RANDOM = new SecureRandom();
    private static final ThreadLocal<TraceContext> CURRENT = new ThreadLocal<>();

    public TraceContext {
        baggage = baggage == null ? Map.of() : Map.copyOf(baggage);
    }

    public static TraceContext newRoot() {
        return new TraceContext(newTraceId(), newSpanId(), Map.of());
    }

    public static Optional<TraceContext> current() {
        return Optional.ofNullable(CURRENT.get());
    }

    /**
     * Child of the active context, or a new root when nothing is active.
     */
    public static TraceContext childOfCurrent() {
        return current().map(TraceContext::child).orElseGet(TraceContext::newRoot);
    }

    public TraceContext child() {
        return new TraceContext(traceId, newSpanId(), baggage);
    }

    public static String newTraceId() {
        return randomHex(16); // 16 bytes => 32 hex chars
    }

    public static String newSpanId() {
        return randomHex(8); // 8 bytes => 16 hex chars
    }

    public static String toTraceParent(String traceId, String spanId) {
        return "00-" + traceId + "-" + spanId + "-01";
    }

    /**
     * Writes this context into a carrier map: the baggage entries plus {@code traceparent}.
     */
    public Map<String, String> inject() {
        Map<String, String> carrier = new LinkedHashMap<>(baggage);
        carrier.put(TRACEPARENT, toTraceParent(traceId, spanId));
        return carrier;
    }

    public static Optional<TraceContext> extract(Map<String, String> carrier) {
        if (carrier == null || carrier.isEmpty()) {
            return Optional.empty();
        }
        String header = carrier.get(TRACEPARENT);
        if (header == null) {
            return Optional.empty();
        }
        String[] parts = header.trim().split("-");
        if (parts.length != 4 || parts[1].length() != 32 || parts[2].length() != 16) {
            return Optional.empty();
        }
        Map<String, String> baggage = new HashMap<>(carrier);
        baggage.remove(TRACEPARENT);
        return Optional.of(new TraceContext(parts[1], parts[2], baggage));
    }

    public Scope activate() {
        TraceContext previous = CURRENT.get();
        String previousTrace = MDC.get(MDC_TRACE_ID);
        String previousSpan = MDC.get(MDC_SPAN_ID);
        CURRENT.set(this);
        MDC.put(MDC_TRACE_ID, traceId);
        MDC.put(MDC_SPAN_ID, spanId);
        return () -> {
            if (previous == null) {
                CURRENT.remove();
            } else {
                CURRENT.set(previous);
            }
            restore(MDC_TRACE_ID, previousTrace);
            restore(MDC_SPAN_ID, previousSpan);
        };
    }

    /**
     * Captures the trace context and MDC of the calling thread so they can be re-activated on
     * whichever thread later runs a handler.
     */
    public static Captured capture() {
        return new Captured(CURRENT.get(), MDC.getCopyOfContextMap());
    }

    private static void restore(String key, String previousValue) {
        if (previousValue == null) {
            MDC.remove(key);
        } else {
            MDC.put(key, previousValue);
        }
    }

    private static String randomHex(int bytes) {
        byte[] value = new byte[bytes];
        RANDOM.nextBytes(value);
        StringBuilder sb = new StringBuilder(bytes * 2);
        for (byte b : value) {
            sb.append(String.format("%02x", b));
        }
        return sb.toString();
    }

    @FunctionalInterface
    public interface Scope extends AutoCloseable {
        @Override
        void close();

        static Scope noop() {
            return () -> {
            };
        }
    }

    public record Captured(TraceContext trace, Map<String, String> mdc) {
        public Scope activate() {
            TraceContext previous = CURRENT.get();
            Map<String, String> previousMdc = MDC.getCopyOfContextMap();
            if (trace == null) {
                CURRENT.remove();
            } else {
                CURRENT.set(trace);
            }
            if (mdc == null) {
                MDC.clear();
            } else {
                MDC.setContextMap(mdc);
            }
            return () -> {
                if (previous == null) {
                    CURRENT.remove();
                } else {
                    CURRENT.set(previous);
                }
                if (previousMdc == null) {
                    MDC.clear();
                } else {
                    MDC.setContextMap(previousMdc);
                }
            };
        }
    }
}
