package io.taskwire.observability;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.Map;

final class TraceContextTest {

    @Test
    void injectThenExtractKeepsTraceAndBaggage() {
        TraceContext root = new TraceContext(TraceContext.newTraceId(), TraceContext.newSpanId(), Map.of("tenant", "acme"));

        TraceContext extracted = TraceContext.extract(root.inject()).orElseThrow();

        Assertions.assertEquals(root, extracted);
    }

    @Test
    void malformedTraceparentIsIgnored() {
        Assertions.assertTrue(TraceContext.extract(Map.of(TraceContext.TRACEPARENT, "00-short-id-01")).isEmpty());
        Assertions.assertTrue(TraceContext.extract(Map.of()).isEmpty());
    }

    @Test
    void activationRestoresPreviousState() {
        TraceContext outer = TraceContext.newRoot();
        TraceContext inner = outer.child();
        try (TraceContext.Scope ignoredOuter = outer.activate()) {
            try (TraceContext.Scope ignoredInner = inner.activate()) {
                Assertions.assertEquals(inner.spanId(), MDC.get(TraceContext.MDC_SPAN_ID));
                Assertions.assertEquals(outer.traceId(), TraceContext.childOfCurrent().traceId());
            }
            Assertions.assertEquals(outer, TraceContext.current().orElseThrow());
            Assertions.assertEquals(outer.spanId(), MDC.get(TraceContext.MDC_SPAN_ID));
        }
        Assertions.assertTrue(TraceContext.current().isEmpty());
        Assertions.assertNull(MDC.get(TraceContext.MDC_TRACE_ID));
    }
}
