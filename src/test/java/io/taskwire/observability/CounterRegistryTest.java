package io.taskwire.observability;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.Map;

final class CounterRegistryTest {

    @Test
    void countsPerLabelSetAndRendersPrometheusText() {
        CounterRegistry counters = new CounterRegistry();
        counters.dropped("duplicate");
        counters.dropped("duplicate");
        counters.dropped("no_handler");
        counters.increment(TransportMetrics.TASK_TIMEOUT);

        Assertions.assertEquals(2L, counters.count(TransportMetrics.MESSAGE_DROPPED, Map.of("reason", "duplicate")));
        Assertions.assertEquals(3L, counters.total(TransportMetrics.MESSAGE_DROPPED));

        String text = counters.prometheusText();
        Assertions.assertTrue(text.contains("# TYPE taskwire_message_dropped_total counter"), text);
        Assertions.assertTrue(text.contains("taskwire_message_dropped_total{reason=\"duplicate\"} 2"), text);
        Assertions.assertTrue(text.contains("taskwire_task_timeout_total 1"), text);
    }
}
