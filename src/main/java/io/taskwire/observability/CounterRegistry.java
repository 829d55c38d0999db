package io.taskwire.observability;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory counters with Prometheus text rendering.
 */
public final class CounterRegistry implements TransportMetrics {
    private static final String PREFIX = "taskwire_";

    private final ConcurrentMap<CounterKey, AtomicLong> counters = new ConcurrentHashMap<>();

    @Override
    public void increment(String name, Map<String, String> labels) {
        CounterKey key = new CounterKey(name, labels == null ? Map.of() : new TreeMap<>(labels));
        counters.computeIfAbsent(key, ignored -> new AtomicLong(0L)).incrementAndGet();
    }

    public long count(String name, Map<String, String> labels) {
        AtomicLong value = counters.get(new CounterKey(name, new TreeMap<>(labels)));
        return value == null ? 0L : value.get();
    }

    public long count(String name) {
        return count(name, Map.of());
    }

    /**
     * Sum over every label combination of {@code name}.
     */
    public long total(String name) {
        long sum = 0L;
        for (Map.Entry<CounterKey, AtomicLong> e : counters.entrySet()) {
            if (e.getKey().name().equals(name)) {
                sum += e.getValue().get();
            }
        }
        return sum;
    }

    public String prometheusText() {
        List<Map.Entry<CounterKey, AtomicLong>> rows = new ArrayList<>(counters.entrySet());
        rows.sort(Comparator.comparing((Map.Entry<CounterKey, AtomicLong> e) -> e.getKey().name())
                .thenComparing(e -> e.getKey().labels().toString()));
        StringBuilder sb = new StringBuilder();
        String lastMetric = null;
        for (Map.Entry<CounterKey, AtomicLong> row : rows) {
            String metric = PREFIX + row.getKey().name() + "_total";
            if (!metric.equals(lastMetric)) {
                sb.append("# HELP ").append(metric).append(' ').append(row.getKey().name()).append(" events").append('\n');
                sb.append("# TYPE ").append(metric).append(" counter").append('\n');
                lastMetric = metric;
            }
            sb.append(metric);
            Map<String, String> labels = row.getKey().labels();
            if (!labels.isEmpty()) {
                sb.append('{');
                boolean first = true;
                for (Map.Entry<String, String> label : labels.entrySet()) {
                    if (!first) {
                        sb.append(',');
                    }
                    sb.append(label.getKey()).append("=\"").append(escapeLabel(label.getValue())).append('"');
                    first = false;
                }
                sb.append('}');
            }
            sb.append(' ').append(row.getValue().get()).append('\n');
        }
        return sb.toString();
    }

    private static String escapeLabel(String v) {
        return v == null ? "" : v.replace("\\", "\\\\").replace("\"", "\\\"");
    }

    private record CounterKey(String name, Map<String, String> labels) {
    }
}
