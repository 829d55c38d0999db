package io.taskwire.transport.local;

import com.fasterxml.jackson.databind.JsonNode;
import io.taskwire.config.TaskWireConfig;
import io.taskwire.envelope.EnvelopeValidator;
import io.taskwire.model.MessageEnvelope;
import io.taskwire.observability.TraceContext;
import io.taskwire.observability.TransportMetrics;
import io.taskwire.transport.DeliveryException;
import io.taskwire.transport.MessageHandler;
import io.taskwire.transport.Subscription;
import io.taskwire.transport.Transport;
import io.taskwire.util.Threads;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * Publish/subscribe bus for senders and recipients that share a JVM.
 *
 * <p>Delivery is FIFO per recipient. {@link #publish} delivers on the calling thread unless
 * another thread is already draining that recipient, in which case the draining thread delivers
 * it in order. {@link #send} always hands delivery to the transport's executor. Both are bounded
 * by {@code maxQueueSize} per recipient.
 */
public final class InProcessTransport implements Transport {
    private static final Logger log = LoggerFactory.getLogger(InProcessTransport.class);

    private final ConcurrentMap<String, RecipientChannel> channels = new ConcurrentHashMap<>();
    private final EnvelopeValidator validator = new EnvelopeValidator();
    private final DeduplicationCache dedup;
    private final TransportMetrics metrics;
    private final int maxQueueSize;
    private final ExecutorService deliveryExecutor;
    private final ScheduledExecutorService sweeper;
    private volatile boolean disposed;

    public InProcessTransport(TaskWireConfig config, TransportMetrics metrics) {
        this(config, metrics, System::currentTimeMillis);
    }

    public InProcessTransport(TaskWireConfig config, TransportMetrics metrics, LongSupplier clock) {
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.maxQueueSize = config.maxQueueSize();
        this.dedup = new DeduplicationCache(config.dedupWindowMs(), config.dedupMaxEntries(), clock);
        this.deliveryExecutor = Executors.newCachedThreadPool(Threads.daemon("taskwire-local-delivery"));
        this.sweeper = Executors.newSingleThreadScheduledExecutor(Threads.daemon("taskwire-dedup-sweep"));
        long sweepInterval = Math.max(1_000L, Math.min(config.dedupWindowMs(), 30_000L));
        this.sweeper.scheduleWithFixedDelay(this::sweepDedup, sweepInterval, sweepInterval, TimeUnit.MILLISECONDS);
    }

    /**
     * Validates a raw wire tree and publishes it.
     */
    public void publish(JsonNode raw) {
        publish(validator.validate(raw));
    }

    public void publish(MessageEnvelope envelope) {
        RecipientChannel channel = accept(envelope);
        if (channel != null) {
            channel.drain(this::deliver);
        }
    }

    @Override
    public void send(MessageEnvelope envelope) {
        RecipientChannel channel = accept(envelope);
        if (channel == null) {
            return;
        }
        try {
            deliveryExecutor.execute(() -> channel.drain(this::deliver));
        } catch (RejectedExecutionException e) {
            throw new IllegalStateException("Transport is disposed", e);
        }
    }

    @Override
    public Subscription subscribe(String recipient, MessageHandler handler) {
        if (recipient == null || recipient.isBlank()) {
            throw new IllegalArgumentException("recipient cannot be empty");
        }
        Objects.requireNonNull(handler, "handler");
        ensureOpen();
        RecipientChannel channel = channels.computeIfAbsent(recipient, r -> new RecipientChannel(r, maxQueueSize));
        RecipientChannel.Registration registration = channel.add(handler);
        log.debug("Subscribed handler recipient={}", recipient);
        return () -> {
            if (channel.remove(registration)) {
                log.debug("Unsubscribed handler recipient={}", recipient);
            }
        };
    }

    public int queueDepth(String recipient) {
        RecipientChannel channel = channels.get(recipient);
        return channel == null ? 0 : channel.depth();
    }

    public int subscriberCount(String recipient) {
        RecipientChannel channel = channels.get(recipient);
        return channel == null ? 0 : channel.handlers().size();
    }

    public void dispose() {
        if (disposed) {
            return;
        }
        disposed = true;
        for (RecipientChannel channel : channels.values()) {
            channel.clear();
        }
        channels.clear();
        dedup.clear();
        sweeper.shutdownNow();
        deliveryExecutor.shutdown();
        log.info("In-process transport disposed");
    }

    @Override
    public void close() {
        dispose();
    }

    private RecipientChannel accept(MessageEnvelope envelope) {
        MessageEnvelope valid = validator.validate(envelope);
        ensureOpen();
        if (!dedup.register(valid.id())) {
            metrics.dropped("duplicate");
            log.debug("Dropped duplicate message id={} recipient={}", valid.id(), valid.recipient());
            return null;
        }
        RecipientChannel channel = channels.get(valid.recipient());
        if (channel == null || !channel.hasHandlers()) {
            metrics.dropped("no_handler");
            log.debug("Dropped message without handler id={} recipient={}", valid.id(), valid.recipient());
            return null;
        }
        try {
            channel.offer(valid, TraceContext.capture());
        } catch (RuntimeException e) {
            // Rejected envelopes may be retried under the same id.
            dedup.forget(valid.id());
            metrics.dropped("queue_full");
            throw e;
        }
        metrics.increment(TransportMetrics.MESSAGE_SENT, Map.of("type", valid.messageType().name()));
        return channel;
    }

    private void deliver(RecipientChannel channel, MessageEnvelope envelope, TraceContext.Captured captured) {
        for (RecipientChannel.Registration registration : channel.handlers()) {
            try (TraceContext.Scope ignored = captured.activate()) {
                try {
                    registration.handler().onMessage(envelope);
                } catch (Exception e) {
                    DeliveryException failure = new DeliveryException(channel.recipient(), envelope.id(), e);
                    metrics.increment(TransportMetrics.MESSAGE_ERROR, Map.of("reason", "handler_failed"));
                    log.warn("{}", failure.getMessage(), failure);
                }
            }
        }
    }

    private void sweepDedup() {
        try {
            int evicted = dedup.sweep();
            if (evicted > 0) {
                log.debug("Dedup sweep evicted={} remaining={}", evicted, dedup.size());
            }
        } catch (RuntimeException e) {
            log.warn("Dedup sweep failed", e);
        }
    }

    private void ensureOpen() {
        if (disposed) {
            throw new IllegalStateException("Transport is disposed");
        }
    }
}
