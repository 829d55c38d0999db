package io.taskwire.transport.socket;

import com.fasterxml.jackson.databind.JsonNode;
import io.taskwire.config.TaskWireConfig;
import io.taskwire.envelope.EnvelopeValidator;
import io.taskwire.envelope.EnvelopeWriter;
import io.taskwire.envelope.ValidationException;
import io.taskwire.model.MessageEnvelope;
import io.taskwire.model.MessageType;
import io.taskwire.observability.TraceContext;
import io.taskwire.observability.TransportMetrics;
import io.taskwire.transport.MessageHandler;
import io.taskwire.transport.Subscription;
import io.taskwire.transport.Transport;
import io.taskwire.transport.TransportException;
import io.taskwire.util.Threads;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.StandardProtocolFamily;
import java.net.UnixDomainSocketAddress;
import java.nio.channels.SocketChannel;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Dials a {@link UnixSocketServer}. {@link #connect()} completes once the server acknowledges
 * {@code HELLO}; messages are written directly, with no buffering or retry.
 */
public final class UnixSocketClient implements Transport {
    private static final Logger log = LoggerFactory.getLogger(UnixSocketClient.class);

    private final TaskWireConfig config;
    private final String clientId;
    private final TransportMetrics metrics;
    private final FrameCodec codec;
    private final EnvelopeValidator validator = new EnvelopeValidator();
    private final CopyOnWriteArrayList<MessageHandler> listeners = new CopyOnWriteArrayList<>();
    private final CopyOnWriteArrayList<Consumer<JsonNode>> errorListeners = new CopyOnWriteArrayList<>();
    private final ScheduledExecutorService timers;
    private final ExecutorService reader;
    private final ExecutorService writer;
    private volatile SocketConnection connection;
    private volatile CompletableFuture<Void> connected;
    private volatile boolean closed;

    public UnixSocketClient(TaskWireConfig config, String clientId, TransportMetrics metrics) {
        if (clientId == null || clientId.isBlank()) {
            throw new IllegalArgumentException("clientId cannot be empty");
        }
        this.config = Objects.requireNonNull(config, "config");
        this.clientId = clientId;
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.codec = new FrameCodec(config.maxFrameSize());
        this.timers = Executors.newSingleThreadScheduledExecutor(Threads.daemon("taskwire-client-timer"));
        this.reader = Executors.newSingleThreadExecutor(Threads.daemon("taskwire-client-reader"));
        this.writer = Executors.newSingleThreadExecutor(Threads.daemon("taskwire-client-writer"));
    }

    /**
     * Opens the socket and sends {@code HELLO}. The future fails with {@link NoAckException}
     * when no {@code ACK} arrives within the handshake timeout, or with
     * {@link HandshakeTimeoutException} when the server gives up first.
     */
    public synchronized CompletableFuture<Void> connect() {
        if (connected != null) {
            return connected;
        }
        CompletableFuture<Void> future = new CompletableFuture<>();
        connected = future;
        if (closed) {
            future.completeExceptionally(new IllegalStateException("Client is closed"));
            return future;
        }
        SocketChannel channel;
        try {
            channel = SocketChannel.open(StandardProtocolFamily.UNIX);
            channel.connect(UnixDomainSocketAddress.of(config.socketPath()));
        } catch (IOException e) {
            future.completeExceptionally(new TransportException("Failed to connect to " + config.socketPath(), e));
            return future;
        }
        SocketConnection conn = new SocketConnection(clientId, channel, writer, this::writeFailed);
        connection = conn;
        conn.handshakeTimer(timers.schedule(this::ackExpired, config.handshakeTimeoutMs(), TimeUnit.MILLISECONDS));
        reader.execute(() -> readLoop(conn));
        if (!conn.enqueue(codec.encode(ControlRecords.hello(clientId)))) {
            fail(new TransportException("Failed to send HELLO to " + config.socketPath()));
        }
        return future;
    }

    public boolean isConnected() {
        SocketConnection conn = connection;
        return conn != null && conn.isOpen() && conn.isHandshakeComplete();
    }

    public Optional<SocketConnection.Stats> stats() {
        SocketConnection conn = connection;
        return conn == null ? Optional.empty() : Optional.of(conn.stats());
    }

    @Override
    public void send(MessageEnvelope envelope) {
        MessageEnvelope valid = validator.validate(envelope);
        SocketConnection conn = connection;
        if (conn == null || !conn.isOpen() || !conn.isHandshakeComplete()) {
            throw new TransportException("Client is not connected: " + config.socketPath());
        }
        if (!conn.enqueue(codec.encode(EnvelopeWriter.toTree(valid)))) {
            metrics.dropped("outbox_full");
            throw new TransportException("Failed to send message " + valid.id() + " to " + config.socketPath());
        }
        metrics.increment(TransportMetrics.MESSAGE_SENT, Map.of("type", valid.messageType().name()));
    }

    public Subscription onMessage(MessageHandler listener) {
        Objects.requireNonNull(listener, "listener");
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    /**
     * Error records reported by the server after the handshake, such as {@code invalid_message}.
     */
    public Subscription onError(Consumer<JsonNode> listener) {
        Objects.requireNonNull(listener, "listener");
        errorListeners.add(listener);
        return () -> errorListeners.remove(listener);
    }

    @Override
    public Subscription subscribe(String recipient, MessageHandler handler) {
        if (recipient == null || recipient.isBlank()) {
            throw new IllegalArgumentException("recipient cannot be empty");
        }
        Objects.requireNonNull(handler, "handler");
        return onMessage(envelope -> {
            if (recipient.equals(envelope.recipient())) {
                handler.onMessage(envelope);
            }
        });
    }

    @Override
    public void close() {
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
        }
        SocketConnection conn = connection;
        if (conn != null) {
            conn.destroy();
        }
        CompletableFuture<Void> future = connected;
        if (future != null) {
            future.completeExceptionally(new IllegalStateException("Client is closed"));
        }
        listeners.clear();
        errorListeners.clear();
        timers.shutdownNow();
        reader.shutdownNow();
        writer.shutdownNow();
        log.debug("Socket client closed client={}", clientId);
    }

    private void readLoop(SocketConnection conn) {
        FrameDecoder decoder = codec.newDecoder();
        try {
            conn.readFrames(decoder, body -> onFrame(conn, body));
        } catch (FrameTooLargeException e) {
            metrics.increment(TransportMetrics.MESSAGE_ERROR, Map.of("reason", "frame_too_large"));
            log.warn("Closing client={} reason={}", clientId, e.getMessage());
        } catch (IOException e) {
            if (!closed) {
                log.debug("Client read ended client={} error={}", clientId, e.getMessage());
            }
        } finally {
            conn.destroy();
            fail(new TransportException("Connection closed before handshake completed: " + config.socketPath()));
        }
    }

    private void onFrame(SocketConnection conn, byte[] body) {
        JsonNode record;
        try {
            record = codec.decode(body);
        } catch (IOException e) {
            if (!conn.isHandshakeComplete()) {
                fail(new TransportException("Malformed frame before ACK from " + config.socketPath(), e));
                conn.destroy();
                return;
            }
            metrics.dropped("undecodable");
            log.warn("Dropped undecodable frame client={}", clientId);
            return;
        }

        Optional<String> error = ControlRecords.errorCode(record);
        if (error.isPresent()) {
            onServerError(conn, error.get(), record);
            return;
        }
        Optional<MessageType> control = ControlRecords.controlType(record);
        if (control.isPresent()) {
            onControl(conn, control.get(), record);
            return;
        }
        if (!conn.isHandshakeComplete()) {
            metrics.dropped("pre_handshake");
            return;
        }

        MessageEnvelope envelope;
        try {
            envelope = validator.validate(record);
        } catch (ValidationException e) {
            metrics.dropped("invalid_message");
            log.warn("Dropped invalid message client={} fields={}", clientId, e.fields());
            return;
        }
        if (envelope.messageType().isControl()) {
            metrics.dropped("control");
            log.debug("Dropped control-typed envelope client={} type={}", clientId, envelope.messageType());
            return;
        }
        metrics.increment(TransportMetrics.MESSAGE_RECEIVED, Map.of("type", envelope.messageType().name()));
        dispatch(envelope);
    }

    private void onServerError(SocketConnection conn, String code, JsonNode record) {
        if (ControlRecords.HANDSHAKE_TIMEOUT.equals(code) && conn.expireHandshake()) {
            metrics.increment(TransportMetrics.HANDSHAKE_TIMEOUT);
            fail(new HandshakeTimeoutException(config.socketPath(), config.handshakeTimeoutMs()));
            conn.destroy();
            return;
        }
        log.warn("Server reported error client={} error={} details={}", clientId, code, record.path("details"));
        for (Consumer<JsonNode> listener : errorListeners) {
            try {
                listener.accept(record);
            } catch (RuntimeException e) {
                log.warn("Error listener failed client={}", clientId, e);
            }
        }
    }

    private void onControl(SocketConnection conn, MessageType type, JsonNode record) {
        switch (type) {
            case ACK -> {
                if (!conn.completeHandshake()) {
                    return;
                }
                long interval = config.heartbeatIntervalMs();
                conn.heartbeatTimer(timers.scheduleAtFixedRate(
                        () -> sendPong(conn),
                        interval,
                        interval,
                        TimeUnit.MILLISECONDS
                ));
                log.info("Connected client={} path={} serverVersion={}",
                        clientId, config.socketPath(), record.path("version").asText(""));
                connected.complete(null);
            }
            case PING -> {
                conn.markPing(System.currentTimeMillis());
                if (conn.isHandshakeComplete() && !conn.enqueue(codec.encode(ControlRecords.pong()))) {
                    log.warn("Dropped PONG client={} reason=outbox full", clientId);
                }
            }
            case PONG -> conn.markPong(System.currentTimeMillis());
            default -> log.debug("Ignored control record client={} type={}", clientId, type);
        }
    }

    private void dispatch(MessageEnvelope envelope) {
        TraceContext trace = TraceContext.extract(envelope.context().baggage()).orElse(null);
        for (MessageHandler listener : listeners) {
            try (TraceContext.Scope ignored = trace == null ? TraceContext.Scope.noop() : trace.activate()) {
                try {
                    listener.onMessage(envelope);
                } catch (Exception e) {
                    metrics.increment(TransportMetrics.MESSAGE_ERROR, Map.of("reason", "handler_failed"));
                    log.warn("Listener failed message={} client={}", envelope.id(), clientId, e);
                }
            }
        }
    }

    private void ackExpired() {
        SocketConnection conn = connection;
        if (conn == null || !conn.expireHandshake()) {
            return;
        }
        metrics.increment(TransportMetrics.HANDSHAKE_TIMEOUT);
        log.warn("No ACK client={} path={} timeoutMs={}", clientId, config.socketPath(), config.handshakeTimeoutMs());
        fail(new NoAckException(config.socketPath(), config.handshakeTimeoutMs()));
        conn.destroy();
    }

    private void sendPong(SocketConnection conn) {
        if (!conn.isOpen()) {
            return;
        }
        if (conn.enqueue(codec.encode(ControlRecords.pong()))) {
            conn.markPong(System.currentTimeMillis());
        } else {
            log.warn("Heartbeat skipped client={} reason=outbox full", clientId);
        }
    }

    private void writeFailed(SocketConnection conn, IOException error) {
        log.warn("Write failed client={} error={}", clientId, error.getMessage());
        fail(new TransportException("Write failed on " + config.socketPath(), error));
    }

    private void fail(Throwable cause) {
        CompletableFuture<Void> future = connected;
        if (future != null) {
            future.completeExceptionally(cause);
        }
    }
}
