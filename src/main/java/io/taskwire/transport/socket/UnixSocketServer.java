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
import java.nio.channels.ClosedChannelException;
import java.nio.channels.ServerSocketChannel;
import java.nio.channels.SocketChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Accepts framed connections on a Unix domain socket. A connection must send {@code HELLO}
 * within the handshake timeout; until then everything else it sends is discarded. After the
 * {@code ACK} the server pings it every heartbeat interval and dispatches its envelopes.
 */
public final class UnixSocketServer implements Transport {
    private static final Logger log = LoggerFactory.getLogger(UnixSocketServer.class);

    private final TaskWireConfig config;
    private final TransportMetrics metrics;
    private final FrameCodec codec;
    private final EnvelopeValidator validator = new EnvelopeValidator();
    private final ConcurrentMap<String, SocketConnection> connections = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, SocketConnection> routes = new ConcurrentHashMap<>();
    private final CopyOnWriteArrayList<ConnectionMessageHandler> handlers = new CopyOnWriteArrayList<>();
    private final AtomicLong connectionSeq = new AtomicLong();
    private final Path socketPath;
    private ServerSocketChannel serverChannel;
    private ExecutorService ioExecutor;
    private ScheduledExecutorService timers;
    private volatile boolean running;

    public UnixSocketServer(TaskWireConfig config, TransportMetrics metrics) {
        this.config = Objects.requireNonNull(config, "config");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.codec = new FrameCodec(config.maxFrameSize());
        this.socketPath = Path.of(config.socketPath());
    }

    /**
     * Binds the socket path, replacing a stale socket file left by an earlier process.
     */
    public synchronized void start() {
        if (running) {
            return;
        }
        try {
            Files.deleteIfExists(socketPath);
            Path parent = socketPath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            serverChannel = ServerSocketChannel.open(StandardProtocolFamily.UNIX);
            serverChannel.bind(UnixDomainSocketAddress.of(socketPath));
        } catch (IOException e) {
            throw new TransportException("Failed to bind socket: " + socketPath, e);
        }
        ioExecutor = Executors.newCachedThreadPool(Threads.daemon("taskwire-socket-io"));
        timers = Executors.newSingleThreadScheduledExecutor(Threads.daemon("taskwire-socket-timer"));
        running = true;
        ioExecutor.execute(this::acceptLoop);
        log.info("Socket server listening path={} protocolVersion={}", socketPath, config.protocolVersion());
    }

    public boolean isRunning() {
        return running;
    }

    public Path socketPath() {
        return socketPath;
    }

    public Subscription onMessage(ConnectionMessageHandler handler) {
        Objects.requireNonNull(handler, "handler");
        handlers.add(handler);
        return () -> handlers.remove(handler);
    }

    /**
     * Filters inbound envelopes by recipient.
     */
    @Override
    public Subscription subscribe(String recipient, MessageHandler handler) {
        if (recipient == null || recipient.isBlank()) {
            throw new IllegalArgumentException("recipient cannot be empty");
        }
        Objects.requireNonNull(handler, "handler");
        ConnectionMessageHandler filtered = (envelope, connection) -> {
            if (recipient.equals(envelope.recipient())) {
                handler.onMessage(envelope);
            }
        };
        return onMessage(filtered);
    }

    /**
     * Writes {@code envelope} to one connection.
     */
    public void send(SocketConnection connection, MessageEnvelope envelope) {
        MessageEnvelope valid = validator.validate(envelope);
        if (!connection.isHandshakeComplete() || !connection.isOpen()) {
            throw new IllegalStateException("Connection is not ready: " + connection.id());
        }
        if (!connection.enqueue(codec.encode(EnvelopeWriter.toTree(valid)))) {
            metrics.dropped("outbox_full");
            drop(connection, "outbox full");
            throw new TransportException("Connection " + connection.id() + " is not accepting writes");
        }
        metrics.increment(TransportMetrics.MESSAGE_SENT, Map.of("type", valid.messageType().name()));
    }

    /**
     * Routes to the connection the recipient last sent from, or broadcasts when the recipient
     * has not been seen.
     */
    @Override
    public void send(MessageEnvelope envelope) {
        MessageEnvelope valid = validator.validate(envelope);
        SocketConnection route = routes.get(valid.recipient());
        if (route != null && route.isOpen()) {
            send(route, valid);
            return;
        }
        broadcast(valid);
    }

    /**
     * Writes {@code envelope} to every handshake-complete connection.
     *
     * @return number of connections written to
     */
    public int broadcast(MessageEnvelope envelope) {
        MessageEnvelope valid = validator.validate(envelope);
        byte[] frame = codec.encode(EnvelopeWriter.toTree(valid));
        int delivered = 0;
        for (SocketConnection connection : connections.values()) {
            if (!connection.isHandshakeComplete() || !connection.isOpen()) {
                continue;
            }
            if (connection.enqueue(frame)) {
                delivered++;
            } else {
                log.warn("Broadcast skipped connection={} reason=outbox full", connection.id());
                metrics.dropped("outbox_full");
                drop(connection, "outbox full");
            }
        }
        if (delivered > 0) {
            metrics.increment(TransportMetrics.MESSAGE_SENT, Map.of("type", valid.messageType().name()));
        } else {
            metrics.dropped("no_connection");
            log.debug("Broadcast reached no connection id={} recipient={}", valid.id(), valid.recipient());
        }
        return delivered;
    }

    public List<SocketConnection.Stats> connections() {
        List<SocketConnection.Stats> out = new ArrayList<>();
        for (SocketConnection connection : connections.values()) {
            out.add(connection.stats());
        }
        return out;
    }

    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        try {
            serverChannel.close();
        } catch (IOException e) {
            log.warn("Failed to close server socket path={}", socketPath, e);
        }
        for (SocketConnection connection : connections.values()) {
            connection.destroy();
        }
        connections.clear();
        routes.clear();
        handlers.clear();
        timers.shutdownNow();
        ioExecutor.shutdownNow();
        try {
            Files.deleteIfExists(socketPath);
        } catch (IOException e) {
            log.warn("Failed to remove socket file path={}", socketPath, e);
        }
        log.info("Socket server stopped path={}", socketPath);
    }

    @Override
    public void close() {
        stop();
    }

    private void acceptLoop() {
        while (running) {
            SocketChannel channel;
            try {
                channel = serverChannel.accept();
            } catch (ClosedChannelException e) {
                return;
            } catch (IOException e) {
                if (running) {
                    log.warn("Accept failed path={} error={}", socketPath, e.getMessage());
                }
                continue;
            }
            register(channel);
        }
    }

    private void register(SocketChannel channel) {
        SocketConnection connection = new SocketConnection(
                "conn-" + connectionSeq.incrementAndGet(),
                channel,
                ioExecutor,
                this::writeFailed
        );
        connections.put(connection.id(), connection);
        try {
            connection.handshakeTimer(timers.schedule(
                    () -> handshakeExpired(connection),
                    config.handshakeTimeoutMs(),
                    TimeUnit.MILLISECONDS
            ));
            ioExecutor.execute(() -> readLoop(connection));
        } catch (RejectedExecutionException e) {
            // Server is stopping.
            drop(connection, "server stopping");
            return;
        }
        log.debug("Accepted connection={}", connection.id());
    }

    private void readLoop(SocketConnection connection) {
        FrameDecoder decoder = codec.newDecoder();
        try {
            connection.readFrames(decoder, body -> onFrame(connection, body));
        } catch (FrameTooLargeException e) {
            metrics.increment(TransportMetrics.MESSAGE_ERROR, Map.of("reason", "frame_too_large"));
            log.warn("Closing connection={} reason={}", connection.id(), e.getMessage());
        } catch (IOException e) {
            if (running && connection.isOpen()) {
                log.debug("Connection read ended connection={} error={}", connection.id(), e.getMessage());
            }
        } finally {
            drop(connection, "closed");
        }
    }

    private void onFrame(SocketConnection connection, byte[] body) {
        JsonNode record;
        try {
            record = codec.decode(body);
        } catch (IOException e) {
            if (!connection.isHandshakeComplete()) {
                log.warn("Malformed frame before handshake connection={}", connection.id());
                drop(connection, "malformed pre-handshake frame");
                return;
            }
            metrics.dropped("undecodable");
            writeControl(connection, ControlRecords.invalidMessage(List.of("<frame>")));
            return;
        }

        Optional<MessageType> control = ControlRecords.controlType(record);
        if (!connection.isHandshakeComplete()) {
            if (control.isPresent() && control.get() == MessageType.HELLO) {
                completeHandshake(connection, record);
            } else {
                metrics.dropped("pre_handshake");
                log.debug("Discarded record before handshake connection={}", connection.id());
            }
            return;
        }
        if (control.isPresent()) {
            onControl(connection, control.get());
            return;
        }
        Optional<String> error = ControlRecords.errorCode(record);
        if (error.isPresent()) {
            log.warn("Peer reported error connection={} error={}", connection.id(), error.get());
            return;
        }

        MessageEnvelope envelope;
        try {
            envelope = validator.validate(record);
        } catch (ValidationException e) {
            metrics.dropped("invalid_message");
            log.warn("Rejected invalid message connection={} fields={}", connection.id(), e.fields());
            writeControl(connection, ControlRecords.invalidMessage(e.fields()));
            return;
        }
        if (envelope.messageType().isControl()) {
            metrics.dropped("control");
            log.debug("Dropped control-typed envelope connection={} type={}", connection.id(), envelope.messageType());
            return;
        }
        routes.put(envelope.sender(), connection);
        metrics.increment(TransportMetrics.MESSAGE_RECEIVED, Map.of("type", envelope.messageType().name()));
        dispatch(envelope, connection);
    }

    private void completeHandshake(SocketConnection connection, JsonNode hello) {
        if (!connection.completeHandshake()) {
            log.debug("Ignored HELLO after handshake timeout connection={}", connection.id());
            return;
        }
        if (!writeControl(connection, ControlRecords.ack(config.protocolVersion()))) {
            return;
        }
        long interval = config.heartbeatIntervalMs();
        connection.heartbeatTimer(timers.scheduleAtFixedRate(
                () -> sendPing(connection),
                interval,
                interval,
                TimeUnit.MILLISECONDS
        ));
        log.info("Handshake complete connection={} client={}", connection.id(), hello.path("client").asText(""));
    }

    private void onControl(SocketConnection connection, MessageType type) {
        switch (type) {
            case PONG -> connection.markPong(System.currentTimeMillis());
            case PING -> writeControl(connection, ControlRecords.pong());
            default -> log.debug("Ignored control record connection={} type={}", connection.id(), type);
        }
    }

    private void dispatch(MessageEnvelope envelope, SocketConnection connection) {
        TraceContext trace = TraceContext.extract(envelope.context().baggage()).orElse(null);
        for (ConnectionMessageHandler handler : handlers) {
            try (TraceContext.Scope ignored = trace == null ? TraceContext.Scope.noop() : trace.activate()) {
                try {
                    handler.onMessage(envelope, connection);
                } catch (Exception e) {
                    metrics.increment(TransportMetrics.MESSAGE_ERROR, Map.of("reason", "handler_failed"));
                    log.warn("Handler failed message={} connection={}", envelope.id(), connection.id(), e);
                }
            }
        }
    }

    private void handshakeExpired(SocketConnection connection) {
        if (!connection.isOpen() || !connection.expireHandshake()) {
            return;
        }
        metrics.increment(TransportMetrics.HANDSHAKE_TIMEOUT);
        log.warn("Handshake timeout connection={} timeoutMs={}", connection.id(), config.handshakeTimeoutMs());
        forget(connection);
        // The report is the last frame; the writer closes the channel after it.
        if (!connection.enqueueAndClose(codec.encode(ControlRecords.handshakeTimeout()))) {
            drop(connection, "handshake timeout");
        }
    }

    private void sendPing(SocketConnection connection) {
        if (!connection.isOpen()) {
            return;
        }
        if (writeControl(connection, ControlRecords.ping())) {
            connection.markPing(System.currentTimeMillis());
        }
    }

    /**
     * Queues a control record. A connection whose outbox is full has stopped reading and is
     * dropped.
     */
    private boolean writeControl(SocketConnection connection, JsonNode record) {
        if (connection.enqueue(codec.encode(record))) {
            return true;
        }
        if (connection.isOpen()) {
            metrics.dropped("outbox_full");
            log.warn("Closing stalled connection={} reason=outbox full", connection.id());
        }
        drop(connection, "outbox full");
        return false;
    }

    private void writeFailed(SocketConnection connection, IOException error) {
        log.warn("Write failed connection={} error={}", connection.id(), error.getMessage());
        drop(connection, "write failed");
    }

    private void drop(SocketConnection connection, String reason) {
        if (connection.destroy()) {
            log.debug("Closed connection={} reason={}", connection.id(), reason);
        }
        forget(connection);
    }

    private void forget(SocketConnection connection) {
        connections.remove(connection.id(), connection);
        routes.values().removeIf(route -> route == connection);
    }
}
