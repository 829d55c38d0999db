package io.taskwire.transport.socket;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.SocketChannel;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One end of an accepted or dialed socket. Outgoing frames go through a bounded outbox drained
 * by at most one writer task at a time, so callers (timers included) never block on a peer that
 * stopped reading. Reads happen on the single reader thread that runs {@link #readFrames}.
 */
public final class SocketConnection {
    static final int MAX_OUTBOX_FRAMES = 1024;
    private static final int READ_BUFFER_BYTES = 64 * 1024;

    private final String id;
    private final SocketChannel channel;
    private final Executor writer;
    private final WriteFailureListener writeFailureListener;
    private final Deque<byte[]> outbox = new ArrayDeque<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicReference<HandshakeState> handshake = new AtomicReference<>(HandshakeState.PENDING);
    private final AtomicLong bytesReceived = new AtomicLong();
    private final AtomicLong bytesSent = new AtomicLong();
    private final long connectedAtMs = System.currentTimeMillis();
    private boolean draining;
    private boolean closeWhenFlushed;
    private volatile long lastPingAtMs;
    private volatile long lastPongAtMs;
    private volatile Future<?> handshakeTimer;
    private volatile Future<?> heartbeatTimer;

    SocketConnection(String id, SocketChannel channel, Executor writer, WriteFailureListener writeFailureListener) {
        this.id = id;
        this.channel = channel;
        this.writer = writer;
        this.writeFailureListener = writeFailureListener;
    }

    public String id() {
        return id;
    }

    public boolean isHandshakeComplete() {
        return handshake.get() == HandshakeState.COMPLETE;
    }

    public boolean isOpen() {
        return !closed.get() && channel.isOpen();
    }

    public long lastPingAtMs() {
        return lastPingAtMs;
    }

    public long lastPongAtMs() {
        return lastPongAtMs;
    }

    public Stats stats() {
        return new Stats(
                id,
                isHandshakeComplete(),
                connectedAtMs,
                lastPingAtMs,
                lastPongAtMs,
                bytesReceived.get(),
                bytesSent.get()
        );
    }

    /**
     * Moves a pending handshake to complete. Returns false if it already completed or expired.
     */
    boolean completeHandshake() {
        if (!handshake.compareAndSet(HandshakeState.PENDING, HandshakeState.COMPLETE)) {
            return false;
        }
        cancel(handshakeTimer);
        handshakeTimer = null;
        return true;
    }

    /**
     * Moves a pending handshake to expired. Returns false if it already completed or expired.
     */
    boolean expireHandshake() {
        return handshake.compareAndSet(HandshakeState.PENDING, HandshakeState.EXPIRED);
    }

    void markPing(long atMs) {
        lastPingAtMs = atMs;
    }

    void markPong(long atMs) {
        lastPongAtMs = atMs;
    }

    void handshakeTimer(Future<?> timer) {
        this.handshakeTimer = timer;
    }

    void heartbeatTimer(Future<?> timer) {
        this.heartbeatTimer = timer;
    }

    /**
     * Queues {@code frame} for the writer. Returns false when the connection is closed, is
     * closing, or already holds {@link #MAX_OUTBOX_FRAMES} unwritten frames.
     */
    boolean enqueue(byte[] frame) {
        return offer(frame, false);
    }

    /**
     * Queues a last frame; the channel is closed once it has been written.
     */
    boolean enqueueAndClose(byte[] frame) {
        return offer(frame, true);
    }

    /**
     * Blocks reading until the peer closes or the connection is destroyed, passing every
     * complete frame body to {@code consumer} in arrival order.
     */
    void readFrames(FrameDecoder decoder, FrameConsumer consumer) throws IOException {
        ByteBuffer buffer = ByteBuffer.allocate(READ_BUFFER_BYTES);
        while (isOpen()) {
            buffer.clear();
            int read = channel.read(buffer);
            if (read < 0) {
                return;
            }
            bytesReceived.addAndGet(read);
            buffer.flip();
            List<byte[]> frames = decoder.feed(buffer);
            for (byte[] body : frames) {
                if (!isOpen()) {
                    return;
                }
                consumer.accept(body);
            }
        }
    }

    /**
     * Cancels both timers, discards unwritten frames and closes the channel. Safe to call more
     * than once.
     */
    boolean destroy() {
        if (!closed.compareAndSet(false, true)) {
            return false;
        }
        cancel(handshakeTimer);
        cancel(heartbeatTimer);
        synchronized (outbox) {
            outbox.clear();
        }
        try {
            channel.close();
        } catch (IOException ignored) {
            // Already closing; nothing left to release.
        }
        return true;
    }

    private boolean offer(byte[] frame, boolean last) {
        synchronized (outbox) {
            if (!isOpen() || closeWhenFlushed || outbox.size() >= MAX_OUTBOX_FRAMES) {
                return false;
            }
            outbox.addLast(frame);
            closeWhenFlushed = last;
            if (draining) {
                return true;
            }
            draining = true;
        }
        try {
            writer.execute(this::flush);
        } catch (RejectedExecutionException e) {
            synchronized (outbox) {
                draining = false;
            }
            destroy();
            return false;
        }
        return true;
    }

    private void flush() {
        while (true) {
            byte[] frame;
            boolean closeNow = false;
            synchronized (outbox) {
                frame = outbox.pollFirst();
                if (frame == null) {
                    draining = false;
                    closeNow = closeWhenFlushed;
                }
            }
            if (frame == null) {
                if (closeNow) {
                    destroy();
                }
                return;
            }
            try {
                ByteBuffer buffer = ByteBuffer.wrap(frame);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                bytesSent.addAndGet(frame.length);
            } catch (IOException e) {
                synchronized (outbox) {
                    draining = false;
                }
                if (isOpen()) {
                    writeFailureListener.onWriteFailure(this, e);
                }
                destroy();
                return;
            }
        }
    }

    private static void cancel(Future<?> timer) {
        if (timer != null) {
            timer.cancel(false);
        }
    }

    private enum HandshakeState {
        PENDING,
        COMPLETE,
        EXPIRED
    }

    @FunctionalInterface
    interface FrameConsumer {
        void accept(byte[] body) throws IOException;
    }

    @FunctionalInterface
    interface WriteFailureListener {
        void onWriteFailure(SocketConnection connection, IOException error);
    }

    public record Stats(
            String connectionId,
            boolean handshakeComplete,
            long connectedAtMs,
            long lastPingAtMs,
            long lastPongAtMs,
            long bytesReceived,
            long bytesSent
    ) {
    }
}
