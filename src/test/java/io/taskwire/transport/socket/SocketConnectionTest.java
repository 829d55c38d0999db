package io.taskwire.transport.socket;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.net.StandardProtocolFamily;
import java.nio.channels.SocketChannel;
import java.util.concurrent.Executor;

final class SocketConnectionTest {
    private static final Executor NEVER_RUNS = command -> {
    };

    @Test
    void expiredHandshakeCannotComplete() throws Exception {
        SocketChannel channel = SocketChannel.open(StandardProtocolFamily.UNIX);
        try {
            SocketConnection connection = new SocketConnection("c-1", channel, NEVER_RUNS, (c, e) -> {
            });

            Assertions.assertTrue(connection.expireHandshake());
            Assertions.assertFalse(connection.completeHandshake());
            Assertions.assertFalse(connection.isHandshakeComplete());
        } finally {
            channel.close();
        }
    }

    @Test
    void completedHandshakeCannotExpire() throws Exception {
        SocketChannel channel = SocketChannel.open(StandardProtocolFamily.UNIX);
        try {
            SocketConnection connection = new SocketConnection("c-2", channel, NEVER_RUNS, (c, e) -> {
            });

            Assertions.assertTrue(connection.completeHandshake());
            Assertions.assertFalse(connection.expireHandshake());
            Assertions.assertFalse(connection.completeHandshake());
            Assertions.assertTrue(connection.isHandshakeComplete());
        } finally {
            channel.close();
        }
    }

    @Test
    void outboxRefusesFramesOnceFull() throws Exception {
        SocketChannel channel = SocketChannel.open(StandardProtocolFamily.UNIX);
        try {
            SocketConnection connection = new SocketConnection("c-3", channel, NEVER_RUNS, (c, e) -> {
            });
            byte[] frame = new byte[]{0, 0, 0, 0};

            for (int i = 0; i < SocketConnection.MAX_OUTBOX_FRAMES; i++) {
                Assertions.assertTrue(connection.enqueue(frame), "frame " + i);
            }

            Assertions.assertFalse(connection.enqueue(frame));
        } finally {
            channel.close();
        }
    }

    @Test
    void nothingIsQueuedAfterTheLastFrame() throws Exception {
        SocketChannel channel = SocketChannel.open(StandardProtocolFamily.UNIX);
        try {
            SocketConnection connection = new SocketConnection("c-4", channel, NEVER_RUNS, (c, e) -> {
            });

            Assertions.assertTrue(connection.enqueueAndClose(new byte[]{1}));
            Assertions.assertFalse(connection.enqueue(new byte[]{2}));
        } finally {
            channel.close();
        }
    }
}
