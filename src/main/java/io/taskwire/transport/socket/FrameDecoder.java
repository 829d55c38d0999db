package io.taskwire.transport.socket;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Reassembles length-prefixed frames from arbitrary read boundaries. Not thread-safe; one
 * decoder per connection.
 */
public final class FrameDecoder {
    private final int maxFrameSize;
    private byte[] buffer = new byte[8192];
    private int size;

    FrameDecoder(int maxFrameSize) {
        this.maxFrameSize = maxFrameSize;
    }

    /**
     * Appends {@code chunk} and returns every frame body it completed, in order.
     *
     * @throws FrameTooLargeException if a length prefix exceeds the frame limit
     */
    public List<byte[]> feed(ByteBuffer chunk) {
        int incoming = chunk.remaining();
        ensureCapacity(size + incoming);
        chunk.get(buffer, size, incoming);
        size += incoming;

        List<byte[]> frames = new ArrayList<>();
        int offset = 0;
        while (size - offset >= FrameCodec.LENGTH_PREFIX_BYTES) {
            long frameLength = Integer.toUnsignedLong(readInt(offset));
            if (frameLength > maxFrameSize) {
                throw new FrameTooLargeException(frameLength, maxFrameSize);
            }
            long total = FrameCodec.LENGTH_PREFIX_BYTES + frameLength;
            if (size - offset < total) {
                break;
            }
            int bodyStart = offset + FrameCodec.LENGTH_PREFIX_BYTES;
            frames.add(Arrays.copyOfRange(buffer, bodyStart, bodyStart + (int) frameLength));
            offset += (int) total;
        }
        if (offset > 0) {
            System.arraycopy(buffer, offset, buffer, 0, size - offset);
            size -= offset;
        }
        return frames;
    }

    public List<byte[]> feed(byte[] data) {
        return feed(ByteBuffer.wrap(data));
    }

    /**
     * Bytes held for a frame that has not fully arrived yet.
     */
    public int buffered() {
        return size;
    }

    private int readInt(int offset) {
        return ((buffer[offset] & 0xff) << 24)
                | ((buffer[offset + 1] & 0xff) << 16)
                | ((buffer[offset + 2] & 0xff) << 8)
                | (buffer[offset + 3] & 0xff);
    }

    private void ensureCapacity(int required) {
        if (required <= buffer.length) {
            return;
        }
        long next = buffer.length;
        while (next < required) {
            next = next * 2;
        }
        buffer = Arrays.copyOf(buffer, (int) Math.min(next, Integer.MAX_VALUE));
    }
}
