package io.taskwire.transport.socket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.msgpack.jackson.dataformat.MessagePackFactory;

import java.io.IOException;
import java.nio.ByteBuffer;

/**
 * Wire framing: a 4-byte big-endian length followed by one MessagePack-encoded map.
 */
public final class FrameCodec {
    public static final int LENGTH_PREFIX_BYTES = 4;

    private static final ObjectMapper MSGPACK = new ObjectMapper(new MessagePackFactory());

    private final int maxFrameSize;

    public FrameCodec(int maxFrameSize) {
        this.maxFrameSize = maxFrameSize;
    }

    public byte[] encode(JsonNode record) {
        byte[] body;
        try {
            body = MSGPACK.writeValueAsBytes(record);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize frame", e);
        }
        if (body.length > maxFrameSize) {
            throw new FrameTooLargeException(body.length, maxFrameSize);
        }
        return ByteBuffer.allocate(LENGTH_PREFIX_BYTES + body.length)
                .putInt(body.length)
                .put(body)
                .array();
    }

    /**
     * Decodes one frame body (without its length prefix).
     *
     * @throws IOException if the body is not a MessagePack map
     */
    public JsonNode decode(byte[] body) throws IOException {
        JsonNode node;
        try {
            node = MSGPACK.readTree(body);
        } catch (RuntimeException e) {
            throw new IOException("Malformed frame body", e);
        }
        if (node == null || !node.isObject()) {
            throw new IOException("Frame is not a map");
        }
        return node;
    }

    public FrameDecoder newDecoder() {
        return new FrameDecoder(maxFrameSize);
    }

    public int maxFrameSize() {
        return maxFrameSize;
    }
}
