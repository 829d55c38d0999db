package io.taskwire.transport.socket;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

final class FrameDecoderTest {
    private final FrameCodec codec = new FrameCodec(1024);

    @Test
    void reassemblesFramesSplitAcrossReads() throws Exception {
        ByteArrayOutputStream stream = new ByteArrayOutputStream();
        stream.write(codec.encode(ControlRecords.hello("client-a")));
        stream.write(codec.encode(ControlRecords.ping()));
        stream.write(codec.encode(ControlRecords.invalidMessage(List.of("id", "sender"))));
        byte[] wire = stream.toByteArray();

        FrameDecoder decoder = codec.newDecoder();
        List<JsonNode> records = new ArrayList<>();
        for (int offset = 0; offset < wire.length; offset += 3) {
            byte[] chunk = Arrays.copyOfRange(wire, offset, Math.min(wire.length, offset + 3));
            for (byte[] body : decoder.feed(chunk)) {
                records.add(codec.decode(body));
            }
        }

        Assertions.assertEquals(3, records.size());
        Assertions.assertEquals("HELLO", records.get(0).path("type").asText());
        Assertions.assertEquals("client-a", records.get(0).path("client").asText());
        Assertions.assertEquals("PING", records.get(1).path("type").asText());
        Assertions.assertEquals("invalid_message", records.get(2).path("error").asText());
        Assertions.assertEquals("sender", records.get(2).path("details").get(1).asText());
        Assertions.assertEquals(0, decoder.buffered());
    }

    @Test
    void holdsPartialFrameUntilComplete() {
        byte[] frame = codec.encode(ControlRecords.pong());
        FrameDecoder decoder = codec.newDecoder();

        Assertions.assertTrue(decoder.feed(Arrays.copyOf(frame, frame.length - 1)).isEmpty());
        Assertions.assertEquals(frame.length - 1, decoder.buffered());
        Assertions.assertEquals(1, decoder.feed(new byte[]{frame[frame.length - 1]}).size());
    }

    @Test
    void waitsForBodyWhenDeclaredLengthIsNearIntRange() {
        FrameDecoder decoder = new FrameDecoder(Integer.MAX_VALUE);
        byte[] header = ByteBuffer.allocate(6).putInt(Integer.MAX_VALUE).put((byte) 1).put((byte) 2).array();

        Assertions.assertTrue(decoder.feed(header).isEmpty());
        Assertions.assertEquals(6, decoder.buffered());
    }

    @Test
    void rejectsDeclaredLengthAboveLimit() {
        FrameDecoder decoder = codec.newDecoder();
        byte[] header = ByteBuffer.allocate(4).putInt(4096).array();

        FrameTooLargeException error = Assertions.assertThrows(FrameTooLargeException.class, () -> decoder.feed(header));
        Assertions.assertEquals(4096L, error.frameLength());
    }

    @Test
    void encodeRefusesOversizedRecords() {
        FrameCodec tiny = new FrameCodec(16);
        Assertions.assertThrows(FrameTooLargeException.class,
                () -> tiny.encode(ControlRecords.invalidMessage(List.of("a-very-long-field-name", "another-one"))));
    }

    @Test
    void controlRecordsAreToldApartFromEnvelopes() throws Exception {
        byte[] frame = codec.encode(ControlRecords.ack("1.0"));
        JsonNode ack = codec.decode(Arrays.copyOfRange(frame, FrameCodec.LENGTH_PREFIX_BYTES, frame.length));

        Assertions.assertTrue(ControlRecords.controlType(ack).isPresent());
        Assertions.assertTrue(ControlRecords.errorCode(ack).isEmpty());
        Assertions.assertTrue(ControlRecords.errorCode(ControlRecords.handshakeTimeout()).isPresent());
    }
}
