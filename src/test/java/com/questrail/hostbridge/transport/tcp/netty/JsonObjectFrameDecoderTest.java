package com.questrail.hostbridge.transport.tcp.netty;

import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class JsonObjectFrameDecoderTest {

    private static void write(EmbeddedChannel channel, String text) {
        channel.writeInbound(Unpooled.copiedBuffer(text, StandardCharsets.UTF_8));
    }

    private static String readFrame(EmbeddedChannel channel) {
        Object msg = channel.readInbound();
        assertInstanceOf(byte[].class, msg);
        return new String((byte[]) msg, StandardCharsets.UTF_8);
    }

    @Test
    void splitObjectIsReassembled() {
        EmbeddedChannel channel = new EmbeddedChannel(new JsonObjectFrameDecoder(1024));

        write(channel, "{\"type\":\"set_");
        assertNull(channel.readInbound());
        write(channel, "tempo\",\"params\":{\"tempo\":");
        assertNull(channel.readInbound());
        write(channel, "96}}\n{\"type\"");

        assertEquals("{\"type\":\"set_tempo\",\"params\":{\"tempo\":96}}", readFrame(channel));
        assertNull(channel.readInbound());

        write(channel, ":\"get_session_info\"}");
        assertEquals("{\"type\":\"get_session_info\"}", readFrame(channel));
        assertFalse(channel.finish());
    }

    @Test
    void garbageBecomesAMalformedFrameAndTheChannelSurvives() {
        EmbeddedChannel channel = new EmbeddedChannel(new JsonObjectFrameDecoder(1024));

        write(channel, "oops\n{\"type\":\"a\"}");

        Object first = channel.readInbound();
        JsonObjectFrameDecoder.MalformedFrame malformed =
                assertInstanceOf(JsonObjectFrameDecoder.MalformedFrame.class, first);
        assertEquals("Discarded 4 byte(s) outside a JSON object", malformed.reason());
        assertEquals("{\"type\":\"a\"}", readFrame(channel));
        assertTrue(channel.isActive());
        channel.finishAndReleaseAll();
    }

    @Test
    void oversizedObjectIsReportedNotBuffered() {
        JsonObjectFrameDecoder decoder = new JsonObjectFrameDecoder(32);
        EmbeddedChannel channel = new EmbeddedChannel(decoder);

        write(channel, "{\"type\":\"" + "x".repeat(100));
        assertNull(channel.readInbound());
        assertTrue(decoder.bufferedBytes() <= 32);

        write(channel, "\"}");
        JsonObjectFrameDecoder.MalformedFrame malformed =
                assertInstanceOf(JsonObjectFrameDecoder.MalformedFrame.class, channel.readInbound());
        assertEquals("Message exceeds 32 bytes", malformed.reason());
        channel.finishAndReleaseAll();
    }
}
