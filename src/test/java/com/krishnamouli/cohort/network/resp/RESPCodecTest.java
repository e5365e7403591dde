package com.krishnamouli.cohort.network.resp;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.DecoderException;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RESPCodecTest {

    @Test
    void testDecodesCommandArray() {
        EmbeddedChannel channel = new EmbeddedChannel(new RESPDecoder());
        channel.writeInbound(buffer("*2\r\n$3\r\nGET\r\n$5\r\nmykey\r\n"));

        List<?> command = channel.readInbound();
        assertEquals(2, command.size());
        assertEquals("GET", text(command.get(0)));
        assertEquals("mykey", text(command.get(1)));
    }

    @Test
    void testWaitsForCompleteFrame() {
        EmbeddedChannel channel = new EmbeddedChannel(new RESPDecoder());
        channel.writeInbound(buffer("*2\r\n$3\r\nGET\r\n$5\r\nmy"));
        assertNull(channel.readInbound());

        channel.writeInbound(buffer("key\r\n"));
        List<?> command = channel.readInbound();
        assertEquals("mykey", text(command.get(1)));
    }

    @Test
    void testDecodesReplies() {
        EmbeddedChannel channel = new EmbeddedChannel(new RESPDecoder());
        channel.writeInbound(buffer("+OK\r\n-ERR boom\r\n:42\r\n$-1\r\n$0\r\n\r\n"));

        assertEquals("OK", channel.readInbound());
        RESPEncoder.RESPError error = channel.readInbound();
        assertEquals("ERR boom", error.getMessage());
        assertEquals(42L, (Long) channel.readInbound());
        assertEquals(RESPEncoder.Nil.INSTANCE, channel.readInbound());
        byte[] empty = channel.readInbound();
        assertEquals(0, empty.length);
    }

    @Test
    void testRejectsUnknownType() {
        EmbeddedChannel channel = new EmbeddedChannel(new RESPDecoder());
        assertThrows(DecoderException.class, () -> channel.writeInbound(buffer("?what\r\n")));
    }

    @Test
    void testEncodesValues() {
        EmbeddedChannel channel = new EmbeddedChannel(new RESPEncoder());
        channel.writeOutbound("OK");
        channel.writeOutbound(7L);
        channel.writeOutbound(RESPEncoder.Nil.INSTANCE);
        channel.writeOutbound(new RESPEncoder.RESPError("ERR nope"));
        channel.writeOutbound(Arrays.asList(
                "SET".getBytes(StandardCharsets.UTF_8), "k".getBytes(StandardCharsets.UTF_8)));

        assertEquals("+OK\r\n", drain(channel));
        assertEquals(":7\r\n", drain(channel));
        assertEquals("$-1\r\n", drain(channel));
        assertEquals("-ERR nope\r\n", drain(channel));
        assertEquals("*2\r\n$3\r\nSET\r\n$1\r\nk\r\n", drain(channel));
    }

    static ByteBuf buffer(String resp) {
        return Unpooled.copiedBuffer(resp, StandardCharsets.UTF_8);
    }

    static String drain(EmbeddedChannel channel) {
        ByteBuf out = channel.readOutbound();
        try {
            return out.toString(StandardCharsets.UTF_8);
        } finally {
            out.release();
        }
    }

    private static String text(Object bulk) {
        return new String((byte[]) bulk, StandardCharsets.UTF_8);
    }
}
