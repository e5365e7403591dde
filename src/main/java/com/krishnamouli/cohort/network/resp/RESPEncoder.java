package com.krishnamouli.cohort.network.resp;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToByteEncoder;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Redis RESP (REdis Serialization Protocol) encoder.
 * Used in both directions: replies from the store server and commands from the
 * remote store client (an array of bulk strings).
 */
public class RESPEncoder extends MessageToByteEncoder<Object> {

    private static final byte[] CRLF = "\r\n".getBytes(StandardCharsets.UTF_8);
    private static final byte[] NULL_BULK = "$-1\r\n".getBytes(StandardCharsets.UTF_8);

    @Override
    protected void encode(ChannelHandlerContext ctx, Object msg, ByteBuf out) {
        write(msg, out);
    }

    static void write(Object msg, ByteBuf out) {
        if (msg == null || msg == Nil.INSTANCE) {
            out.writeBytes(NULL_BULK);
        } else if (msg instanceof String) {
            writeSimpleString(out, (String) msg);
        } else if (msg instanceof byte[]) {
            writeBulkString(out, (byte[]) msg);
        } else if (msg instanceof Long || msg instanceof Integer) {
            writeInteger(out, ((Number) msg).longValue());
        } else if (msg instanceof List) {
            writeArray(out, (List<?>) msg);
        } else if (msg instanceof RESPError) {
            writeError(out, ((RESPError) msg).getMessage());
        } else {
            throw new IllegalArgumentException("Unsupported type: " + msg.getClass());
        }
    }

    private static void writeSimpleString(ByteBuf out, String str) {
        out.writeByte('+');
        out.writeBytes(str.getBytes(StandardCharsets.UTF_8));
        out.writeBytes(CRLF);
    }

    private static void writeError(ByteBuf out, String error) {
        out.writeByte('-');
        out.writeBytes(error.getBytes(StandardCharsets.UTF_8));
        out.writeBytes(CRLF);
    }

    private static void writeInteger(ByteBuf out, long value) {
        out.writeByte(':');
        out.writeBytes(String.valueOf(value).getBytes(StandardCharsets.UTF_8));
        out.writeBytes(CRLF);
    }

    private static void writeBulkString(ByteBuf out, byte[] data) {
        out.writeByte('$');
        out.writeBytes(String.valueOf(data.length).getBytes(StandardCharsets.UTF_8));
        out.writeBytes(CRLF);
        out.writeBytes(data);
        out.writeBytes(CRLF);
    }

    private static void writeArray(ByteBuf out, List<?> array) {
        out.writeByte('*');
        out.writeBytes(String.valueOf(array.size()).getBytes(StandardCharsets.UTF_8));
        out.writeBytes(CRLF);

        for (Object item : array) {
            write(item, out);
        }
    }

    /**
     * Error reply ({@code -ERR ...}).
     */
    public static class RESPError {
        private final String message;

        public RESPError(String message) {
            this.message = message;
        }

        public String getMessage() {
            return message;
        }

        @Override
        public String toString() {
            return message;
        }
    }

    /**
     * Null bulk reply ({@code $-1}). Netty pipelines cannot carry a real null.
     */
    public enum Nil {
        INSTANCE
    }
}
