package com.krishnamouli.cohort.network.resp;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;
import io.netty.handler.codec.DecoderException;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Redis RESP (REdis Serialization Protocol) decoder.
 * Supports RESP2. Emits String (simple string), {@link RESPEncoder.RESPError},
 * Long, byte[] (bulk string), List and {@link RESPEncoder.Nil}.
 */
public class RESPDecoder extends ByteToMessageDecoder {

    // Marker for "frame not fully received yet"
    private static final Object INCOMPLETE = new Object();

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) {
        while (in.isReadable()) {
            int start = in.readerIndex();
            Object decoded = decodeMessage(in);

            if (decoded == INCOMPLETE) {
                in.readerIndex(start);
                return;
            }

            out.add(decoded);
        }
    }

    private Object decodeMessage(ByteBuf in) {
        if (!in.isReadable()) {
            return INCOMPLETE;
        }

        byte firstByte = in.readByte();

        switch (firstByte) {
            case '+': // Simple String
                return decodeSimpleString(in);
            case '-': // Error
                return decodeError(in);
            case ':': // Integer
                return decodeInteger(in);
            case '$': // Bulk String
                return decodeBulkString(in);
            case '*': // Array
                return decodeArray(in);
            default:
                throw new DecoderException("Unknown RESP type: " + (char) firstByte);
        }
    }

    private Object decodeSimpleString(ByteBuf in) {
        String line = readLine(in);
        return line != null ? line : INCOMPLETE;
    }

    private Object decodeError(ByteBuf in) {
        String line = readLine(in);
        return line != null ? new RESPEncoder.RESPError(line) : INCOMPLETE;
    }

    private Object decodeInteger(ByteBuf in) {
        String line = readLine(in);
        return line != null ? (Object) parseLong(line) : INCOMPLETE;
    }

    private Object decodeBulkString(ByteBuf in) {
        String lengthStr = readLine(in);
        if (lengthStr == null) {
            return INCOMPLETE;
        }

        int length = (int) parseLong(lengthStr);
        if (length < 0) {
            return RESPEncoder.Nil.INSTANCE;
        }

        if (in.readableBytes() < length + 2) { // +2 for \r\n
            return INCOMPLETE;
        }

        byte[] data = new byte[length];
        in.readBytes(data);
        in.skipBytes(2); // Skip \r\n

        return data;
    }

    private Object decodeArray(ByteBuf in) {
        String countStr = readLine(in);
        if (countStr == null) {
            return INCOMPLETE;
        }

        int count = (int) parseLong(countStr);
        if (count < 0) {
            return RESPEncoder.Nil.INSTANCE;
        }

        List<Object> array = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            Object element = decodeMessage(in);
            if (element == INCOMPLETE) {
                return INCOMPLETE;
            }
            array.add(element);
        }

        return array;
    }

    private String readLine(ByteBuf in) {
        int lineLength = indexOf(in, (byte) '\n');
        if (lineLength == -1) {
            return null;
        }

        byte[] lineBytes = new byte[lineLength];
        in.readBytes(lineBytes);
        in.skipBytes(1); // Skip \n

        // Remove \r if present
        if (lineLength > 0 && lineBytes[lineLength - 1] == '\r') {
            return new String(lineBytes, 0, lineLength - 1, StandardCharsets.UTF_8);
        }

        return new String(lineBytes, StandardCharsets.UTF_8);
    }

    private int indexOf(ByteBuf buffer, byte value) {
        int index = buffer.indexOf(buffer.readerIndex(), buffer.writerIndex(), value);
        return index < 0 ? -1 : index - buffer.readerIndex();
    }

    private static long parseLong(String line) {
        try {
            return Long.parseLong(line);
        } catch (NumberFormatException e) {
            throw new DecoderException("Malformed RESP number: " + line, e);
        }
    }
}
