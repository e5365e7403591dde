package com.krishnamouli.cohort.network.resp;

import com.krishnamouli.cohort.core.MutableClock;
import com.krishnamouli.cohort.core.SegmentedTtlMap;
import com.krishnamouli.cohort.core.eviction.LRUEvictionPolicy;
import io.netty.channel.embedded.EmbeddedChannel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Redis commands over the full decoder/handler/encoder pipeline.
 */
class StoreCommandHandlerTest {

    private MutableClock clock;
    private SegmentedTtlMap<byte[]> store;
    private EmbeddedChannel channel;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-01-01T00:00:00Z"));
        store = new SegmentedTtlMap<>(4, 1000, new LRUEvictionPolicy(), clock, 0);
        channel = new EmbeddedChannel(new RESPDecoder(), new RESPEncoder(), new StoreCommandHandler(store));
    }

    @Test
    void testPing() {
        assertEquals("+PONG\r\n", send("PING"));
        assertEquals("$5\r\nhello\r\n", send("PING", "hello"));
    }

    @Test
    void testSetAndGet() {
        assertEquals("+OK\r\n", send("SET", "k", "v1"));
        assertEquals("$2\r\nv1\r\n", send("GET", "k"));
        assertEquals("$-1\r\n", send("GET", "missing"));
    }

    @Test
    void testSetNx() {
        assertEquals("+OK\r\n", send("SET", "k", "first", "NX"));
        assertEquals("$-1\r\n", send("SET", "k", "second", "NX"));
        assertEquals("$5\r\nfirst\r\n", send("GET", "k"));
    }

    @Test
    void testSetXx() {
        assertEquals("$-1\r\n", send("SET", "k", "v", "XX"));
        send("SET", "k", "v");
        assertEquals("+OK\r\n", send("SET", "k", "v2", "XX"));
        assertEquals("$2\r\nv2\r\n", send("GET", "k"));
    }

    @Test
    void testSetWithExpiry() {
        send("SET", "k", "v", "PX", "1500", "NX");
        assertEquals(":1500\r\n", send("PTTL", "k"));
        assertEquals(":2\r\n", send("TTL", "k"));

        clock.advance(Duration.ofMillis(1501));
        assertEquals("$-1\r\n", send("GET", "k"));
        assertEquals(":-2\r\n", send("TTL", "k"));

        // Expired key no longer blocks NX
        assertEquals("+OK\r\n", send("SET", "k", "again", "EX", "10", "NX"));
        assertEquals(":10\r\n", send("TTL", "k"));
    }

    @Test
    void testTtlWithoutExpiry() {
        send("SET", "k", "v");
        assertEquals(":-1\r\n", send("TTL", "k"));
    }

    @Test
    void testDelAndExists() {
        send("SET", "a", "1");
        send("SET", "b", "2");

        assertEquals(":2\r\n", send("EXISTS", "a", "b", "c"));
        assertEquals(":1\r\n", send("DEL", "a", "c"));
        assertEquals(":1\r\n", send("DBSIZE"));
    }

    @Test
    void testExpire() {
        send("SET", "k", "v");
        assertEquals(":1\r\n", send("PEXPIRE", "k", "500"));
        assertEquals(":500\r\n", send("PTTL", "k"));
        assertEquals(":0\r\n", send("EXPIRE", "missing", "5"));
        assertEquals(":1\r\n", send("EXPIRE", "k", "0"));
        assertEquals("$-1\r\n", send("GET", "k"));
    }

    @Test
    void testFlushAll() {
        send("SET", "a", "1");
        assertEquals("+OK\r\n", send("FLUSHALL"));
        assertEquals(":0\r\n", send("DBSIZE"));
    }

    @Test
    void testErrors() {
        assertTrue(send("NOPE").startsWith("-ERR unknown command 'nope'"));
        assertTrue(send("GET").startsWith("-ERR wrong number of arguments"));
        assertTrue(send("SET", "k", "v", "PX", "soon").startsWith("-ERR value is not an integer"));
        assertTrue(send("SET", "k", "v", "PX", "-5").startsWith("-ERR invalid expire time"));
        assertTrue(send("SET", "k", "v", "NX", "XX").startsWith("-ERR syntax error"));
        assertTrue(send("SET", "k", "v", "BOGUS").startsWith("-ERR syntax error"));
        assertEquals("$-1\r\n", send("GET", "k"));
    }

    @Test
    void testInfo() {
        send("SET", "k", "v");
        send("GET", "k");
        String info = send("INFO");
        assertTrue(info.contains("keys:1"), info);
        assertTrue(info.contains("hits:1"), info);
    }

    private String send(String... args) {
        StringBuilder resp = new StringBuilder("*").append(args.length).append("\r\n");
        for (String arg : args) {
            resp.append('$').append(arg.length()).append("\r\n").append(arg).append("\r\n");
        }
        channel.writeInbound(RESPCodecTest.buffer(resp.toString()));
        return RESPCodecTest.drain(channel);
    }
}
