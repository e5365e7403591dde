package com.krishnamouli.cohort.store.remote;

import com.krishnamouli.cohort.catalog.ExperimentCatalog;
import com.krishnamouli.cohort.config.CohortConfig;
import com.krishnamouli.cohort.core.SegmentedTtlMap;
import com.krishnamouli.cohort.core.eviction.LRUEvictionPolicy;
import com.krishnamouli.cohort.engine.AssignmentEngine;
import com.krishnamouli.cohort.engine.BucketHasher;
import com.krishnamouli.cohort.experiment.Experiment;
import com.krishnamouli.cohort.monitoring.AssignmentOutcome;
import com.krishnamouli.cohort.monitoring.MetricsCollector;
import com.krishnamouli.cohort.network.resp.RespStoreServer;
import com.krishnamouli.cohort.store.Assignment;
import com.krishnamouli.cohort.store.StoreUnavailableException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.*;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Remote store against an in-process Redis-protocol server.
 */
class RemoteAssignmentStoreTest {

    private SegmentedTtlMap<byte[]> shared;
    private RespStoreServer server;
    private RemoteAssignmentStore store;

    @BeforeEach
    void setUp() throws InterruptedException {
        shared = new SegmentedTtlMap<>(4, 1000, new LRUEvictionPolicy(), Clock.systemUTC(), 0);
        server = new RespStoreServer(0, 1, shared);
        server.start();
        store = new RemoteAssignmentStore("127.0.0.1", server.getBoundPort(), "ab_", Duration.ofSeconds(2));
    }

    @AfterEach
    void tearDown() {
        store.close();
        server.shutdown();
    }

    @Test
    @Timeout(10)
    void testSetThenGet() {
        store.set("exp", "user-1", "B", Duration.ofMinutes(30));

        Assignment stored = store.get("exp", "user-1").orElseThrow();
        assertEquals("B", stored.getVariantId());
        assertNotNull(stored.getExpiresAt());

        byte[] raw = shared.get("ab_exp_user-1");
        assertNotNull(raw);
        assertTrue(new String(raw, StandardCharsets.UTF_8).contains("\"variantId\":\"B\""));
        long ttl = shared.ttlMillis("ab_exp_user-1");
        assertTrue(ttl > 0 && ttl <= Duration.ofMinutes(30).toMillis(), "ttl " + ttl);
    }

    @Test
    @Timeout(10)
    void testSetIsFirstWriterWins() {
        store.set("exp", "user-1", "A", Duration.ofMinutes(30));
        store.set("exp", "user-1", "B", Duration.ofMinutes(30));

        assertEquals("A", store.get("exp", "user-1").orElseThrow().getVariantId());
    }

    @Test
    @Timeout(10)
    void testPutOverwrites() {
        store.set("exp", "user-1", "A", Duration.ofMinutes(30));
        store.put("exp", "user-1", Assignment.of("C", Instant.now(), Duration.ZERO));

        assertEquals("C", store.get("exp", "user-1").orElseThrow().getVariantId());
        assertEquals(SegmentedTtlMap.NO_EXPIRY, shared.ttlMillis("ab_exp_user-1"));
    }

    @Test
    @Timeout(10)
    void testRemoveAndMissing() {
        assertTrue(store.get("exp", "nobody").isEmpty());

        store.set("exp", "user-1", "A", Duration.ofMinutes(30));
        assertTrue(store.remove("exp", "user-1"));
        assertFalse(store.remove("exp", "user-1"));
        assertTrue(store.get("exp", "user-1").isEmpty());
    }

    @Test
    @Timeout(10)
    void testCorruptRecordIsAbsent() {
        shared.put("ab_exp_user-1", "garbage".getBytes(StandardCharsets.UTF_8), 0);
        assertTrue(store.get("exp", "user-1").isEmpty());
    }

    @Test
    @Timeout(10)
    void testErrorReplyRaisesStoreUnavailable() {
        assertEquals("PONG", store.execute("PING"));
        assertThrows(StoreUnavailableException.class, () -> store.execute("NOSUCHCOMMAND"));
        // Connection stays usable after an error reply
        assertEquals("PONG", store.execute("PING"));
    }

    @Test
    @Timeout(20)
    void testConcurrentFirstAssignmentsConverge() throws Exception {
        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<String>> results = new ArrayList<>();

        for (int i = 0; i < threads; i++) {
            final String variant = "variant-" + i;
            results.add(executor.submit(() -> {
                start.await();
                store.set("exp", "user-1", variant, Duration.ofMinutes(30));
                return store.get("exp", "user-1").orElseThrow().getVariantId();
            }));
        }
        start.countDown();

        String winner = results.get(0).get(10, TimeUnit.SECONDS);
        for (Future<String> result : results) {
            assertEquals(winner, result.get(10, TimeUnit.SECONDS));
        }
        executor.shutdown();
    }

    @Test
    @Timeout(10)
    void testUnreachableServer() throws Exception {
        int closedPort;
        try (ServerSocket socket = new ServerSocket(0)) {
            closedPort = socket.getLocalPort();
        }
        RemoteAssignmentStore unreachable = new RemoteAssignmentStore(
                "127.0.0.1", closedPort, "ab_", Duration.ofMillis(500));
        try {
            assertThrows(StoreUnavailableException.class, () -> unreachable.get("exp", "user-1"));
            assertThrows(StoreUnavailableException.class,
                    () -> unreachable.set("exp", "user-1", "A", Duration.ofMinutes(1)));
        } finally {
            unreachable.close();
        }
    }

    @Test
    @Timeout(10)
    void testSilentServerIsBoundedByTimeout() throws Exception {
        // Accepts connections at the TCP level but never answers
        try (ServerSocket silent = new ServerSocket(0)) {
            RemoteAssignmentStore slow = new RemoteAssignmentStore(
                    "127.0.0.1", silent.getLocalPort(), "ab_", Duration.ofMillis(100));
            try {
                long started = System.nanoTime();
                assertThrows(StoreUnavailableException.class, () -> slow.get("exp", "user-1"));
                assertTrue(elapsedMillis(started) < 2000, "get took " + elapsedMillis(started) + "ms");

                started = System.nanoTime();
                assertThrows(StoreUnavailableException.class,
                        () -> slow.set("exp", "user-1", "A", Duration.ofMinutes(1)));
                assertTrue(elapsedMillis(started) < 2000, "set took " + elapsedMillis(started) + "ms");

                ExperimentCatalog catalog = new ExperimentCatalog();
                catalog.update(Experiment.builder("exp").variant("A", 50).variant("B", 50).build());
                MetricsCollector metrics = new MetricsCollector();
                AssignmentEngine engine = new AssignmentEngine(new CohortConfig(), catalog, slow,
                        BucketHasher.INSTANCE, metrics, Clock.systemUTC());

                started = System.nanoTime();
                assertNotNull(engine.assign("exp", "user-1"));
                assertTrue(elapsedMillis(started) < 2000, "assign took " + elapsedMillis(started) + "ms");
                assertEquals(1, metrics.getOutcomeCount(AssignmentOutcome.DEGRADED));
                assertEquals(2, metrics.getStoreFailures());
            } finally {
                slow.close();
            }
        }
    }

    @Test
    void testClosedStoreRejectsCommands() {
        store.close();
        assertThrows(StoreUnavailableException.class, () -> store.get("exp", "user-1"));
    }

    private static long elapsedMillis(long startedNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
    }
}
