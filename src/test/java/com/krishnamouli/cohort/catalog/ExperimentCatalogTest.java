package com.krishnamouli.cohort.catalog;

import com.krishnamouli.cohort.experiment.Experiment;
import com.krishnamouli.cohort.experiment.ExperimentStatus;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class ExperimentCatalogTest {

    private static final Instant START = Instant.parse("2024-01-01T00:00:00Z");
    private static final Instant END = Instant.parse("2024-12-31T00:00:00Z");

    @Test
    void testLoadAndGet() {
        ExperimentCatalog catalog = new ExperimentCatalog(List.of(
                Experiment.builder("a").variant("control", 100).build(),
                Experiment.builder("b").variant("control", 100).build()));

        assertEquals(2, catalog.size());
        assertTrue(catalog.get("a").isPresent());
        assertTrue(catalog.get("unknown").isEmpty());
        assertTrue(catalog.get(null).isEmpty());
    }

    @Test
    void testLoadIsIdempotentAndMerges() {
        ExperimentCatalog catalog = new ExperimentCatalog();
        List<Experiment> batch = List.of(Experiment.builder("a").variant("control", 100).build());

        catalog.load(batch);
        catalog.load(batch);
        assertEquals(1, catalog.size());

        catalog.load(List.of(Experiment.builder("a").name("Renamed").variant("control", 100).build(),
                Experiment.builder("c").build()));
        assertEquals(2, catalog.size());
        assertEquals("Renamed", catalog.get("a").get().getName());
    }

    @Test
    void testListActiveHonoursStatusAndInclusiveWindow() {
        ExperimentCatalog catalog = new ExperimentCatalog(List.of(
                Experiment.builder("windowed").startDate(START).endDate(END).build(),
                Experiment.builder("open").build(),
                Experiment.builder("paused").status(ExperimentStatus.PAUSED).build()));

        assertEquals(List.of("open"), ids(catalog.listActive(START.minusSeconds(1))));
        assertEquals(List.of("windowed", "open"), ids(catalog.listActive(START)));
        assertEquals(List.of("windowed", "open"), ids(catalog.listActive(END)));
        assertEquals(List.of("open"), ids(catalog.listActive(END.plusMillis(1))));
    }

    @Test
    void testUpdateAndRemove() {
        ExperimentCatalog catalog = new ExperimentCatalog();
        Experiment original = Experiment.builder("a").variant("control", 100).build();
        catalog.update(original);
        catalog.update(original.toBuilder().status(ExperimentStatus.PAUSED).build());

        assertEquals(ExperimentStatus.PAUSED, catalog.get("a").get().getStatus());
        assertTrue(catalog.remove("a"));
        assertFalse(catalog.remove("a"));
        assertEquals(0, catalog.size());
    }

    @Test
    void testSnapshotIsImmutable() {
        ExperimentCatalog catalog = new ExperimentCatalog(List.of(Experiment.builder("a").build()));
        assertThrows(UnsupportedOperationException.class, () -> catalog.all().clear());
    }

    @Test
    @Timeout(10)
    void testReadersNeverSeeHalfAppliedUpdate() throws InterruptedException {
        ExperimentCatalog catalog = new ExperimentCatalog(List.of(
                Experiment.builder("exp").variant("A", 50).variant("B", 50).build()));
        AtomicBoolean running = new AtomicBoolean(true);
        AtomicInteger torn = new AtomicInteger();

        Thread reader = new Thread(() -> {
            while (running.get()) {
                Experiment experiment = catalog.get("exp").orElse(null);
                if (experiment == null || experiment.totalAllocation() != 100) {
                    torn.incrementAndGet();
                }
            }
        });
        reader.start();

        for (int i = 0; i < 10_000; i++) {
            int a = i % 101;
            catalog.update(Experiment.builder("exp").variant("A", a).variant("B", 100 - a).build());
        }
        running.set(false);
        reader.join();

        assertEquals(0, torn.get());
    }

    private static List<String> ids(List<Experiment> experiments) {
        return experiments.stream().map(Experiment::getId).collect(Collectors.toList());
    }
}
