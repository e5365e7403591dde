package com.krishnamouli.cohort;

import com.krishnamouli.cohort.catalog.ExperimentCatalog;
import com.krishnamouli.cohort.catalog.ExperimentLoader;
import com.krishnamouli.cohort.config.CohortConfig;
import com.krishnamouli.cohort.config.CohortDefaults;
import com.krishnamouli.cohort.core.SegmentedTtlMap;
import com.krishnamouli.cohort.core.eviction.LRUEvictionPolicy;
import com.krishnamouli.cohort.engine.AssignmentEngine;
import com.krishnamouli.cohort.engine.BucketHasher;
import com.krishnamouli.cohort.events.EventRecorder;
import com.krishnamouli.cohort.events.EventSink;
import com.krishnamouli.cohort.events.InMemoryEventSink;
import com.krishnamouli.cohort.events.JsonLinesEventSink;
import com.krishnamouli.cohort.experiment.Experiment;
import com.krishnamouli.cohort.monitoring.MetricsCollector;
import com.krishnamouli.cohort.network.http.HTTPServer;
import com.krishnamouli.cohort.network.resp.RespStoreServer;
import com.krishnamouli.cohort.store.AssignmentStore;
import com.krishnamouli.cohort.store.AssignmentStores;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.List;

/**
 * Main entry point for Cohort - experiment assignment and tracking service.
 * Usage: {@code java -jar cohort.jar [config.json]}
 */
public class Main {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        logger.info("Cohort - experiment assignment service v1.0");

        CohortConfig config = new CohortConfig();

        // Parse command line arguments
        if (args.length > 0) {
            try {
                config = CohortConfig.load(Paths.get(args[0]));
            } catch (RuntimeException e) {
                logger.error("Cannot read configuration {}: {}", args[0], e.getMessage());
                System.exit(1);
            }
        }

        try {
            CohortDefaults.validate(config);
        } catch (IllegalArgumentException e) {
            logger.error("Invalid configuration: {}", e.getMessage());
            System.exit(1);
        }

        logger.info("Configuration: {}", config);

        // Load experiment definitions
        ExperimentLoader loader = new ExperimentLoader();
        List<Experiment> experiments = config.getExperimentsPath() != null
                ? loader.fromFile(Paths.get(config.getExperimentsPath()))
                : loader.fromResource(ExperimentLoader.DEFAULT_RESOURCE);
        ExperimentCatalog catalog = new ExperimentCatalog(experiments);

        // Shared store server, for other instances using the remote backend
        RespStoreServer storeServer = null;
        SegmentedTtlMap<byte[]> sharedStore = null;
        if (config.isEnableRespServer()) {
            logger.info("Initializing shared assignment store...");
            sharedStore = new SegmentedTtlMap<>(
                    config.getStoreSegments(),
                    config.getMaxStoreEntries(),
                    new LRUEvictionPolicy());
            storeServer = new RespStoreServer(config.getRespPort(), config.getWorkerThreads(), sharedStore);
        }

        logger.info("Initializing {} assignment store...", config.getStorageBackend().wireName());
        AssignmentStore store = AssignmentStores.create(config);

        MetricsCollector metrics = new MetricsCollector();

        EventSink sink;
        try {
            sink = config.getEventLogPath() != null
                    ? new JsonLinesEventSink(Paths.get(config.getEventLogPath()))
                    : new InMemoryEventSink(config.getEventBufferSize());
        } catch (IOException e) {
            logger.error("Cannot open event log {}", config.getEventLogPath(), e);
            System.exit(1);
            return;
        }
        EventRecorder recorder = new EventRecorder(sink, config.getEventQueueCapacity(), metrics);

        AssignmentEngine engine = new AssignmentEngine(
                config, catalog, store, BucketHasher.INSTANCE, metrics, Clock.systemUTC());

        HTTPServer httpServer = new HTTPServer(config, engine, recorder);

        // Graceful shutdown hook
        final RespStoreServer finalStoreServer = storeServer;
        final SegmentedTtlMap<byte[]> finalSharedStore = sharedStore;

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("Shutdown signal received, cleaning up...");

            httpServer.shutdown();
            if (finalStoreServer != null) {
                finalStoreServer.shutdown();
            }
            if (finalSharedStore != null) {
                finalSharedStore.shutdown();
            }

            recorder.shutdown();
            store.close();
            logger.info("Cohort shutdown complete");
        }));

        try {
            if (storeServer != null) {
                storeServer.start();
            }
            httpServer.start();

            logger.info("Cohort is ready: {} experiments ({} active), HTTP API on port {}",
                    catalog.size(), catalog.listActive(Clock.systemUTC().instant()).size(),
                    httpServer.getBoundPort());
            if (storeServer != null) {
                logger.info("Shared assignment store on port {} (try: redis-cli -p {})",
                        storeServer.getBoundPort(), storeServer.getBoundPort());
            }

            httpServer.awaitTermination();

        } catch (InterruptedException e) {
            logger.error("Server interrupted", e);
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            logger.error("Fatal error", e);
            System.exit(1);
        }
    }
}
