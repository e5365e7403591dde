package com.krishnamouli.cohort.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.krishnamouli.cohort.catalog.ExperimentCatalog;
import com.krishnamouli.cohort.config.CohortConfig;
import com.krishnamouli.cohort.experiment.Experiment;
import com.krishnamouli.cohort.experiment.ExperimentStatus;
import com.krishnamouli.cohort.experiment.TargetAudience;
import com.krishnamouli.cohort.experiment.Variant;
import com.krishnamouli.cohort.monitoring.AssignmentOutcome;
import com.krishnamouli.cohort.monitoring.MetricsCollector;
import com.krishnamouli.cohort.store.Assignment;
import com.krishnamouli.cohort.store.AssignmentStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves the variant a subject sees in an experiment.
 *
 * <p>
 * Order of checks: kill switch, catalog lookup, audience targeting, sticky
 * lookup, deterministic selection, persistence. Selection hashes
 * {@code experimentId + "-" + subjectId}, so every instance computes the same
 * variant for the same subject without coordination; the store only keeps a
 * subject on its variant when allocations change later.
 *
 * <p>
 * Store failures never reach the caller. A failed read is treated as a miss
 * and a failed write still returns the computed variant.
 */
public class AssignmentEngine {
    private static final Logger logger = LoggerFactory.getLogger(AssignmentEngine.class);

    private final CohortConfig config;
    private final ExperimentCatalog catalog;
    private final AssignmentStore store;
    private final Bucketer bucketer;
    private final MetricsCollector metrics;
    private final Clock clock;

    public AssignmentEngine(CohortConfig config, ExperimentCatalog catalog, AssignmentStore store) {
        this(config, catalog, store, BucketHasher.INSTANCE, new MetricsCollector(), Clock.systemUTC());
    }

    public AssignmentEngine(CohortConfig config, ExperimentCatalog catalog, AssignmentStore store,
            Bucketer bucketer, MetricsCollector metrics, Clock clock) {
        this.config = config;
        this.catalog = catalog;
        this.store = store;
        this.bucketer = bucketer;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Engine sharing this one's catalog, configuration and metrics but
     * persisting to {@code requestStore}. Used for stores scoped to a single
     * request, such as one backed by the caller's cookies.
     */
    public AssignmentEngine withStore(AssignmentStore requestStore) {
        return new AssignmentEngine(config, catalog, requestStore, bucketer, metrics, clock);
    }

    public String assign(String experimentId, String subjectId) {
        return assign(experimentId, subjectId, AssignmentContext.empty());
    }

    /**
     * @return assigned variant id, or null when the subject should get the
     *         default experience (disabled, unknown or inactive experiment,
     *         not eligible, no variants)
     */
    public String assign(String experimentId, String subjectId, AssignmentContext context) {
        long start = System.nanoTime();
        AssignmentContext ctx = context != null ? context : AssignmentContext.empty();

        if (!config.isEnabled()) {
            metrics.recordAssignment(AssignmentOutcome.DISABLED, System.nanoTime() - start);
            return null;
        }

        Optional<Experiment> found = catalog.get(experimentId);
        if (found.isEmpty() || found.get().getStatus() != ExperimentStatus.ACTIVE) {
            metrics.recordAssignment(AssignmentOutcome.NOT_FOUND, System.nanoTime() - start);
            return null;
        }
        Experiment experiment = found.get();

        if (!isEligible(experiment, subjectId, ctx)) {
            metrics.recordAssignment(AssignmentOutcome.INELIGIBLE, System.nanoTime() - start);
            return null;
        }

        Optional<Assignment> existing = lookup(experimentId, subjectId);
        if (existing.isPresent()) {
            metrics.recordAssignment(AssignmentOutcome.STICKY, System.nanoTime() - start);
            return existing.get().getVariantId();
        }

        Variant variant = VariantSelector.select(
                experiment.getVariants(), bucketer.bucket(experimentId + "-" + subjectId));
        if (variant == null) {
            logger.warn("Experiment {} has no variants", experimentId);
            metrics.recordAssignment(AssignmentOutcome.NO_VARIANTS, System.nanoTime() - start);
            return null;
        }

        boolean persisted = persist(experimentId, subjectId, variant.getId());
        metrics.recordAssignment(persisted ? AssignmentOutcome.ASSIGNED : AssignmentOutcome.DEGRADED,
                System.nanoTime() - start);
        return variant.getId();
    }

    /**
     * {@link #assign} with a fallback for the default experience.
     */
    public String getVariant(String experimentId, String subjectId, AssignmentContext context,
            String defaultVariant) {
        String variantId = assign(experimentId, subjectId, context);
        return variantId != null ? variantId : defaultVariant;
    }

    /**
     * Assigns the subject to every experiment currently running.
     *
     * @return experimentId to variantId in catalog order, only for experiments
     *         that produced an assignment
     */
    public Map<String, String> assignAll(String subjectId, AssignmentContext context) {
        Map<String, String> assignments = new LinkedHashMap<>();
        for (Experiment experiment : catalog.listActive(clock.instant())) {
            String variantId = assign(experiment.getId(), subjectId, context);
            if (variantId != null) {
                assignments.put(experiment.getId(), variantId);
            }
        }
        return assignments;
    }

    /**
     * @return config map of the variant, or null if either id is unknown
     */
    public Map<String, JsonNode> getVariantConfig(String experimentId, String variantId) {
        return catalog.get(experimentId)
                .flatMap(experiment -> experiment.findVariant(variantId))
                .map(Variant::getConfig)
                .orElse(null);
    }

    public ExperimentCatalog getCatalog() {
        return catalog;
    }

    public AssignmentStore getStore() {
        return store;
    }

    public MetricsCollector getMetrics() {
        return metrics;
    }

    public CohortConfig getConfig() {
        return config;
    }

    private boolean isEligible(Experiment experiment, String subjectId, AssignmentContext ctx) {
        TargetAudience audience = experiment.getTargetAudience();
        if (audience == null) {
            return true;
        }

        if (!audience.getUserTypes().isEmpty() && ctx.getUserType() != null
                && !audience.getUserTypes().contains(ctx.getUserType())) {
            return false;
        }

        if (!audience.getLocations().isEmpty() && ctx.getLocation() != null
                && !audience.getLocations().contains(ctx.getLocation())) {
            return false;
        }

        if (audience.getPercentage() < 100) {
            String rolloutKey = ctx.resolveRolloutKey(subjectId);
            return bucketer.bucket(experiment.getId() + "-" + rolloutKey) < audience.getPercentage();
        }
        return true;
    }

    private Optional<Assignment> lookup(String experimentId, String subjectId) {
        try {
            return store.get(experimentId, subjectId);
        } catch (RuntimeException e) {
            metrics.recordStoreFailure();
            logger.warn("Assignment lookup failed for {}/{}, assigning without it: {}",
                    experimentId, subjectId, e.toString());
            return Optional.empty();
        }
    }

    private boolean persist(String experimentId, String subjectId, String variantId) {
        try {
            store.set(experimentId, subjectId, variantId, config.sessionTimeout());
            return true;
        } catch (RuntimeException e) {
            metrics.recordStoreFailure();
            logger.warn("Assignment write failed for {}/{}, returning {} unpersisted: {}",
                    experimentId, subjectId, variantId, e.toString());
            return false;
        }
    }
}
