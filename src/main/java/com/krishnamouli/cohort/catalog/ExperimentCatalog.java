package com.krishnamouli.cohort.catalog;

import com.krishnamouli.cohort.experiment.Experiment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Registry of experiment definitions.
 *
 * <p>
 * Readers see an immutable snapshot through a volatile reference; writers
 * build a new snapshot under the instance lock and swap it in, so an
 * in-flight assignment never observes a half-applied update.
 */
public class ExperimentCatalog {
    private static final Logger logger = LoggerFactory.getLogger(ExperimentCatalog.class);

    private volatile Map<String, Experiment> snapshot = Collections.emptyMap();

    public ExperimentCatalog() {
    }

    public ExperimentCatalog(Collection<Experiment> experiments) {
        load(experiments);
    }

    /**
     * Merges definitions into the registry. An experiment with a known id
     * replaces the previous definition, so loading the same list twice is a
     * no-op.
     */
    public synchronized void load(Collection<Experiment> experiments) {
        Map<String, Experiment> next = new LinkedHashMap<>(snapshot);
        for (Experiment experiment : experiments) {
            next.put(experiment.getId(), experiment);
        }
        snapshot = Collections.unmodifiableMap(next);
        logger.info("Experiment catalog loaded: {} definitions, {} total", experiments.size(), next.size());
    }

    public Optional<Experiment> get(String experimentId) {
        if (experimentId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(snapshot.get(experimentId));
    }

    /**
     * Experiments that are active and inside their date window at {@code now}.
     */
    public List<Experiment> listActive(Instant now) {
        List<Experiment> active = new ArrayList<>();
        for (Experiment experiment : snapshot.values()) {
            if (experiment.isRunningAt(now)) {
                active.add(experiment);
            }
        }
        return active;
    }

    public synchronized void update(Experiment experiment) {
        Map<String, Experiment> next = new LinkedHashMap<>(snapshot);
        Experiment previous = next.put(experiment.getId(), experiment);
        snapshot = Collections.unmodifiableMap(next);
        logger.info("Experiment {} {}", experiment.getId(), previous == null ? "added" : "updated");
    }

    public synchronized boolean remove(String experimentId) {
        if (!snapshot.containsKey(experimentId)) {
            return false;
        }
        Map<String, Experiment> next = new LinkedHashMap<>(snapshot);
        next.remove(experimentId);
        snapshot = Collections.unmodifiableMap(next);
        logger.info("Experiment {} removed", experimentId);
        return true;
    }

    public Collection<Experiment> all() {
        return snapshot.values();
    }

    public int size() {
        return snapshot.size();
    }
}
