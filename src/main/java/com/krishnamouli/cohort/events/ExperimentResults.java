package com.krishnamouli.cohort.events;

import com.krishnamouli.cohort.experiment.ConversionGoal;
import com.krishnamouli.cohort.experiment.Experiment;

import java.time.Instant;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Raw per-variant counts over an experiment's events. Significance testing
 * belongs to the analytics side and is not computed here.
 *
 * <p>
 * An event counts as a conversion when its name is {@value #CONVERSION_EVENT}
 * or the id of one of the experiment's conversion goals.
 */
public class ExperimentResults {
    public static final String CONVERSION_EVENT = "conversion";

    private final String experimentId;
    private final long totalEvents;
    private final int totalParticipants;
    private final Map<String, VariantResults> variants;
    private final Instant lastUpdated;

    private ExperimentResults(String experimentId, long totalEvents, int totalParticipants,
            Map<String, VariantResults> variants, Instant lastUpdated) {
        this.experimentId = experimentId;
        this.totalEvents = totalEvents;
        this.totalParticipants = totalParticipants;
        this.variants = variants;
        this.lastUpdated = lastUpdated;
    }

    /**
     * @param experiment definition used to list every variant and the goal
     *                   ids; may be null for an experiment no longer in the
     *                   catalog
     */
    public static ExperimentResults summarize(String experimentId, Experiment experiment,
            List<TrackedEvent> events, Instant now) {
        Set<String> goalIds = new HashSet<>();
        Map<String, VariantResults> variants = new LinkedHashMap<>();
        if (experiment != null) {
            for (ConversionGoal goal : experiment.getConversionGoals()) {
                goalIds.add(goal.getId());
            }
            experiment.getVariants().forEach(v -> variants.put(v.getId(), new VariantResults()));
        }

        Set<String> participants = new HashSet<>();
        for (TrackedEvent event : events) {
            String participant = event.getSubjectId() != null ? event.getSubjectId() : event.getSessionId();
            participants.add(participant);

            VariantResults results = variants.computeIfAbsent(event.getVariantId(), id -> new VariantResults());
            results.add(event, participant,
                    CONVERSION_EVENT.equals(event.getEvent()) || goalIds.contains(event.getEvent()));
        }

        return new ExperimentResults(experimentId, events.size(), participants.size(), variants, now);
    }

    public String getExperimentId() {
        return experimentId;
    }

    public long getTotalEvents() {
        return totalEvents;
    }

    public int getTotalParticipants() {
        return totalParticipants;
    }

    public Map<String, VariantResults> getVariants() {
        return variants;
    }

    public Instant getLastUpdated() {
        return lastUpdated;
    }

    public static class VariantResults {
        private final Set<String> participantIds = new HashSet<>();
        private final Set<String> sessionIds = new HashSet<>();
        private final Map<String, Long> events = new TreeMap<>();
        private long conversions;

        void add(TrackedEvent event, String participant, boolean conversion) {
            participantIds.add(participant);
            sessionIds.add(event.getSessionId());
            events.merge(event.getEvent(), 1L, Long::sum);
            if (conversion) {
                conversions++;
            }
        }

        public int getParticipants() {
            return participantIds.size();
        }

        public int getSessions() {
            return sessionIds.size();
        }

        public long getConversions() {
            return conversions;
        }

        public double getConversionRate() {
            return participantIds.isEmpty() ? 0.0 : (double) conversions / participantIds.size();
        }

        public Map<String, Long> getEvents() {
            return events;
        }
    }
}
