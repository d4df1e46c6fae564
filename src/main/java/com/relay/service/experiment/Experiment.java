package com.relay.service.experiment;

import com.relay.model.routing.Variant;
import lombok.Getter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable state of one experiment. Guarded by the manager's lock.
 */
@Getter
class Experiment {

    private final ExperimentConfig config;
    private final Instant createdAt;
    private final Map<String, Variant> assignments = new HashMap<>();
    private List<ExperimentResult> results = new ArrayList<>();

    private ExperimentStatus status = ExperimentStatus.DRAFT;
    private Instant startedAt;
    private Instant endedAt;
    private String endReason;
    private ExperimentAnalysis latestAnalysis;
    private int resultsSinceAnalysis;

    Experiment(ExperimentConfig config, Instant createdAt) {
        this.config = config;
        this.createdAt = createdAt;
    }

    void start(Instant now) {
        if (startedAt == null) {
            startedAt = now;
        }
        status = ExperimentStatus.RUNNING;
    }

    void pause() {
        status = ExperimentStatus.PAUSED;
    }

    void finish(ExperimentStatus finalStatus, String reason, Instant now) {
        status = finalStatus;
        endReason = reason;
        endedAt = now;
    }

    boolean isExpired(Instant now) {
        return startedAt != null && now.isAfter(startedAt.plus(config.getMaxDuration()));
    }

    /**
     * Keep at most {@code max} results, trimming to the newest {@code retained} when over.
     */
    void addResult(ExperimentResult result, int max, int retained) {
        results.add(result);
        resultsSinceAnalysis++;
        if (results.size() > max) {
            results = new ArrayList<>(results.subList(results.size() - retained, results.size()));
        }
    }

    boolean hasUnanalyzedResults() {
        return resultsSinceAnalysis > 0;
    }

    void analyzed(ExperimentAnalysis analysis) {
        latestAnalysis = analysis;
        resultsSinceAnalysis = 0;
    }

    int samples(Variant variant) {
        return (int) results.stream().filter(r -> r.getVariant() == variant).count();
    }
}
