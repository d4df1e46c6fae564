package com.relay.service.experiment;

import com.relay.model.routing.Variant;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Read-only view of an experiment.
 */
@Value
@Builder
public class ExperimentSnapshot {

    ExperimentConfig config;
    ExperimentStatus status;
    Instant createdAt;
    Instant startedAt;
    Instant endedAt;
    String endReason;
    int samplesA;
    int samplesB;
    int participants;
    ExperimentAnalysis latestAnalysis;

    static ExperimentSnapshot of(Experiment experiment) {
        return ExperimentSnapshot.builder()
                .config(experiment.getConfig())
                .status(experiment.getStatus())
                .createdAt(experiment.getCreatedAt())
                .startedAt(experiment.getStartedAt())
                .endedAt(experiment.getEndedAt())
                .endReason(experiment.getEndReason())
                .samplesA(experiment.samples(Variant.A))
                .samplesB(experiment.samples(Variant.B))
                .participants(experiment.getAssignments().size())
                .latestAnalysis(experiment.getLatestAnalysis())
                .build();
    }
}
