package com.relay.service.experiment;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Statistical read-out of an experiment on its primary metric, with secondary metrics alongside.
 */
@Value
@Builder
public class ExperimentAnalysis {

    String experimentId;
    AnalysisStatus status;
    MetricComparison primary;
    /** Mean of B minus mean of A on the primary metric. */
    double effect;
    double confidence;
    /** 95% interval for {@link #effect}. */
    double confidenceIntervalLow;
    double confidenceIntervalHigh;
    Map<ExperimentMetric, MetricComparison> secondary;
    Recommendation recommendation;
    String reason;
    Instant analyzedAt;

    public boolean isSignificant() {
        return primary != null && primary.isSignificant();
    }
}
