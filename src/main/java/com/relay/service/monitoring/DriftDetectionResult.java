package com.relay.service.monitoring;

import com.relay.model.routing.ModelKey;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
public class DriftDetectionResult {

    ModelKey key;
    boolean driftDetected;
    double driftMagnitude;

    /** Subset of cost, latency, quality whose accuracy moved past the threshold. */
    @Singular
    List<String> affectedMetrics;

    double significance;
    RecommendedAction recommendedAction;
    AccuracyMetrics baseline;
    AccuracyMetrics current;
    Instant detectedAt;

    public static DriftDetectionResult noBaseline(ModelKey key, AccuracyMetrics current, Instant now) {
        return DriftDetectionResult.builder()
                .key(key)
                .recommendedAction(RecommendedAction.MONITOR)
                .current(current)
                .detectedAt(now)
                .build();
    }
}
