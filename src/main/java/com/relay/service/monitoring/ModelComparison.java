package com.relay.service.monitoring;

import com.relay.model.routing.ModelKey;
import lombok.Builder;
import lombok.Value;

/**
 * Side-by-side prediction accuracy of two (provider, model) pairs. Differences are comparison minus baseline.
 */
@Value
@Builder
public class ModelComparison {

    public enum Recommendation {
        INSUFFICIENT_DATA,
        EQUIVALENT,
        PREFER_BASELINE,
        PREFER_COMPARISON
    }

    ModelKey baseline;
    ModelKey comparison;
    double costDifference;
    double latencyDifference;
    Double qualityDifference;
    boolean significant;
    double confidence;
    Recommendation recommendation;
}
