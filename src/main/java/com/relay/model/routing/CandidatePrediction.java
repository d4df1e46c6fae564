package com.relay.model.routing;

import lombok.Builder;
import lombok.Value;

/**
 * Predicted cost, latency and quality of sending one request to one (provider, model).
 * Produced fresh per request.
 */
@Value
@Builder(toBuilder = true)
public class CandidatePrediction {

    ProviderType provider;
    String model;

    double predictedCost;
    long predictedLatencyMs;
    double predictedQuality;
    double confidence;

    double costLow;
    double costHigh;
    long latencyLowMs;
    long latencyHighMs;

    int sampleSize;

    /** Uncalibrated estimates, kept so observed outcomes can move the correction factors. */
    double baseCost;
    long baseLatencyMs;

    public ModelKey key() {
        return ModelKey.of(provider, model);
    }
}
