package com.relay.service.monitoring;

import com.relay.model.routing.CandidatePrediction;
import com.relay.model.routing.ExecutionOutcome;
import lombok.Value;

/**
 * One prediction paired with what actually happened, with per-sample accuracies in [0, 1].
 */
@Value
public class PredictionSample {

    static final double MIN_COST = 0.001;
    static final double MIN_LATENCY_MS = 1.0;

    CandidatePrediction prediction;
    ExecutionOutcome outcome;

    double costAccuracy;
    double latencyAccuracy;

    /** Null when the outcome carried no quality score. */
    Double qualityAccuracy;

    double overallAccuracy;

    /** Whether the request ran on the model the router picked first. */
    boolean routedAsDecided;

    public static PredictionSample of(CandidatePrediction prediction, ExecutionOutcome outcome, boolean routedAsDecided) {
        double cost = relativeAccuracy(prediction.getPredictedCost(), outcome.getCost(), MIN_COST);
        double latency = relativeAccuracy(prediction.getPredictedLatencyMs(), outcome.getLatencyMs(), MIN_LATENCY_MS);
        Double quality = null;
        if (outcome.getQualityScore() != null) {
            quality = clamp(1 - Math.abs(prediction.getPredictedQuality() - outcome.getQualityScore()));
        }
        double overall = quality != null ? (cost + latency + quality) / 3 : (cost + latency) / 2;
        return new PredictionSample(prediction, outcome, cost, latency, quality, overall, routedAsDecided);
    }

    /**
     * {@code 1 - |predicted - actual| / max(actual, floor)}, clamped to [0, 1].
     */
    static double relativeAccuracy(double predicted, double actual, double floor) {
        return clamp(1 - Math.abs(predicted - actual) / Math.max(actual, floor));
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
