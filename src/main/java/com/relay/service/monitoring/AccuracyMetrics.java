package com.relay.service.monitoring;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Prediction accuracy over a window of samples for one (provider, model).
 */
@Value
@Builder(toBuilder = true)
public class AccuracyMetrics {

    static final double Z_95 = 1.96;

    double costAccuracy;
    double latencyAccuracy;

    /** Null until some outcome carried a quality score. */
    Double qualityAccuracy;

    double overallAccuracy;
    double providerMatchRate;
    int sampleSize;

    double confidenceLow;
    double confidenceHigh;

    Instant computedAt;

    public static AccuracyMetrics empty(Instant now) {
        return AccuracyMetrics.builder()
                .confidenceLow(0)
                .confidenceHigh(1)
                .computedAt(now)
                .build();
    }

    /**
     * Build metrics from running sums. Overall accuracy is the mean of the metric accuracies available.
     */
    static AccuracyMetrics fromSums(double costSum, double latencySum, double qualitySum, int qualityCount,
                                    int matchCount, int sampleSize, Instant now) {
        if (sampleSize == 0) {
            return empty(now);
        }
        double cost = costSum / sampleSize;
        double latency = latencySum / sampleSize;
        Double quality = qualityCount > 0 ? qualitySum / qualityCount : null;
        double overall = quality != null ? (cost + latency + quality) / 3 : (cost + latency) / 2;

        double low = 0;
        double high = 1;
        if (sampleSize >= 2) {
            double margin = Z_95 * Math.sqrt(overall * (1 - overall) / sampleSize);
            low = Math.max(0, overall - margin);
            high = Math.min(1, overall + margin);
        }

        return AccuracyMetrics.builder()
                .costAccuracy(round(cost))
                .latencyAccuracy(round(latency))
                .qualityAccuracy(quality != null ? round(quality) : null)
                .overallAccuracy(round(overall))
                .providerMatchRate(round((double) matchCount / sampleSize))
                .sampleSize(sampleSize)
                .confidenceLow(low)
                .confidenceHigh(high)
                .computedAt(now)
                .build();
    }

    private static double round(double value) {
        return Math.round(value * 10000) / 10000.0;
    }
}
