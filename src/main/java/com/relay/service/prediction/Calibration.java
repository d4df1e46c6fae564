package com.relay.service.prediction;

import lombok.Builder;
import lombok.Value;

/**
 * Immutable snapshot of what has been learned about one (provider, model).
 */
@Value
@Builder(toBuilder = true)
public class Calibration {

    public static final Calibration NEUTRAL = Calibration.builder().build();

    @Builder.Default
    double costCorrection = 1.0;

    @Builder.Default
    double latencyCorrection = 1.0;

    /** EMA of observed quality scores; null until one arrives. */
    Double observedQuality;

    int qualitySamples;

    /** Rolling quality-accuracy signal from the monitor, in [0, 1]; null until known. */
    Double qualityAccuracy;

    int sampleCount;

    /** Confidence multiplier; below 1 while a drift fallback is in effect. */
    @Builder.Default
    double driftPenalty = 1.0;

    /** Fresh samples still needed to lift the drift penalty. */
    int recoverySamplesRemaining;

    @Builder.Default
    QualityTrend qualityTrend = QualityTrend.STABLE;

    public boolean isPenalized() {
        return driftPenalty < 1.0;
    }
}
