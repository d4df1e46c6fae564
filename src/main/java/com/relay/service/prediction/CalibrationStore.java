package com.relay.service.prediction;

import com.relay.config.RelayProperties;
import com.relay.model.routing.ModelKey;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Learned correction factors per (provider, model).
 *
 * The accuracy monitor's worker is the only writer. Readers get immutable {@link Calibration}
 * snapshots, so the predictor never needs a lock.
 */
@Slf4j
@Component
public class CalibrationStore {

    private static final double TREND_EPSILON = 0.01;

    private final Map<ModelKey, Calibration> calibrations = new ConcurrentHashMap<>();
    private final RelayProperties.PredictionConfig config;

    public CalibrationStore(RelayProperties properties) {
        this.config = properties.getPrediction();
    }

    public Calibration get(ModelKey key) {
        return calibrations.getOrDefault(key, Calibration.NEUTRAL);
    }

    public Map<ModelKey, Calibration> snapshot() {
        return Map.copyOf(calibrations);
    }

    /**
     * Move the correction factors toward {@code actual / base} and fold in an optional quality score.
     */
    public Calibration recordObservation(ModelKey key, double baseCost, double actualCost,
                                         long baseLatencyMs, long actualLatencyMs, Double qualityScore) {
        return calibrations.compute(key, (k, current) -> {
            Calibration c = current != null ? current : Calibration.NEUTRAL;
            Calibration.CalibrationBuilder next = c.toBuilder().sampleCount(c.getSampleCount() + 1);

            if (baseCost > 0 && actualCost >= 0) {
                next.costCorrection(ema(c.getCostCorrection(), actualCost / baseCost));
            }
            if (baseLatencyMs > 0 && actualLatencyMs > 0) {
                next.latencyCorrection(ema(c.getLatencyCorrection(), (double) actualLatencyMs / baseLatencyMs));
            }
            if (qualityScore != null) {
                applyQuality(c, qualityScore, next);
            }
            if (c.isPenalized()) {
                int remaining = c.getRecoverySamplesRemaining() - 1;
                if (remaining <= 0) {
                    log.info("Confidence penalty lifted for {} after fresh samples", k);
                    next.driftPenalty(1.0).recoverySamplesRemaining(0);
                } else {
                    next.recoverySamplesRemaining(remaining);
                }
            }
            return next.build();
        });
    }

    /**
     * Record the monitor's rolling quality-accuracy signal.
     */
    public void updateQualityAccuracy(ModelKey key, double qualityAccuracy) {
        double bounded = Math.max(0.0, Math.min(1.0, qualityAccuracy));
        calibrations.compute(key, (k, current) ->
                (current != null ? current : Calibration.NEUTRAL).toBuilder().qualityAccuracy(bounded).build());
    }

    /**
     * Reduce confidence for a pair after drift, until enough fresh samples arrive.
     */
    public void penalize(ModelKey key) {
        calibrations.compute(key, (k, current) -> (current != null ? current : Calibration.NEUTRAL).toBuilder()
                .driftPenalty(config.getDriftPenalty())
                .recoverySamplesRemaining(config.getDriftRecoverySamples())
                .build());
        log.warn("Confidence for {} penalized to {} until {} fresh samples arrive", key, config.getDriftPenalty(),
                config.getDriftRecoverySamples());
    }

    public void reset(ModelKey key) {
        calibrations.remove(key);
    }

    private void applyQuality(Calibration c, double qualityScore, Calibration.CalibrationBuilder next) {
        double score = Math.max(0.0, Math.min(1.0, qualityScore));
        Double previous = c.getObservedQuality();
        double updated = previous == null ? score : previous + config.getLearningRate() * (score - previous);
        QualityTrend trend = QualityTrend.STABLE;
        if (previous != null && updated - previous > TREND_EPSILON) {
            trend = QualityTrend.IMPROVING;
        } else if (previous != null && previous - updated > TREND_EPSILON) {
            trend = QualityTrend.DEGRADING;
        }
        next.observedQuality(updated).qualitySamples(c.getQualitySamples() + 1).qualityTrend(trend);
    }

    private double ema(double current, double target) {
        double updated = current + config.getLearningRate() * (target - current);
        return Math.max(config.getMinCorrection(), Math.min(config.getMaxCorrection(), updated));
    }
}
