package com.relay.service.monitoring;

import com.relay.config.RelayProperties;
import com.relay.model.routing.ModelKey;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;

/**
 * Compares a recent accuracy window against a baseline.
 *
 * Magnitude is the largest absolute change among cost, latency and quality accuracy. Drift is
 * reported only when the magnitude exceeds the threshold and a Welch test on per-sample overall
 * accuracy reaches the significance threshold.
 */
@Slf4j
@Component
public class DriftDetector {

    static final double ALERT_MAGNITUDE = 0.10;
    static final double FALLBACK_MAGNITUDE = 0.15;
    static final double PREFERENCE_MARGIN = 0.05;

    private final double driftThreshold;
    private final double significanceThreshold;
    private final int minSampleSize;

    public DriftDetector(RelayProperties properties) {
        RelayProperties.MonitoringConfig config = properties.getMonitoring();
        this.driftThreshold = config.getDriftThreshold();
        this.significanceThreshold = config.getSignificanceThreshold();
        this.minSampleSize = config.getMinSampleSize();
    }

    public DriftDetectionResult detect(ModelKey key,
                                       AccuracyMetrics baseline, List<Double> baselineSamples,
                                       AccuracyMetrics current, List<Double> currentSamples,
                                       Instant now) {
        DriftDetectionResult.DriftDetectionResultBuilder result = DriftDetectionResult.builder()
                .key(key)
                .baseline(baseline)
                .current(current)
                .detectedAt(now);

        double costDrift = Math.abs(current.getCostAccuracy() - baseline.getCostAccuracy());
        double latencyDrift = Math.abs(current.getLatencyAccuracy() - baseline.getLatencyAccuracy());
        double qualityDrift = 0;
        if (current.getQualityAccuracy() != null && baseline.getQualityAccuracy() != null) {
            qualityDrift = Math.abs(current.getQualityAccuracy() - baseline.getQualityAccuracy());
        }
        double magnitude = Math.max(costDrift, Math.max(latencyDrift, qualityDrift));

        if (costDrift > driftThreshold) {
            result.affectedMetric("cost");
        }
        if (latencyDrift > driftThreshold) {
            result.affectedMetric("latency");
        }
        if (qualityDrift > driftThreshold) {
            result.affectedMetric("quality");
        }

        double significance = significance(baselineSamples, currentSamples);
        boolean detected = magnitude > driftThreshold && significance >= significanceThreshold;
        RecommendedAction action = detected ? actionFor(magnitude) : RecommendedAction.MONITOR;
        if (detected) {
            log.info("Drift on {}: magnitude={}, significance={}, action={}", key,
                    String.format("%.4f", magnitude), String.format("%.4f", significance), action);
        }

        return result
                .driftDetected(detected)
                .driftMagnitude(magnitude)
                .significance(significance)
                .recommendedAction(action)
                .build();
    }

    public ModelComparison compare(ModelKey baselineKey, AccuracyMetrics baseline, List<Double> baselineSamples,
                                   ModelKey comparisonKey, AccuracyMetrics comparison, List<Double> comparisonSamples) {
        ModelComparison.ModelComparisonBuilder result = ModelComparison.builder()
                .baseline(baselineKey)
                .comparison(comparisonKey);
        if (baseline == null || comparison == null) {
            return result.recommendation(ModelComparison.Recommendation.INSUFFICIENT_DATA).build();
        }

        double costDifference = comparison.getCostAccuracy() - baseline.getCostAccuracy();
        double latencyDifference = comparison.getLatencyAccuracy() - baseline.getLatencyAccuracy();
        Double qualityDifference = null;
        if (comparison.getQualityAccuracy() != null && baseline.getQualityAccuracy() != null) {
            qualityDifference = comparison.getQualityAccuracy() - baseline.getQualityAccuracy();
        }
        double overallDifference = comparison.getOverallAccuracy() - baseline.getOverallAccuracy();
        double significance = significance(baselineSamples, comparisonSamples);
        boolean significant = significance >= significanceThreshold;

        ModelComparison.Recommendation recommendation = ModelComparison.Recommendation.EQUIVALENT;
        if (Math.min(baselineSamples.size(), comparisonSamples.size()) < minSampleSize) {
            recommendation = ModelComparison.Recommendation.INSUFFICIENT_DATA;
        } else if (significant && overallDifference > PREFERENCE_MARGIN) {
            recommendation = ModelComparison.Recommendation.PREFER_COMPARISON;
        } else if (significant && overallDifference < -PREFERENCE_MARGIN) {
            recommendation = ModelComparison.Recommendation.PREFER_BASELINE;
        }

        return result
                .costDifference(costDifference)
                .latencyDifference(latencyDifference)
                .qualityDifference(qualityDifference)
                .significant(significant)
                .confidence(significance)
                .recommendation(recommendation)
                .build();
    }

    RecommendedAction actionFor(double magnitude) {
        if (magnitude > FALLBACK_MAGNITUDE) {
            return RecommendedAction.FALLBACK;
        }
        if (magnitude > ALERT_MAGNITUDE) {
            return RecommendedAction.ALERT;
        }
        if (magnitude > driftThreshold) {
            return RecommendedAction.INVESTIGATE;
        }
        return RecommendedAction.MONITOR;
    }

    /**
     * Zero below the minimum sample size on either side.
     */
    double significance(List<Double> a, List<Double> b) {
        if (Math.min(a.size(), b.size()) < minSampleSize) {
            return 0.0;
        }
        return StatisticalTests.welch(a, b).significance();
    }
}
