package com.relay.service.monitoring;

import com.relay.config.RelayProperties;
import com.relay.model.routing.ModelKey;
import com.relay.model.routing.ProviderType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class DriftDetectorTest {

    private static final ModelKey KEY = ModelKey.of(ProviderType.GOOGLE, "gemini-1.5-pro");
    private static final ModelKey OTHER = ModelKey.of(ProviderType.OPENAI, "gpt-4o-mini");
    private static final Instant NOW = Instant.parse("2024-03-10T12:00:00Z");

    private final DriftDetector detector = new DriftDetector(new RelayProperties());

    private static AccuracyMetrics metrics(double cost, double latency, Double quality, int samples) {
        double overall = quality != null ? (cost + latency + quality) / 3 : (cost + latency) / 2;
        return AccuracyMetrics.builder()
                .costAccuracy(cost)
                .latencyAccuracy(latency)
                .qualityAccuracy(quality)
                .overallAccuracy(overall)
                .sampleSize(samples)
                .computedAt(NOW)
                .build();
    }

    /** Samples alternating around {@code center} so the variance is non-zero. */
    private static List<Double> samples(double center, int n) {
        List<Double> values = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            values.add(center + (i % 2 == 0 ? 0.01 : -0.01));
        }
        return values;
    }

    @Nested
    @DisplayName("Drift detection")
    class Detection {

        @Test
        @DisplayName("should report significant drift with the affected metrics")
        void significantDrift() {
            DriftDetectionResult result = detector.detect(KEY,
                    metrics(0.95, 0.95, null, 20), samples(0.95, 20),
                    metrics(0.70, 0.94, null, 20), samples(0.82, 20),
                    NOW);

            assertThat(result.isDriftDetected()).isTrue();
            assertThat(result.getDriftMagnitude()).isCloseTo(0.25, within(1e-9));
            assertThat(result.getAffectedMetrics()).containsExactly("cost");
            assertThat(result.getSignificance()).isGreaterThanOrEqualTo(0.95);
            assertThat(result.getRecommendedAction()).isEqualTo(RecommendedAction.FALLBACK);
        }

        @Test
        @DisplayName("should not report drift without enough samples")
        void tooFewSamples() {
            DriftDetectionResult result = detector.detect(KEY,
                    metrics(0.95, 0.95, null, 20), samples(0.95, 20),
                    metrics(0.70, 0.95, null, 5), samples(0.82, 5),
                    NOW);

            assertThat(result.isDriftDetected()).isFalse();
            assertThat(result.getSignificance()).isZero();
            assertThat(result.getRecommendedAction()).isEqualTo(RecommendedAction.MONITOR);
        }

        @Test
        @DisplayName("should not report drift that stays under the threshold")
        void smallChange() {
            DriftDetectionResult result = detector.detect(KEY,
                    metrics(0.95, 0.95, 0.9, 20), samples(0.95, 20),
                    metrics(0.93, 0.96, 0.88, 20), samples(0.80, 20),
                    NOW);

            assertThat(result.isDriftDetected()).isFalse();
            assertThat(result.getAffectedMetrics()).isEmpty();
        }

        @Test
        @DisplayName("should not report drift when the samples are indistinguishable")
        void notSignificant() {
            List<Double> baseline = samples(0.9, 20);
            List<Double> current = new ArrayList<>(baseline);
            Collections.reverse(current);

            DriftDetectionResult result = detector.detect(KEY,
                    metrics(0.95, 0.85, null, 20), baseline,
                    metrics(0.85, 0.95, null, 20), current,
                    NOW);

            assertThat(result.getDriftMagnitude()).isGreaterThan(0.05);
            assertThat(result.isDriftDetected()).isFalse();
        }

        @Test
        @DisplayName("should escalate the action with the magnitude")
        void actions() {
            assertThat(detector.actionFor(0.03)).isEqualTo(RecommendedAction.MONITOR);
            assertThat(detector.actionFor(0.07)).isEqualTo(RecommendedAction.INVESTIGATE);
            assertThat(detector.actionFor(0.12)).isEqualTo(RecommendedAction.ALERT);
            assertThat(detector.actionFor(0.20)).isEqualTo(RecommendedAction.FALLBACK);
        }
    }

    @Nested
    @DisplayName("Model comparison")
    class Comparison {

        @Test
        @DisplayName("should need history for both models")
        void missingHistory() {
            ModelComparison comparison = detector.compare(KEY, null, List.of(),
                    OTHER, metrics(0.9, 0.9, null, 20), samples(0.9, 20));

            assertThat(comparison.getRecommendation()).isEqualTo(ModelComparison.Recommendation.INSUFFICIENT_DATA);
        }

        @Test
        @DisplayName("should need the minimum sample size on both sides")
        void fewSamples() {
            ModelComparison comparison = detector.compare(KEY, metrics(0.6, 0.6, null, 3), samples(0.6, 3),
                    OTHER, metrics(0.9, 0.9, null, 20), samples(0.9, 20));

            assertThat(comparison.getRecommendation()).isEqualTo(ModelComparison.Recommendation.INSUFFICIENT_DATA);
        }

        @Test
        @DisplayName("should prefer the significantly more accurate model")
        void prefers() {
            ModelComparison comparison = detector.compare(KEY, metrics(0.6, 0.6, 0.8, 20), samples(0.67, 20),
                    OTHER, metrics(0.9, 0.9, 0.7, 20), samples(0.83, 20));

            assertThat(comparison.getRecommendation()).isEqualTo(ModelComparison.Recommendation.PREFER_COMPARISON);
            assertThat(comparison.isSignificant()).isTrue();
            assertThat(comparison.getCostDifference()).isCloseTo(0.3, within(1e-9));
            assertThat(comparison.getQualityDifference()).isCloseTo(-0.1, within(1e-9));

            ModelComparison reversed = detector.compare(OTHER, metrics(0.9, 0.9, 0.7, 20), samples(0.83, 20),
                    KEY, metrics(0.6, 0.6, 0.8, 20), samples(0.67, 20));
            assertThat(reversed.getRecommendation()).isEqualTo(ModelComparison.Recommendation.PREFER_BASELINE);
        }

        @Test
        @DisplayName("should call close models equivalent")
        void equivalent() {
            ModelComparison comparison = detector.compare(KEY, metrics(0.9, 0.9, null, 20), samples(0.9, 20),
                    OTHER, metrics(0.91, 0.9, null, 20), samples(0.9, 20));

            assertThat(comparison.getRecommendation()).isEqualTo(ModelComparison.Recommendation.EQUIVALENT);
            assertThat(comparison.getQualityDifference()).isNull();
        }
    }
}
