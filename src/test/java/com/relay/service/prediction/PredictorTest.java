package com.relay.service.prediction;

import com.relay.config.RelayProperties;
import com.relay.model.routing.CandidatePrediction;
import com.relay.model.routing.CapabilityClass;
import com.relay.model.routing.ModelKey;
import com.relay.model.routing.ProviderType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class PredictorTest {

    private static final ModelProfile PROFILE = ModelProfile.builder()
            .provider(ProviderType.OPENAI)
            .model("gpt-4o")
            .inputCostPer1k(0.001)
            .outputCostPer1k(0.002)
            .baseLatencyMs(1000)
            .latencyPerTokenMs(2)
            .baselineQuality(0.8)
            .capability(CapabilityClass.CHAT)
            .build();

    private CalibrationStore calibrationStore;
    private Predictor predictor;

    @BeforeEach
    void setUp() {
        RelayProperties properties = new RelayProperties();
        calibrationStore = new CalibrationStore(properties);
        predictor = new Predictor(new RequestFeatureExtractor(), calibrationStore, properties);
    }

    private static RequestFeatures features(double complexity) {
        return RequestFeatures.builder()
                .promptTokens(1000)
                .estimatedCompletionTokens(500)
                .messageCount(1)
                .complexityScore(complexity)
                .capability(CapabilityClass.CHAT)
                .build();
    }

    @Nested
    @DisplayName("Uncalibrated predictions")
    class Uncalibrated {

        @Test
        @DisplayName("should price prompt and completion tokens from the profile")
        void cost() {
            CandidatePrediction prediction = predictor.predictOne(features(0), PROFILE);

            assertThat(prediction.getPredictedCost()).isCloseTo(0.002, within(1e-12));
            assertThat(prediction.getBaseCost()).isCloseTo(0.002, within(1e-12));
        }

        @Test
        @DisplayName("should scale latency with completion tokens and complexity")
        void latency() {
            assertThat(predictor.predictOne(features(0), PROFILE).getPredictedLatencyMs()).isEqualTo(2000);
            assertThat(predictor.predictOne(features(1.0), PROFILE).getPredictedLatencyMs()).isEqualTo(2600);
        }

        @Test
        @DisplayName("should start at base confidence with a wide interval")
        void confidence() {
            CandidatePrediction prediction = predictor.predictOne(features(0), PROFILE);

            assertThat(prediction.getConfidence()).isEqualTo(0.5);
            assertThat(prediction.getPredictedQuality()).isEqualTo(0.8);
            assertThat(prediction.getCostLow()).isCloseTo(0.001, within(1e-12));
            assertThat(prediction.getCostHigh()).isCloseTo(0.003, within(1e-12));
            assertThat(prediction.getLatencyLowMs()).isEqualTo(1000);
            assertThat(prediction.getLatencyHighMs()).isEqualTo(3000);
        }
    }

    @Nested
    @DisplayName("Calibrated predictions")
    class Calibrated {

        @Test
        @DisplayName("should apply learned cost and latency corrections")
        void corrections() {
            calibrationStore.recordObservation(PROFILE.key(), 0.002, 0.004, 2000, 4000, null);

            CandidatePrediction prediction = predictor.predictOne(features(0), PROFILE);

            assertThat(prediction.getPredictedCost()).isCloseTo(0.0022, within(1e-9));
            assertThat(prediction.getPredictedLatencyMs()).isEqualTo(2200);
            assertThat(prediction.getBaseCost()).isCloseTo(0.002, within(1e-12));
            assertThat(prediction.getSampleSize()).isEqualTo(1);
        }

        @Test
        @DisplayName("should reach full confidence after enough samples")
        void fullConfidence() {
            for (int i = 0; i < 20; i++) {
                calibrationStore.recordObservation(PROFILE.key(), 0.002, 0.002, 2000, 2000, null);
            }

            assertThat(predictor.predictOne(features(0), PROFILE).getConfidence()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("should halve confidence while a drift penalty is in effect")
        void driftPenalty() {
            calibrationStore.penalize(PROFILE.key());

            assertThat(predictor.predictOne(features(0), PROFILE).getConfidence()).isEqualTo(0.25);
        }

        @Test
        @DisplayName("should shrink quality toward the midpoint when quality accuracy is low")
        void qualityShrink() {
            Calibration calibration = Calibration.builder().qualityAccuracy(0.5).build();

            assertThat(predictor.quality(0.9, calibration)).isCloseTo(0.7, within(1e-9));
        }

        @Test
        @DisplayName("should blend observed quality into the baseline")
        void observedQuality() {
            Calibration calibration = Calibration.builder().observedQuality(0.4).qualitySamples(10).build();

            // weight 10/20
            assertThat(predictor.quality(0.8, calibration)).isCloseTo(0.6, within(1e-9));
        }
    }

    @Test
    @DisplayName("should order candidates by confidence then provider and model")
    void ordering() {
        ModelProfile other = ModelProfile.builder()
                .provider(ProviderType.ANTHROPIC)
                .model("claude-3-haiku")
                .inputCostPer1k(0.00025)
                .outputCostPer1k(0.00125)
                .baseLatencyMs(800)
                .latencyPerTokenMs(1)
                .baselineQuality(0.85)
                .capability(CapabilityClass.CHAT)
                .build();
        calibrationStore.recordObservation(ModelKey.of(ProviderType.ANTHROPIC, "claude-3-haiku"),
                0.001, 0.001, 1000, 1000, null);

        List<CandidatePrediction> predictions = predictor.predict(features(0), List.of(PROFILE, other));

        assertThat(predictions).extracting(CandidatePrediction::getModel)
                .containsExactly("claude-3-haiku", "gpt-4o");
    }
}
