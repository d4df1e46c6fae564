package com.relay.service.prediction;

import com.relay.config.RelayProperties;
import com.relay.model.routing.CandidatePrediction;
import com.relay.model.routing.RoutingRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Estimates cost, latency and quality for each eligible (provider, model).
 *
 * Strategy-agnostic: returns every candidate with its raw predictions. Ranking is the routing engine's job.
 */
@Slf4j
@Service
public class Predictor {

    static final double BASE_CONFIDENCE = 0.5;
    static final double COMPLEXITY_LATENCY_FACTOR = 0.3;

    private static final Comparator<CandidatePrediction> ORDER = Comparator
            .comparingDouble(CandidatePrediction::getConfidence).reversed()
            .thenComparing(CandidatePrediction::getProvider)
            .thenComparing(CandidatePrediction::getModel);

    private final RequestFeatureExtractor featureExtractor;
    private final CalibrationStore calibrationStore;
    private final int fullConfidenceSamples;

    public Predictor(RequestFeatureExtractor featureExtractor, CalibrationStore calibrationStore,
                     RelayProperties properties) {
        this.featureExtractor = featureExtractor;
        this.calibrationStore = calibrationStore;
        this.fullConfidenceSamples = Math.max(1, properties.getPrediction().getFullConfidenceSamples());
    }

    public List<CandidatePrediction> predict(RoutingRequest request, Collection<ModelProfile> eligible) {
        return predict(featureExtractor.extract(request), eligible);
    }

    public List<CandidatePrediction> predict(RequestFeatures features, Collection<ModelProfile> eligible) {
        List<CandidatePrediction> predictions = eligible.stream()
                .map(profile -> predictOne(features, profile))
                .sorted(ORDER)
                .toList();
        log.debug("Predicted {} candidates (promptTokens={}, completionTokens={}, capability={})",
                predictions.size(), features.getPromptTokens(), features.getEstimatedCompletionTokens(),
                features.getCapability());
        return predictions;
    }

    CandidatePrediction predictOne(RequestFeatures features, ModelProfile profile) {
        Calibration calibration = calibrationStore.get(profile.key());

        double baseCost = profile.costFor(features.getPromptTokens(), features.getEstimatedCompletionTokens());
        long baseLatency = Math.round(profile.latencyFor(features.getEstimatedCompletionTokens())
                * (1 + COMPLEXITY_LATENCY_FACTOR * features.getComplexityScore()));

        double cost = baseCost * calibration.getCostCorrection();
        long latency = Math.round(baseLatency * calibration.getLatencyCorrection());
        double quality = quality(profile.getBaselineQuality(), calibration);
        double confidence = confidence(calibration);
        double spread = 1.0 - confidence;

        return CandidatePrediction.builder()
                .provider(profile.getProvider())
                .model(profile.getModel())
                .predictedCost(cost)
                .predictedLatencyMs(latency)
                .predictedQuality(quality)
                .confidence(confidence)
                .costLow(Math.max(0, cost * (1 - spread)))
                .costHigh(cost * (1 + spread))
                .latencyLowMs(Math.max(0, Math.round(latency * (1 - spread))))
                .latencyHighMs(Math.round(latency * (1 + spread)))
                .sampleSize(calibration.getSampleCount())
                .baseCost(baseCost)
                .baseLatencyMs(baseLatency)
                .build();
    }

    double quality(double baseline, Calibration calibration) {
        double blended = baseline;
        if (calibration.getObservedQuality() != null) {
            double weight = Math.min(1.0, (double) calibration.getQualitySamples() / fullConfidenceSamples);
            blended = (1 - weight) * baseline + weight * calibration.getObservedQuality();
        }
        if (calibration.getQualityAccuracy() != null) {
            // Untrustworthy quality predictions shrink toward the midpoint
            blended = 0.5 + (blended - 0.5) * calibration.getQualityAccuracy();
        }
        return Math.max(0.0, Math.min(1.0, blended));
    }

    double confidence(Calibration calibration) {
        double fromSamples = BASE_CONFIDENCE
                + (1 - BASE_CONFIDENCE) * Math.min(1.0, (double) calibration.getSampleCount() / fullConfidenceSamples);
        return Math.max(0.0, Math.min(1.0, fromSamples * calibration.getDriftPenalty()));
    }
}
