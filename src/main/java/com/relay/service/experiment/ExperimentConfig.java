package com.relay.service.experiment;

import com.relay.model.routing.CapabilityClass;
import com.relay.model.routing.Variant;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.util.List;
import java.util.Set;

/**
 * Definition of a two-variant routing experiment.
 */
@Value
@Builder(toBuilder = true)
public class ExperimentConfig {

    static final int MIN_SAMPLE_SIZE_FLOOR = 10;
    private static final double WEIGHT_TOLERANCE = 1e-9;

    String id;
    String name;
    String description;
    String hypothesis;

    ExperimentVariant variantA;
    ExperimentVariant variantB;

    @Builder.Default
    int minSampleSize = 30;
    @Builder.Default
    Duration maxDuration = Duration.ofDays(7);
    /** Alpha: the p-value below which a difference counts as significant. */
    @Builder.Default
    double significanceLevel = 0.05;
    /** Share of eligible requests that take part. */
    @Builder.Default
    double trafficAllocation = 1.0;

    /** Request types that take part; empty means all. */
    @Singular
    Set<CapabilityClass> capabilities;

    @Builder.Default
    ExperimentMetric primaryMetric = ExperimentMetric.COST;
    @Singular
    List<ExperimentMetric> secondaryMetrics;

    @Builder.Default
    boolean autoStop = true;
    /** Confidence at which a significant winner completes the experiment. */
    @Builder.Default
    double winnerThreshold = 0.95;

    /**
     * @throws IllegalArgumentException describing the first problem found
     */
    public void validate() {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Experiment id is required");
        }
        if (variantA == null || variantB == null) {
            throw new IllegalArgumentException("Both variants are required");
        }
        if (variantA.key().equals(variantB.key())) {
            throw new IllegalArgumentException("Variants must route to different models");
        }
        if (variantA.getWeight() < 0 || variantB.getWeight() < 0
                || Math.abs(variantA.getWeight() + variantB.getWeight() - 1.0) > WEIGHT_TOLERANCE) {
            throw new IllegalArgumentException("Variant weights must be non-negative and sum to 1.0");
        }
        if (trafficAllocation < 0 || trafficAllocation > 1) {
            throw new IllegalArgumentException("Traffic allocation must be between 0 and 1");
        }
        if (significanceLevel <= 0 || significanceLevel >= 1) {
            throw new IllegalArgumentException("Significance level must be between 0 and 1");
        }
        if (winnerThreshold <= 0 || winnerThreshold > 1) {
            throw new IllegalArgumentException("Winner threshold must be within (0, 1]");
        }
        if (minSampleSize < MIN_SAMPLE_SIZE_FLOOR) {
            throw new IllegalArgumentException("Minimum sample size must be at least " + MIN_SAMPLE_SIZE_FLOOR);
        }
        if (maxDuration == null || maxDuration.isNegative() || maxDuration.isZero()) {
            throw new IllegalArgumentException("Max duration must be positive");
        }
    }

    public boolean admits(CapabilityClass capability) {
        return capabilities.isEmpty() || capabilities.contains(capability);
    }

    public ExperimentVariant variant(Variant variant) {
        return variant == Variant.A ? variantA : variantB;
    }
}
