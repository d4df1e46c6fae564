package com.relay.model.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.relay.model.routing.CapabilityClass;
import com.relay.model.routing.ProviderType;
import com.relay.service.experiment.ExperimentConfig;
import com.relay.service.experiment.ExperimentMetric;
import com.relay.service.experiment.ExperimentVariant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.util.List;

/**
 * Body of {@code POST /v1/experiments}. Unset fields take the experiment defaults.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExperimentRequest {

    @JsonProperty("id")
    private String id;

    @JsonProperty("name")
    private String name;

    @JsonProperty("description")
    private String description;

    @JsonProperty("hypothesis")
    private String hypothesis;

    @JsonProperty("variant_a")
    private VariantSpec variantA;

    @JsonProperty("variant_b")
    private VariantSpec variantB;

    @JsonProperty("min_sample_size")
    private Integer minSampleSize;

    @JsonProperty("max_duration_hours")
    private Long maxDurationHours;

    @JsonProperty("significance_level")
    private Double significanceLevel;

    @JsonProperty("traffic_allocation")
    private Double trafficAllocation;

    @JsonProperty("request_types")
    private List<String> requestTypes;

    @JsonProperty("primary_metric")
    private String primaryMetric;

    @JsonProperty("secondary_metrics")
    private List<String> secondaryMetrics;

    @JsonProperty("auto_stop")
    private Boolean autoStop;

    @JsonProperty("winner_threshold")
    private Double winnerThreshold;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class VariantSpec {

        @JsonProperty("provider")
        private String provider;

        @JsonProperty("model")
        private String model;

        @JsonProperty("weight")
        private Double weight;

        ExperimentVariant toVariant(String label) {
            if (provider == null || model == null || model.isBlank()) {
                throw new IllegalArgumentException(label + " needs a provider and a model");
            }
            return new ExperimentVariant(ProviderType.fromString(provider), model, weight != null ? weight : 0.5);
        }
    }

    /**
     * @throws IllegalArgumentException if a field cannot be parsed; range checks happen on validation
     */
    public ExperimentConfig toConfig() {
        if (variantA == null || variantB == null) {
            throw new IllegalArgumentException("variant_a and variant_b are required");
        }
        ExperimentConfig.ExperimentConfigBuilder builder = ExperimentConfig.builder()
                .id(id)
                .name(name != null ? name : id)
                .description(description)
                .hypothesis(hypothesis)
                .variantA(variantA.toVariant("variant_a"))
                .variantB(variantB.toVariant("variant_b"));
        if (minSampleSize != null) {
            builder.minSampleSize(minSampleSize);
        }
        if (maxDurationHours != null) {
            builder.maxDuration(Duration.ofHours(maxDurationHours));
        }
        if (significanceLevel != null) {
            builder.significanceLevel(significanceLevel);
        }
        if (trafficAllocation != null) {
            builder.trafficAllocation(trafficAllocation);
        }
        if (requestTypes != null) {
            requestTypes.stream()
                    .filter(type -> type != null && !type.isBlank())
                    .forEach(type -> builder.capability(CapabilityClass.fromString(type)));
        }
        if (primaryMetric != null) {
            builder.primaryMetric(ExperimentMetric.fromString(primaryMetric));
        }
        if (secondaryMetrics != null) {
            secondaryMetrics.forEach(metric -> builder.secondaryMetric(ExperimentMetric.fromString(metric)));
        }
        if (autoStop != null) {
            builder.autoStop(autoStop);
        }
        if (winnerThreshold != null) {
            builder.winnerThreshold(winnerThreshold);
        }
        return builder.build();
    }
}
