package com.relay.service.experiment;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.relay.service.monitoring.PredictionSample;

import java.util.Locale;

/**
 * What an experiment compares its variants on.
 */
public enum ExperimentMetric {

    COST("cost", true),
    LATENCY("latency", true),
    QUALITY("quality", false),
    ACCURACY("accuracy", false);

    private final String id;
    private final boolean lowerIsBetter;

    ExperimentMetric(String id, boolean lowerIsBetter) {
        this.id = id;
        this.lowerIsBetter = lowerIsBetter;
    }

    @JsonValue
    public String id() {
        return id;
    }

    public boolean isLowerBetter() {
        return lowerIsBetter;
    }

    /**
     * The metric's value for one sample; null when the outcome did not report it.
     */
    public Double valueOf(PredictionSample sample) {
        switch (this) {
            case COST:
                return sample.getOutcome().getCost();
            case LATENCY:
                return (double) sample.getOutcome().getLatencyMs();
            case QUALITY:
                return sample.getOutcome().getQualityScore();
            default:
                return sample.getOverallAccuracy();
        }
    }

    /**
     * Accepts the id, the enum name and "response_time" for LATENCY.
     */
    @JsonCreator
    public static ExperimentMetric fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Metric must not be blank");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        if ("response_time".equals(normalized) || "responsetime".equals(normalized)) {
            return LATENCY;
        }
        for (ExperimentMetric metric : values()) {
            if (metric.id.equals(normalized)) {
                return metric;
            }
        }
        throw new IllegalArgumentException("Unknown metric: " + value);
    }
}
