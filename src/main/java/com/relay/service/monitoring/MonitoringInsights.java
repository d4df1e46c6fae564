package com.relay.service.monitoring;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.relay.service.prediction.UserPatternInsights;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Aggregate view of the accuracy pipeline.
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MonitoringInsights {

    int modelsTracked;
    long samplesAnalyzed;
    double averageAccuracy;
    long driftDetections;
    Map<String, Long> alertsSummary;
    List<ModelAccuracy> topModels;

    int queueSize;
    long droppedSamples;
    double averageOverheadMs;
    double maxOverheadMs;
    double p95OverheadMs;

    /** Present when insights were requested for one user. */
    UserPatternInsights userPatterns;

    @Value
    public static class ModelAccuracy {
        String model;
        double accuracy;
    }
}
