package com.relay.service.experiment;

import com.relay.model.routing.Variant;
import com.relay.service.monitoring.PredictionSample;
import lombok.Value;

import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;

/**
 * Observed metrics of one request routed by an experiment.
 */
@Value
class ExperimentResult {

    String requestId;
    Variant variant;
    Map<ExperimentMetric, Double> values;
    Instant recordedAt;

    static ExperimentResult of(Variant variant, PredictionSample sample, Instant recordedAt) {
        Map<ExperimentMetric, Double> values = new EnumMap<>(ExperimentMetric.class);
        for (ExperimentMetric metric : ExperimentMetric.values()) {
            Double value = metric.valueOf(sample);
            if (value != null) {
                values.put(metric, value);
            }
        }
        return new ExperimentResult(sample.getOutcome().getRequestId(), variant, values, recordedAt);
    }

    Double value(ExperimentMetric metric) {
        return values.get(metric);
    }
}
