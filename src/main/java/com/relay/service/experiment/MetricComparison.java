package com.relay.service.experiment;

import lombok.Builder;
import lombok.Value;

/**
 * Both variants summarized on one metric.
 */
@Value
@Builder
public class MetricComparison {

    ExperimentMetric metric;
    int samplesA;
    int samplesB;
    double meanA;
    double meanB;
    double stdDevA;
    double stdDevB;
    /** Relative improvement of B over A in percent, positive when B is better for this metric. */
    double improvementPercent;
    double pValue;
    boolean significant;
}
