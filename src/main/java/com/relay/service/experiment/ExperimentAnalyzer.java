package com.relay.service.experiment;

import com.relay.model.routing.Variant;
import com.relay.service.monitoring.StatisticalTests;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Compares the two variants of an experiment with Welch's t-test.
 */
final class ExperimentAnalyzer {

    static final double Z_95 = 1.96;

    private ExperimentAnalyzer() {
    }

    static ExperimentAnalysis analyze(ExperimentConfig config, List<ExperimentResult> results, Instant now) {
        long countA = results.stream().filter(r -> r.getVariant() == Variant.A).count();
        long countB = results.size() - countA;
        ExperimentAnalysis.ExperimentAnalysisBuilder analysis = ExperimentAnalysis.builder()
                .experimentId(config.getId())
                .analyzedAt(now);

        if (countA < config.getMinSampleSize() || countB < config.getMinSampleSize()) {
            return analysis
                    .status(AnalysisStatus.INSUFFICIENT_DATA)
                    .primary(compare(config.getPrimaryMetric(), results, config.getSignificanceLevel()))
                    .secondary(Map.of())
                    .recommendation(Recommendation.CONTINUE_TEST)
                    .reason(String.format("Insufficient data: need %d samples per variant (A: %d, B: %d)",
                            config.getMinSampleSize(), countA, countB))
                    .build();
        }

        ExperimentMetric metric = config.getPrimaryMetric();
        MetricComparison primary = compare(metric, results, config.getSignificanceLevel());
        if (primary.getSamplesA() < 2 || primary.getSamplesB() < 2) {
            return analysis
                    .status(AnalysisStatus.INSUFFICIENT_DATA)
                    .primary(primary)
                    .secondary(Map.of())
                    .recommendation(Recommendation.CONTINUE_TEST)
                    .reason("Too few outcomes report " + metric.id())
                    .build();
        }

        Map<ExperimentMetric, MetricComparison> secondary = new EnumMap<>(ExperimentMetric.class);
        for (ExperimentMetric other : config.getSecondaryMetrics()) {
            if (other != metric) {
                secondary.put(other, compare(other, results, config.getSignificanceLevel()));
            }
        }

        double effect = primary.getMeanB() - primary.getMeanA();
        double se = Math.sqrt(Math.pow(primary.getStdDevA(), 2) / primary.getSamplesA()
                + Math.pow(primary.getStdDevB(), 2) / primary.getSamplesB());
        double confidence = 1.0 - primary.getPValue();
        analysis.primary(primary)
                .effect(effect)
                .confidence(confidence)
                .confidenceIntervalLow(effect - Z_95 * se)
                .confidenceIntervalHigh(effect + Z_95 * se)
                .secondary(secondary);

        if (!primary.isSignificant()) {
            return analysis
                    .status(AnalysisStatus.NO_SIGNIFICANT_DIFFERENCE)
                    .recommendation(Recommendation.CONTINUE_TEST)
                    .reason(String.format("No significant difference in %s (p=%.4f)", metric.id(),
                            primary.getPValue()))
                    .build();
        }
        boolean bBetter = metric.isLowerBetter()
                ? primary.getMeanB() < primary.getMeanA()
                : primary.getMeanB() > primary.getMeanA();
        return analysis
                .status(bBetter ? AnalysisStatus.VARIANT_B_WINS : AnalysisStatus.VARIANT_A_WINS)
                .recommendation(bBetter ? Recommendation.CHOOSE_VARIANT_B : Recommendation.CHOOSE_VARIANT_A)
                .reason(String.format("Variant %s is %.1f%% better on %s with %.1f%% confidence",
                        bBetter ? "B" : "A", Math.abs(primary.getImprovementPercent()), metric.id(),
                        confidence * 100))
                .build();
    }

    static MetricComparison compare(ExperimentMetric metric, List<ExperimentResult> results, double alpha) {
        List<Double> a = values(results, Variant.A, metric);
        List<Double> b = values(results, Variant.B, metric);
        double meanA = StatisticalTests.mean(a);
        double meanB = StatisticalTests.mean(b);
        double pValue = StatisticalTests.welch(a, b).getPValue();
        return MetricComparison.builder()
                .metric(metric)
                .samplesA(a.size())
                .samplesB(b.size())
                .meanA(meanA)
                .meanB(meanB)
                .stdDevA(StatisticalTests.standardDeviation(a))
                .stdDevB(StatisticalTests.standardDeviation(b))
                .improvementPercent(improvement(metric, meanA, meanB))
                .pValue(pValue)
                .significant(pValue < alpha)
                .build();
    }

    /**
     * Percent by which B beats A, signed so that positive always favours B.
     */
    static double improvement(ExperimentMetric metric, double meanA, double meanB) {
        if (meanA == 0) {
            return 0;
        }
        double delta = metric.isLowerBetter() ? meanA - meanB : meanB - meanA;
        return delta / Math.abs(meanA) * 100;
    }

    private static List<Double> values(List<ExperimentResult> results, Variant variant, ExperimentMetric metric) {
        return results.stream()
                .filter(r -> r.getVariant() == variant)
                .map(r -> r.value(metric))
                .filter(Objects::nonNull)
                .toList();
    }
}
