package com.relay.service.monitoring;

import lombok.Value;

import java.util.List;

/**
 * Two-sample tests used for drift, model comparison and experiments.
 */
public final class StatisticalTests {

    private StatisticalTests() {
    }

    @Value
    public static class WelchResult {
        double t;
        double degreesOfFreedom;
        double pValue;

        /** {@code 1 - p}, so larger means more confident the samples differ. */
        public double significance() {
            return 1.0 - pValue;
        }
    }

    /**
     * Welch's unequal-variance t-test, two-sided. The p-value uses the normal approximation of
     * the t distribution, which is close once each side has a handful of samples.
     */
    public static WelchResult welch(List<Double> a, List<Double> b) {
        if (a.size() < 2 || b.size() < 2) {
            return new WelchResult(0, 0, 1.0);
        }
        double meanA = mean(a);
        double meanB = mean(b);
        double varA = variance(a, meanA) / a.size();
        double varB = variance(b, meanB) / b.size();
        double se = Math.sqrt(varA + varB);
        if (se == 0) {
            // Both samples constant: identical means are indistinguishable, different ones are certain
            return meanA == meanB ? new WelchResult(0, 0, 1.0) : new WelchResult(Double.POSITIVE_INFINITY, 0, 0.0);
        }
        double t = (meanA - meanB) / se;
        double df = Math.pow(varA + varB, 2)
                / (Math.pow(varA, 2) / (a.size() - 1) + Math.pow(varB, 2) / (b.size() - 1));
        double p = 2 * (1 - normalCdf(Math.abs(t)));
        return new WelchResult(t, df, Math.max(0.0, Math.min(1.0, p)));
    }

    static double normalCdf(double x) {
        return 0.5 * (1 + erf(x / Math.sqrt(2)));
    }

    /**
     * Abramowitz and Stegun 7.1.26, max error 1.5e-7.
     */
    static double erf(double x) {
        double sign = Math.signum(x);
        double ax = Math.abs(x);
        double t = 1 / (1 + 0.3275911 * ax);
        double y = 1 - (((((1.061405429 * t - 1.453152027) * t) + 1.421413741) * t - 0.284496736) * t
                + 0.254829592) * t * Math.exp(-ax * ax);
        return sign * y;
    }

    public static double mean(List<Double> values) {
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        return values.isEmpty() ? 0 : sum / values.size();
    }

    /**
     * Sample standard deviation; zero below two values.
     */
    public static double standardDeviation(List<Double> values) {
        return values.size() < 2 ? 0 : Math.sqrt(variance(values, mean(values)));
    }

    private static double variance(List<Double> values, double mean) {
        double sum = 0;
        for (double v : values) {
            sum += (v - mean) * (v - mean);
        }
        return sum / (values.size() - 1);
    }
}
