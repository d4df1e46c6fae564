package com.relay.service.monitoring;

import com.relay.model.routing.ModelKey;
import lombok.Getter;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * Bounded sample history for one (provider, model), with running sums and a frozen baseline.
 * Not thread-safe: the accuracy monitor guards every instance with its lock.
 */
class AccuracyHistory {

    @Getter
    private final ModelKey key;
    private final int maxSize;
    private final Deque<PredictionSample> samples = new ArrayDeque<>();

    private double costSum;
    private double latencySum;
    private double qualitySum;
    private int qualityCount;
    private int matchCount;

    @Getter
    private long failedOutcomes;
    @Getter
    private AccuracyMetrics latest;
    @Getter
    private AccuracyMetrics baseline;
    private List<Double> baselineAccuracies = List.of();
    private int sinceBaseline;

    AccuracyHistory(ModelKey key, int maxSize) {
        this.key = key;
        this.maxSize = Math.max(1, maxSize);
    }

    /**
     * Append a sample, evicting the oldest past capacity, and return the refreshed metrics.
     */
    AccuracyMetrics add(PredictionSample sample, Instant now) {
        samples.addLast(sample);
        apply(sample, 1);
        if (baseline != null) {
            sinceBaseline++;
        }
        if (samples.size() > maxSize) {
            apply(samples.pollFirst(), -1);
        }
        latest = AccuracyMetrics.fromSums(costSum, latencySum, qualitySum, qualityCount, matchCount,
                samples.size(), now);
        return latest;
    }

    void recordFailure() {
        failedOutcomes++;
    }

    int size() {
        return samples.size();
    }

    boolean hasBaseline() {
        return baseline != null;
    }

    /**
     * Freeze the current state as the drift baseline.
     */
    AccuracyMetrics freezeBaseline(Instant now) {
        baseline = latest != null ? latest : AccuracyMetrics.empty(now);
        baselineAccuracies = overallAccuracies(samples.size());
        sinceBaseline = 0;
        return baseline;
    }

    int samplesSinceBaseline() {
        return sinceBaseline;
    }

    List<Double> baselineAccuracies() {
        return baselineAccuracies;
    }

    /**
     * Metrics over the newest {@code window} samples only.
     */
    AccuracyMetrics recentMetrics(int window, Instant now) {
        List<PredictionSample> recent = recent(window);
        double cost = 0;
        double latency = 0;
        double quality = 0;
        int qualityN = 0;
        int matches = 0;
        for (PredictionSample s : recent) {
            cost += s.getCostAccuracy();
            latency += s.getLatencyAccuracy();
            if (s.getQualityAccuracy() != null) {
                quality += s.getQualityAccuracy();
                qualityN++;
            }
            if (s.isRoutedAsDecided()) {
                matches++;
            }
        }
        return AccuracyMetrics.fromSums(cost, latency, quality, qualityN, matches, recent.size(), now);
    }

    List<Double> overallAccuracies(int window) {
        return recent(window).stream().map(PredictionSample::getOverallAccuracy).toList();
    }

    private List<PredictionSample> recent(int window) {
        List<PredictionSample> recent = new ArrayList<>(Math.min(window, samples.size()));
        Iterator<PredictionSample> it = samples.descendingIterator();
        while (it.hasNext() && recent.size() < window) {
            recent.add(0, it.next());
        }
        return recent;
    }

    private void apply(PredictionSample sample, int sign) {
        costSum += sign * sample.getCostAccuracy();
        latencySum += sign * sample.getLatencyAccuracy();
        if (sample.getQualityAccuracy() != null) {
            qualitySum += sign * sample.getQualityAccuracy();
            qualityCount += sign;
        }
        if (sample.isRoutedAsDecided()) {
            matchCount += sign;
        }
    }
}
