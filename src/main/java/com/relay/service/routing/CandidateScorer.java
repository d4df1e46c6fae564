package com.relay.service.routing;

import com.relay.config.RelayProperties;
import com.relay.model.routing.CandidatePrediction;
import com.relay.model.routing.OptimizationStrategy;
import com.relay.model.routing.RoutingConstraints;
import com.relay.model.routing.ScoredCandidate;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Hard-constraint filtering and strategy scoring.
 */
@Component
public class CandidateScorer {

    /** Floor for zero-cost (local) models so 1/cost stays finite. */
    static final double MIN_COST = 1e-9;

    private final double costWeight;
    private final double latencyWeight;
    private final double qualityWeight;

    @Autowired
    public CandidateScorer(RelayProperties properties) {
        this(properties.getRouting().getCostWeight(),
                properties.getRouting().getLatencyWeight(),
                properties.getRouting().getQualityWeight());
    }

    public CandidateScorer(double costWeight, double latencyWeight, double qualityWeight) {
        this.costWeight = costWeight;
        this.latencyWeight = latencyWeight;
        this.qualityWeight = qualityWeight;
    }

    /**
     * Candidates that satisfy every stated bound. Applied before scoring.
     */
    public List<CandidatePrediction> applyConstraints(List<CandidatePrediction> candidates,
                                                      RoutingConstraints constraints) {
        if (constraints == null) {
            return candidates;
        }
        return candidates.stream().filter(c -> satisfies(c, constraints)).toList();
    }

    public boolean satisfies(CandidatePrediction candidate, RoutingConstraints constraints) {
        if (constraints.getMaxCost() != null && candidate.getPredictedCost() > constraints.getMaxCost()) {
            return false;
        }
        if (constraints.getMinQuality() != null && candidate.getPredictedQuality() < constraints.getMinQuality()) {
            return false;
        }
        return constraints.getMaxResponseTimeMs() == null
                || candidate.getPredictedLatencyMs() <= constraints.getMaxResponseTimeMs();
    }

    /**
     * Score and rank. Ties go to the lower predicted cost, then provider name, then model name.
     */
    public List<ScoredCandidate> rank(List<CandidatePrediction> candidates, OptimizationStrategy strategy) {
        if (candidates.isEmpty()) {
            return List.of();
        }
        double[] scores = score(candidates, strategy);

        List<Integer> order = new ArrayList<>();
        for (int i = 0; i < candidates.size(); i++) {
            order.add(i);
        }
        Comparator<Integer> byScore = (a, b) -> Double.compare(scores[b], scores[a]);
        order.sort(byScore
                .thenComparingDouble(i -> candidates.get(i).getPredictedCost())
                .thenComparing(i -> candidates.get(i).getProvider().id())
                .thenComparing(i -> candidates.get(i).getModel()));

        List<ScoredCandidate> ranked = new ArrayList<>(candidates.size());
        for (int rank = 0; rank < order.size(); rank++) {
            int index = order.get(rank);
            ranked.add(new ScoredCandidate(candidates.get(index), scores[index], rank));
        }
        return ranked;
    }

    double[] score(List<CandidatePrediction> candidates, OptimizationStrategy strategy) {
        int n = candidates.size();
        double[] inverseCost = new double[n];
        double[] inverseLatency = new double[n];
        for (int i = 0; i < n; i++) {
            inverseCost[i] = 1.0 / Math.max(MIN_COST, candidates.get(i).getPredictedCost());
            inverseLatency[i] = 1.0 / Math.max(1L, candidates.get(i).getPredictedLatencyMs());
        }

        double[] scores = new double[n];
        switch (strategy) {
            case COST -> System.arraycopy(inverseCost, 0, scores, 0, n);
            case SPEED -> System.arraycopy(inverseLatency, 0, scores, 0, n);
            case QUALITY -> {
                for (int i = 0; i < n; i++) {
                    scores[i] = candidates.get(i).getPredictedQuality();
                }
            }
            case BALANCED -> {
                double[] cost = normalize(inverseCost);
                double[] latency = normalize(inverseLatency);
                for (int i = 0; i < n; i++) {
                    scores[i] = costWeight * cost[i]
                            + latencyWeight * latency[i]
                            + qualityWeight * candidates.get(i).getPredictedQuality();
                }
            }
            default -> throw new IllegalStateException("Unhandled strategy " + strategy);
        }
        return scores;
    }

    /**
     * Min/max scaling to [0, 1] over the candidate set. A degenerate range maps everything to 1.
     */
    static double[] normalize(double[] values) {
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double v : values) {
            min = Math.min(min, v);
            max = Math.max(max, v);
        }
        double[] result = new double[values.length];
        double range = max - min;
        for (int i = 0; i < values.length; i++) {
            result[i] = range > 0 ? (values[i] - min) / range : 1.0;
        }
        return result;
    }
}
