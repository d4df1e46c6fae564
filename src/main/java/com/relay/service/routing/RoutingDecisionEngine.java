package com.relay.service.routing;

import com.relay.exception.NoEligibleProviderException;
import com.relay.exception.QuotaExhaustedException;
import com.relay.model.routing.CandidatePrediction;
import com.relay.model.routing.OptimizationStrategy;
import com.relay.model.routing.ProviderType;
import com.relay.model.routing.RoutingConstraints;
import com.relay.model.routing.RoutingDecision;
import com.relay.model.routing.RoutingRequest;
import com.relay.model.routing.RoutingState;
import com.relay.model.routing.ScoredCandidate;
import com.relay.service.experiment.ExperimentAssignment;
import com.relay.service.experiment.ExperimentManager;
import com.relay.service.prediction.ModelCatalog;
import com.relay.service.prediction.ModelProfile;
import com.relay.service.prediction.Predictor;
import com.relay.service.prediction.RequestFeatureExtractor;
import com.relay.service.prediction.RequestFeatures;
import com.relay.service.prediction.UserPatternTracker;
import com.relay.service.quota.QuotaPoolManager;
import com.relay.service.quota.UpgradePrompt;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Turns predictions and quota availability into one decision.
 *
 * Walks INIT, CANDIDATES_GATHERED, QUOTA_FILTERED, SCORED and DECIDED. Dispatch and the single
 * fallback live in the routing service, which moves the decision to its terminal state.
 * No stage ever widens the candidate set past what the caller allowed; a running experiment can only
 * promote a candidate that is already admissible.
 */
@Slf4j
@Service
public class RoutingDecisionEngine {

    public static final long UNITS_PER_REQUEST = 1;

    private final ModelCatalog catalog;
    private final RequestFeatureExtractor featureExtractor;
    private final Predictor predictor;
    private final QuotaPoolManager quotaPoolManager;
    private final CandidateScorer scorer;
    private final ProviderAvailability availability;
    private final ExperimentManager experimentManager;
    private final UserPatternTracker userPatternTracker;
    private final Clock clock;

    public RoutingDecisionEngine(ModelCatalog catalog,
                                 RequestFeatureExtractor featureExtractor,
                                 Predictor predictor,
                                 QuotaPoolManager quotaPoolManager,
                                 CandidateScorer scorer,
                                 ProviderAvailability availability,
                                 ExperimentManager experimentManager,
                                 UserPatternTracker userPatternTracker,
                                 Clock clock) {
        this.catalog = catalog;
        this.featureExtractor = featureExtractor;
        this.predictor = predictor;
        this.quotaPoolManager = quotaPoolManager;
        this.scorer = scorer;
        this.availability = availability;
        this.experimentManager = experimentManager;
        this.userPatternTracker = userPatternTracker;
        this.clock = clock;
    }

    /**
     * Decide where a request goes.
     *
     * @throws QuotaExhaustedException      when the user's tier cap is hit or every remaining candidate's pools are empty
     * @throws NoEligibleProviderException  when hints, preferences or constraints leave nothing to choose from
     */
    public RoutingPlan decide(RoutingRequest request) {
        RoutingConstraints constraints = request.getConstraints() != null
                ? request.getConstraints() : RoutingConstraints.NONE;
        constraints.validate();
        OptimizationStrategy strategy = request.getOptimizeFor() != null
                ? request.getOptimizeFor() : OptimizationStrategy.BALANCED;
        log.debug("[{}] {} strategy={}", request.getRequestId(), RoutingState.INIT, strategy);

        RequestFeatures features = featureExtractor.extract(request);
        List<ModelProfile> gathered = gather(request, features, constraints);
        log.debug("[{}] {} {} candidates", request.getRequestId(), RoutingState.CANDIDATES_GATHERED, gathered.size());

        List<ModelProfile> withQuota = filterByQuota(request, gathered);
        log.debug("[{}] {} {} candidates", request.getRequestId(), RoutingState.QUOTA_FILTERED, withQuota.size());

        List<CandidatePrediction> predictions = predictor.predict(features, withQuota);
        List<CandidatePrediction> admissible = scorer.applyConstraints(predictions, constraints);
        if (admissible.isEmpty()) {
            throw new NoEligibleProviderException("Constraints eliminated every candidate ("
                    + describe(constraints) + "; " + predictions.size() + " evaluated)");
        }
        List<ScoredCandidate> ranked = scorer.rank(admissible, strategy);
        log.debug("[{}] {} {} admissible of {}", request.getRequestId(), RoutingState.SCORED, ranked.size(),
                predictions.size());

        Optional<ExperimentAssignment> assignment = experimentManager.assign(request, features, ranked);
        if (assignment.isPresent()) {
            ranked = promote(ranked, assignment.get());
        }

        ScoredCandidate winner = ranked.get(0);
        String reasoning = reasoning(strategy, winner, ranked.size(), gathered.size() - withQuota.size(),
                predictions.size() - admissible.size());
        if (assignment.isPresent()) {
            reasoning += "; experiment " + assignment.get().getExperimentId()
                    + " variant " + assignment.get().getVariant();
        }
        RoutingDecision decision = RoutingDecision.builder()
                .requestId(request.getRequestId())
                .userId(request.getUserId())
                .provider(winner.getProvider())
                .model(winner.getModel())
                .strategy(strategy)
                .chosen(winner.getPrediction())
                .alternatives(ranked)
                .reasoning(reasoning)
                .experimentId(assignment.map(ExperimentAssignment::getExperimentId).orElse(null))
                .variant(assignment.map(ExperimentAssignment::getVariant).orElse(null))
                .state(RoutingState.DECIDED)
                .decidedAt(clock.instant())
                .build();

        userPatternTracker.record(request.getUserId(), features, winner, ranked);

        log.info("[{}] Routed to {}/{} ({}, score={}, {} alternatives)", request.getRequestId(),
                winner.getProvider(), winner.getModel(), strategy, String.format("%.4f", winner.getScore()),
                ranked.size() - 1);
        return new RoutingPlan(request, features, ranked, decision);
    }

    /**
     * Move the assigned variant's candidate to the front, keeping the rest in score order.
     */
    private static List<ScoredCandidate> promote(List<ScoredCandidate> ranked, ExperimentAssignment assignment) {
        List<ScoredCandidate> ordered = new ArrayList<>(ranked.size());
        ranked.stream().filter(assignment::matches).findFirst().ifPresent(ordered::add);
        ranked.stream().filter(c -> !assignment.matches(c)).forEach(ordered::add);
        List<ScoredCandidate> reranked = new ArrayList<>(ordered.size());
        for (int i = 0; i < ordered.size(); i++) {
            ScoredCandidate c = ordered.get(i);
            reranked.add(new ScoredCandidate(c.getPrediction(), c.getScore(), i));
        }
        return reranked;
    }

    private List<ModelProfile> gather(RoutingRequest request, RequestFeatures features,
                                      RoutingConstraints constraints) {
        List<ModelProfile> matching;
        if (request.hasModelHint()) {
            matching = catalog.matchingHint(request.getModelHint());
            if (matching.isEmpty()) {
                throw new NoEligibleProviderException("No model matches '" + request.getModelHint() + "'");
            }
        } else {
            matching = catalog.supporting(features.getCapability());
            if (matching.isEmpty() && !features.isCapabilityExplicit()) {
                matching = catalog.all();
            }
            if (matching.isEmpty()) {
                throw new NoEligibleProviderException("No model supports capability " + features.getCapability());
            }
        }

        List<ModelProfile> allowed = matching.stream()
                .filter(p -> constraints.isAllowed(p.getProvider()))
                .filter(p -> availability.isRoutable(p.getProvider()))
                .toList();
        if (allowed.isEmpty()) {
            if (constraints.hasPreferredProviders()) {
                throw new NoEligibleProviderException("Preferred providers " + names(constraints.getPreferredProviders())
                        + " offer no matching model");
            }
            throw new NoEligibleProviderException("Every matching provider is excluded or unavailable");
        }
        return allowed;
    }

    private List<ModelProfile> filterByQuota(RoutingRequest request, List<ModelProfile> candidates) {
        // Tier cap first: it is about the user, not the providers
        quotaPoolManager.checkUserQuota(request.getUserId(), UNITS_PER_REQUEST);

        Map<ProviderType, Boolean> capacity = new EnumMap<>(ProviderType.class);
        List<ModelProfile> withQuota = candidates.stream()
                .filter(p -> capacity.computeIfAbsent(p.getProvider(),
                        provider -> quotaPoolManager.hasCapacity(provider, UNITS_PER_REQUEST)))
                .toList();
        if (withQuota.isEmpty()) {
            log.warn("[{}] All pools exhausted for {}", request.getRequestId(), names(capacity.keySet()));
            throw new QuotaExhaustedException("All pools exhausted for today", UpgradePrompt.poolsExhausted());
        }
        return withQuota;
    }

    private static String reasoning(OptimizationStrategy strategy, ScoredCandidate winner, int survivors,
                                    int droppedByQuota, int droppedByConstraints) {
        CandidatePrediction p = winner.getPrediction();
        StringBuilder reason = new StringBuilder()
                .append("strategy=").append(strategy.name().toLowerCase())
                .append("; chose ").append(p.getProvider().id()).append('/').append(p.getModel())
                .append(String.format(" (score=%.4f, cost=$%.6f, latency=%dms, quality=%.2f, confidence=%.2f)",
                        winner.getScore(), p.getPredictedCost(), p.getPredictedLatencyMs(),
                        p.getPredictedQuality(), p.getConfidence()))
                .append(" from ").append(survivors).append(survivors == 1 ? " candidate" : " candidates");
        if (droppedByQuota > 0) {
            reason.append("; ").append(droppedByQuota).append(" without quota");
        }
        if (droppedByConstraints > 0) {
            reason.append("; ").append(droppedByConstraints).append(" violating constraints");
        }
        return reason.toString();
    }

    private static String describe(RoutingConstraints c) {
        StringBuilder out = new StringBuilder();
        if (c.getMaxCost() != null) {
            out.append("maxCost=").append(c.getMaxCost()).append(' ');
        }
        if (c.getMinQuality() != null) {
            out.append("minQuality=").append(c.getMinQuality()).append(' ');
        }
        if (c.getMaxResponseTimeMs() != null) {
            out.append("maxResponseTimeMs=").append(c.getMaxResponseTimeMs());
        }
        return out.toString().trim();
    }

    private static String names(Set<ProviderType> providers) {
        return providers.stream().map(ProviderType::id).sorted().collect(Collectors.joining(", ", "[", "]"));
    }
}
