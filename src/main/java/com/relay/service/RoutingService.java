package com.relay.service;

import com.relay.exception.ProviderDispatchException;
import com.relay.exception.QuotaExhaustedException;
import com.relay.exception.ResourceNotFoundException;
import com.relay.model.ChatCompletionChunk;
import com.relay.model.ChatCompletionRequest;
import com.relay.model.ChatCompletionResponse;
import com.relay.model.Usage;
import com.relay.model.routing.ErrorKind;
import com.relay.model.routing.ExecutionOutcome;
import com.relay.model.routing.ProviderType;
import com.relay.model.routing.RoutingConstraints;
import com.relay.model.routing.RoutingDecision;
import com.relay.model.routing.RoutingRequest;
import com.relay.model.routing.ScoredCandidate;
import com.relay.service.monitoring.AccuracyMonitor;
import com.relay.service.monitoring.RelayMetrics;
import com.relay.service.prediction.ModelCatalog;
import com.relay.service.prediction.ModelProfile;
import com.relay.service.quota.PoolAllocation;
import com.relay.service.quota.QuotaPoolManager;
import com.relay.service.quota.UpgradePrompt;
import com.relay.service.routing.DecisionLedger;
import com.relay.service.routing.DecisionReservation;
import com.relay.service.routing.ReservationLedger;
import com.relay.service.routing.RoutedCompletion;
import com.relay.service.routing.RoutingDecisionEngine;
import com.relay.service.routing.RoutingPlan;
import com.relay.service.streaming.StreamNormalizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Main routing service: decides, reserves quota, dispatches and falls back once.
 *
 * A failed dispatch moves to the next-ranked candidate exactly once; a second failure surfaces as
 * {@link ProviderDispatchException}. Streams fall back only before their first chunk. A request holds at
 * most one reservation: it is returned to its pool when the dispatch is cancelled, times out or hands over
 * to the fallback. After a final provider error it is kept, since the provider may have done the work.
 */
@Slf4j
@Service
public class RoutingService {

    private final RoutingDecisionEngine engine;
    private final QuotaPoolManager quotaPoolManager;
    private final ProviderService providerService;
    private final StreamNormalizer streamNormalizer;
    private final StreamingService streamingService;
    private final DecisionLedger decisionLedger;
    private final ReservationLedger reservationLedger;
    private final AccuracyMonitor accuracyMonitor;
    private final ModelCatalog catalog;
    private final RelayMetrics metrics;
    private final Clock clock;

    public RoutingService(RoutingDecisionEngine engine,
                          QuotaPoolManager quotaPoolManager,
                          ProviderService providerService,
                          StreamNormalizer streamNormalizer,
                          StreamingService streamingService,
                          DecisionLedger decisionLedger,
                          ReservationLedger reservationLedger,
                          AccuracyMonitor accuracyMonitor,
                          ModelCatalog catalog,
                          RelayMetrics metrics,
                          Clock clock) {
        this.engine = engine;
        this.quotaPoolManager = quotaPoolManager;
        this.providerService = providerService;
        this.streamNormalizer = streamNormalizer;
        this.streamingService = streamingService;
        this.decisionLedger = decisionLedger;
        this.reservationLedger = reservationLedger;
        this.accuracyMonitor = accuracyMonitor;
        this.catalog = catalog;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Route and execute a non-streaming request.
     */
    public Mono<RoutedCompletion> complete(RoutingRequest request) {
        return Mono.fromCallable(() -> engine.decide(request))
                .flatMap(plan -> dispatch(plan, 0, false, new ArrayList<>()));
    }

    /**
     * Route and execute a streaming request.
     *
     * @param onDispatched called once with the final decision, just before the first chunk is emitted
     */
    public Flux<ChatCompletionChunk> stream(RoutingRequest request, Consumer<RoutingDecision> onDispatched) {
        return Mono.fromCallable(() -> engine.decide(request))
                .flatMapMany(plan -> dispatchStream(plan, 0, false, new ArrayList<>(), onDispatched));
    }

    /**
     * Decide and reserve capacity without dispatching. The caller executes the request and submits the
     * outcome; the reservation is held until then.
     */
    public DecisionReservation decide(RoutingRequest request) {
        RoutingPlan plan = engine.decide(request);
        List<ScoredCandidate> ranked = plan.getRanked();
        for (int i = 0; i < ranked.size(); i++) {
            ScoredCandidate candidate = ranked.get(i);
            PoolAllocation allocation = tryReserve(plan, candidate);
            if (allocation == null) {
                continue;
            }
            RoutingDecision decision = plan.getDecision().toBuilder()
                    .provider(candidate.getProvider())
                    .model(candidate.getModel())
                    .chosen(candidate.getPrediction())
                    .build();
            decisionLedger.record(decision);
            reservationLedger.hold(decision.getRequestId(), allocation);
            metrics.recordDecision(candidate.getProvider(), candidate.getModel(), decision.getStrategy());
            return new DecisionReservation(decision, allocation.getPoolId(), allocation.getQuotaRemaining());
        }
        throw new QuotaExhaustedException("All pools exhausted for today", UpgradePrompt.poolsExhausted());
    }

    /**
     * Record an outcome reported by an external dispatcher and settle its reservation. Cancelled and
     * timed-out executions never reached a provider, so their unit goes back to the pool.
     *
     * @return whether the outcome was sampled for accuracy tracking
     */
    public boolean submitOutcome(ExecutionOutcome outcome) {
        boolean sampled = accuracyMonitor.recordOutcome(outcome);
        if (!outcome.isSuccess()
                && (outcome.getErrorKind() == ErrorKind.CANCELLED || outcome.getErrorKind() == ErrorKind.TIMEOUT)) {
            if (reservationLedger.release(outcome.getRequestId())) {
                log.info("[{}] Outcome {} reported, reservation returned", outcome.getRequestId(),
                        outcome.getErrorKind());
            }
        } else {
            reservationLedger.settle(outcome.getRequestId());
        }
        return sampled;
    }

    /**
     * Give back a decide-only reservation the caller will not use.
     */
    public void releaseReservation(String requestId) {
        if (!reservationLedger.release(requestId)) {
            throw new ResourceNotFoundException("No reservation held for " + requestId);
        }
    }

    public RoutingDecision getDecision(String requestId) {
        return decisionLedger.find(requestId)
                .orElseThrow(() -> new ResourceNotFoundException("No decision recorded for " + requestId));
    }

    // ========== Non-streaming dispatch ==========

    private Mono<RoutedCompletion> dispatch(RoutingPlan plan, int index, boolean viaFallback,
                                            List<ProviderType> attempted) {
        RoutingRequest request = plan.getRequest();
        List<ScoredCandidate> ranked = plan.getRanked();
        int next = index;
        PoolAllocation allocation = null;
        while (next < ranked.size() && (allocation = tryReserve(plan, ranked.get(next))) == null) {
            next++;
        }
        if (allocation == null) {
            return Mono.error(exhausted(plan, attempted));
        }

        ScoredCandidate candidate = ranked.get(next);
        int position = next;
        PoolAllocation reserved = allocation;
        attempted.add(candidate.getProvider());
        long start = clock.millis();
        ChatCompletionRequest upstream = request.getPayload() != null
                ? request.getPayload().forUpstream(candidate.getModel(), false)
                : ChatCompletionRequest.builder().model(candidate.getModel()).messages(request.getMessages())
                        .maxTokens(request.getMaxTokens()).build();

        Mono<ChatCompletionResponse> call = providerService.forward(candidate.getProvider(), upstream,
                reserved.getApiKey());
        Long maxResponseTimeMs = constraints(request).getMaxResponseTimeMs();
        if (maxResponseTimeMs != null) {
            call = call.timeout(Duration.ofMillis(maxResponseTimeMs));
        }

        return call
                .doOnCancel(() -> {
                    log.info("[{}] Dispatch to {} cancelled, releasing reservation", request.getRequestId(),
                            candidate.getProvider());
                    quotaPoolManager.release(reserved);
                })
                .map(response -> {
                    long latency = clock.millis() - start;
                    RoutingDecision decision = succeeded(plan, candidate, viaFallback, attempted);
                    ChatCompletionResponse priced = withCost(response, candidate);
                    recordOutcome(request.getRequestId(), candidate, priced.getUsage(), latency, null);
                    metrics.recordDispatchLatency(candidate.getProvider(), Duration.ofMillis(latency));
                    return new RoutedCompletion(priced, decision, reserved.getQuotaRemaining(), latency);
                })
                .onErrorResume(error -> !(error instanceof QuotaExhaustedException), error -> {
                    ErrorKind kind = onDispatchError(request, candidate, reserved, error);
                    if (!viaFallback && position + 1 < ranked.size()) {
                        ProviderType to = ranked.get(position + 1).getProvider();
                        log.warn("[{}] {} failed ({}), falling back to {}/{}", request.getRequestId(),
                                candidate.getProvider(), kind, to, ranked.get(position + 1).getModel());
                        metrics.recordFallback(candidate.getProvider(), to);
                        quotaPoolManager.release(reserved);
                        return dispatch(plan, position + 1, true, attempted);
                    }
                    return Mono.error(failed(plan, candidate, attempted, kind, clock.millis() - start, error));
                });
    }

    // ========== Streaming dispatch ==========

    private Flux<ChatCompletionChunk> dispatchStream(RoutingPlan plan, int index, boolean viaFallback,
                                                     List<ProviderType> attempted,
                                                     Consumer<RoutingDecision> onDispatched) {
        RoutingRequest request = plan.getRequest();
        List<ScoredCandidate> ranked = plan.getRanked();
        int next = index;
        PoolAllocation allocation = null;
        while (next < ranked.size() && (allocation = tryReserve(plan, ranked.get(next))) == null) {
            next++;
        }
        if (allocation == null) {
            return Flux.error(exhausted(plan, attempted));
        }

        ScoredCandidate candidate = ranked.get(next);
        int position = next;
        PoolAllocation reserved = allocation;
        attempted.add(candidate.getProvider());
        long start = clock.millis();
        AtomicBoolean started = new AtomicBoolean(false);
        AtomicReference<Usage> usage = new AtomicReference<>();
        StringBuilder content = new StringBuilder();

        Flux<ChatCompletionChunk> chunks = open(request, candidate, reserved);
        Long maxResponseTimeMs = constraints(request).getMaxResponseTimeMs();
        if (maxResponseTimeMs != null) {
            // Bounds time to first chunk; a stream already flowing is never cut off
            chunks = chunks.timeout(Mono.delay(Duration.ofMillis(maxResponseTimeMs)), chunk -> Mono.never());
        }

        return chunks
                .doOnNext(chunk -> {
                    if (started.compareAndSet(false, true)) {
                        onDispatched.accept(succeeded(plan, candidate, viaFallback, attempted));
                    }
                    if (chunk.contentDelta() != null) {
                        content.append(chunk.contentDelta());
                    }
                    if (chunk.getUsage() != null) {
                        usage.set(chunk.getUsage());
                    }
                })
                .doOnComplete(() -> {
                    long latency = clock.millis() - start;
                    Usage finalUsage = usage.get() != null ? usage.get() : estimateUsage(plan, content);
                    recordOutcome(request.getRequestId(), candidate, priced(finalUsage, candidate), latency, null);
                    metrics.recordDispatchLatency(candidate.getProvider(), Duration.ofMillis(latency));
                })
                .doOnCancel(() -> {
                    if (!started.get()) {
                        log.info("[{}] Stream from {} cancelled before first chunk, releasing reservation",
                                request.getRequestId(), candidate.getProvider());
                        quotaPoolManager.release(reserved);
                    } else {
                        log.debug("[{}] Client cancelled stream from {}", request.getRequestId(),
                                candidate.getProvider());
                    }
                })
                .onErrorResume(error -> !(error instanceof QuotaExhaustedException), error -> {
                    ErrorKind kind = onDispatchError(request, candidate, reserved, error);
                    if (started.get()) {
                        log.error("[{}] Stream from {} broke after first chunk ({})", request.getRequestId(),
                                candidate.getProvider(), kind);
                        return Flux.error(failed(plan, candidate, attempted, kind, clock.millis() - start, error));
                    }
                    if (!viaFallback && position + 1 < ranked.size()) {
                        ProviderType to = ranked.get(position + 1).getProvider();
                        log.warn("[{}] Stream from {} failed before first chunk ({}), falling back to {}",
                                request.getRequestId(), candidate.getProvider(), kind, to);
                        metrics.recordFallback(candidate.getProvider(), to);
                        quotaPoolManager.release(reserved);
                        return dispatchStream(plan, position + 1, true, attempted, onDispatched);
                    }
                    return Flux.error(failed(plan, candidate, attempted, kind, clock.millis() - start, error));
                });
    }

    private Flux<ChatCompletionChunk> open(RoutingRequest request, ScoredCandidate candidate,
                                           PoolAllocation allocation) {
        ChatCompletionRequest payload = request.getPayload() != null ? request.getPayload()
                : ChatCompletionRequest.builder().messages(request.getMessages()).maxTokens(request.getMaxTokens())
                        .build();
        boolean live = providerService.supportsStreaming(candidate.getProvider())
                && catalog.find(candidate.getPrediction().key()).map(ModelProfile::isStreaming).orElse(true);
        if (!live) {
            log.debug("[{}] {} cannot stream, replaying buffered response", request.getRequestId(),
                    candidate.getProvider());
            return providerService.forward(candidate.getProvider(), payload.forUpstream(candidate.getModel(), false),
                            allocation.getApiKey())
                    .flatMapMany(streamingService::replay);
        }
        Flux<byte[]> transport = providerService.openStream(candidate.getProvider(),
                payload.forUpstream(candidate.getModel(), true), allocation.getApiKey());
        return streamNormalizer.normalize(candidate.getProvider(), transport,
                "chatcmpl-" + request.getRequestId(), candidate.getModel());
    }

    // ========== Shared steps ==========

    private static RoutingConstraints constraints(RoutingRequest request) {
        return request.getConstraints() != null ? request.getConstraints() : RoutingConstraints.NONE;
    }

    /**
     * Reserve on the candidate's provider. Returns null when that provider's pools ran dry since the
     * decision; a tier-cap refusal propagates.
     */
    private PoolAllocation tryReserve(RoutingPlan plan, ScoredCandidate candidate) {
        RoutingRequest request = plan.getRequest();
        try {
            return quotaPoolManager.reserve(request.getUserId(), candidate.getProvider(),
                    RoutingDecisionEngine.UNITS_PER_REQUEST);
        } catch (QuotaExhaustedException e) {
            if (quotaPoolManager.hasCapacity(candidate.getProvider(), RoutingDecisionEngine.UNITS_PER_REQUEST)) {
                throw e;
            }
            log.info("[{}] {} pools exhausted since decision, trying next candidate", request.getRequestId(),
                    candidate.getProvider());
            return null;
        }
    }

    private ErrorKind onDispatchError(RoutingRequest request, ScoredCandidate candidate, PoolAllocation allocation,
                                      Throwable error) {
        ErrorKind kind = ErrorKind.classify(error);
        metrics.recordDispatchFailure(candidate.getProvider(), kind);
        if (kind == ErrorKind.TIMEOUT || error instanceof TimeoutException) {
            quotaPoolManager.release(allocation);
        } else if (kind == ErrorKind.AUTH) {
            quotaPoolManager.markPoolError(allocation.getPoolId());
        }
        log.error("[{}] Dispatch to {}/{} failed: {}", request.getRequestId(), candidate.getProvider(),
                candidate.getModel(), error.getMessage());
        return kind;
    }

    private RoutingDecision succeeded(RoutingPlan plan, ScoredCandidate candidate, boolean viaFallback,
                                      List<ProviderType> attempted) {
        RoutingDecision decision = plan.getDecision().toBuilder()
                .attemptedProviders(attempted)
                .build()
                .dispatchedTo(candidate, viaFallback);
        decisionLedger.record(decision);
        metrics.recordDecision(candidate.getProvider(), candidate.getModel(), decision.getStrategy());
        return decision;
    }

    private ProviderDispatchException failed(RoutingPlan plan, ScoredCandidate last, List<ProviderType> attempted,
                                             ErrorKind kind, long latencyMs, Throwable error) {
        String reason = "All dispatch attempts failed (" + kind + "): " + error.getMessage();
        decisionLedger.record(plan.getDecision().toBuilder().attemptedProviders(attempted).build().failed(reason));
        recordOutcome(plan.getRequest().getRequestId(), last, null, latencyMs, kind);
        return new ProviderDispatchException(reason, List.copyOf(attempted), error);
    }

    private QuotaExhaustedException exhausted(RoutingPlan plan, List<ProviderType> attempted) {
        decisionLedger.record(plan.getDecision().toBuilder().attemptedProviders(attempted).build()
                .failed("All pools exhausted"));
        return new QuotaExhaustedException("All pools exhausted for today", UpgradePrompt.poolsExhausted());
    }

    private ChatCompletionResponse withCost(ChatCompletionResponse response, ScoredCandidate candidate) {
        return response.toBuilder().usage(priced(response.getUsage(), candidate)).build();
    }

    /**
     * Attach the catalog price of the reported tokens; without usage, the predicted cost.
     */
    private Usage priced(Usage usage, ScoredCandidate candidate) {
        if (usage == null) {
            return Usage.builder().cost(candidate.getPrediction().getPredictedCost()).build();
        }
        double cost = catalog.find(candidate.getPrediction().key())
                .map(profile -> profile.costFor(
                        usage.getPromptTokens() != null ? usage.getPromptTokens() : 0,
                        usage.getCompletionTokens() != null ? usage.getCompletionTokens() : 0))
                .orElse(candidate.getPrediction().getPredictedCost());
        return usage.toBuilder().cost(cost).build();
    }

    private static Usage estimateUsage(RoutingPlan plan, CharSequence content) {
        int completion = (int) Math.ceil(content.length() / 4.0);
        return Usage.of((int) plan.getFeatures().getPromptTokens(), completion);
    }

    private void recordOutcome(String requestId, ScoredCandidate candidate, Usage usage, long latencyMs,
                               ErrorKind errorKind) {
        ExecutionOutcome outcome = ExecutionOutcome.builder()
                .requestId(requestId)
                .provider(candidate.getProvider())
                .model(candidate.getModel())
                .cost(usage != null && usage.getCost() != null ? usage.getCost() : 0.0)
                .latencyMs(latencyMs)
                .success(errorKind == null)
                .errorKind(errorKind)
                .completedAt(clock.instant())
                .build();
        try {
            accuracyMonitor.recordOutcome(outcome);
        } catch (RuntimeException e) {
            log.warn("[{}] Outcome not recorded: {}", requestId, e.getMessage());
        }
    }
}
