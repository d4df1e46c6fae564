package com.relay.service.monitoring;

import com.relay.config.RelayProperties;
import com.relay.exception.ResourceNotFoundException;
import com.relay.model.routing.CandidatePrediction;
import com.relay.model.routing.ExecutionOutcome;
import com.relay.model.routing.ModelKey;
import com.relay.model.routing.RoutingDecision;
import com.relay.model.routing.ScoredCandidate;
import com.relay.service.prediction.CalibrationStore;
import com.relay.service.routing.DecisionLedger;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.Disposable;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Closes the loop between predictions and outcomes.
 *
 * Recording is cheap and never blocks the request path: the outcome is registered once, sampled,
 * and emitted into a unicast sink. A single worker consumes the sink one outcome at a time, pairing
 * each with its prediction from the {@link DecisionLedger} before it updates the per-model history and
 * feeds the {@link CalibrationStore}. Alerts and drift detection run on the same worker. At most
 * {@code queue-capacity} outcomes wait; past that the incoming sample is dropped.
 */
@Slf4j
@Service
public class AccuracyMonitor {

    static final int OVERHEAD_WINDOW = 100;
    static final int TOP_MODELS = 5;
    static final double HIGH_SEVERITY_ACCURACY = 0.8;

    private final RelayProperties.MonitoringConfig config;
    private final OutcomeRegistry outcomeRegistry;
    private final DecisionLedger decisionLedger;
    private final CalibrationStore calibrationStore;
    private final DriftDetector driftDetector;
    private final AlertManager alertManager;
    private final SamplingPolicy samplingPolicy;
    private final RelayMetrics metrics;
    private final Clock clock;

    private final Sinks.Many<ExecutionOutcome> outcomes = Sinks.many().unicast().onBackpressureBuffer();
    private final Scheduler scheduler;
    private final int capacity;
    private final AtomicInteger pending = new AtomicInteger();
    private final ReentrantLock emitLock = new ReentrantLock();
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<ModelKey, AccuracyHistory> histories = new HashMap<>();
    private final Map<ModelKey, DriftDetectionResult> lastDrift = new HashMap<>();
    private final Deque<Double> overheadMs = new ArrayDeque<>();
    private final AtomicLong droppedSamples = new AtomicLong();
    private final List<SampleListener> listeners = new CopyOnWriteArrayList<>();

    private Disposable worker;

    @Autowired
    public AccuracyMonitor(RelayProperties properties,
                           OutcomeRegistry outcomeRegistry,
                           DecisionLedger decisionLedger,
                           CalibrationStore calibrationStore,
                           DriftDetector driftDetector,
                           AlertManager alertManager,
                           SamplingPolicy samplingPolicy,
                           RelayMetrics metrics,
                           Clock clock) {
        this(properties, outcomeRegistry, decisionLedger, calibrationStore, driftDetector, alertManager,
                samplingPolicy, metrics, clock, Schedulers.newSingle("relay-accuracy-monitor", true));
    }

    AccuracyMonitor(RelayProperties properties,
                           OutcomeRegistry outcomeRegistry,
                           DecisionLedger decisionLedger,
                           CalibrationStore calibrationStore,
                           DriftDetector driftDetector,
                           AlertManager alertManager,
                           SamplingPolicy samplingPolicy,
                           RelayMetrics metrics,
                           Clock clock,
                           Scheduler scheduler) {
        this.config = properties.getMonitoring();
        this.outcomeRegistry = outcomeRegistry;
        this.decisionLedger = decisionLedger;
        this.calibrationStore = calibrationStore;
        this.driftDetector = driftDetector;
        this.alertManager = alertManager;
        this.samplingPolicy = samplingPolicy;
        this.metrics = metrics;
        this.clock = clock;
        this.scheduler = scheduler;
        this.capacity = Math.max(1, config.getQueueCapacity());
        metrics.registerQueueGauge(pending::get);
    }

    @PostConstruct
    public void start() {
        if (!config.isEnabled()) {
            log.info("Accuracy monitoring disabled");
            return;
        }
        worker = outcomes.asFlux()
                .publishOn(scheduler, 1)
                .subscribe(this::processSafely,
                        error -> log.error("Accuracy monitor stopped", error));
        log.info("Accuracy monitor started (queue capacity {})", config.getQueueCapacity());
    }

    @PreDestroy
    public void shutdown() {
        if (worker != null) {
            worker.dispose();
        }
        outcomes.tryEmitComplete();
        scheduler.dispose();
    }

    /**
     * Register an outcome and queue it for processing if sampled.
     *
     * @return true if the outcome was queued, false if it was not sampled or the queue was full
     * @throws com.relay.exception.DuplicateOutcomeException if this request id already has an outcome
     */
    public boolean recordOutcome(ExecutionOutcome outcome) {
        outcomeRegistry.register(outcome);
        if (!config.isEnabled() || !samplingPolicy.shouldSample(outcome)) {
            return false;
        }
        // Sinks reject concurrent emitters, so producers take turns
        emitLock.lock();
        try {
            if (pending.get() >= capacity) {
                droppedSamples.incrementAndGet();
                metrics.recordDroppedSample();
                log.warn("Monitoring queue full ({}), dropped outcome {}", capacity, outcome.getRequestId());
                return false;
            }
            Sinks.EmitResult result = outcomes.tryEmitNext(outcome);
            if (result.isFailure()) {
                log.warn("Outcome {} not queued: {}", outcome.getRequestId(), result);
                return false;
            }
            pending.incrementAndGet();
            return true;
        } finally {
            emitLock.unlock();
        }
    }

    private void processSafely(ExecutionOutcome outcome) {
        long start = System.nanoTime();
        try {
            process(outcome);
        } catch (RuntimeException e) {
            log.error("Accuracy processing failed for {}", outcome.getRequestId(), e);
        } finally {
            pending.decrementAndGet();
            recordOverhead((System.nanoTime() - start) / 1_000_000.0);
        }
    }

    void process(ExecutionOutcome outcome) {
        Optional<RoutingDecision> decision = decisionLedger.find(outcome.getRequestId());
        if (decision.isEmpty()) {
            log.debug("No decision on record for {}, outcome not paired", outcome.getRequestId());
            return;
        }
        ModelKey key = outcome.key();
        Optional<CandidatePrediction> prediction = predictionFor(decision.get(), key);
        if (prediction.isEmpty()) {
            log.debug("Decision {} has no prediction for {}", outcome.getRequestId(), key);
            return;
        }

        Instant now = clock.instant();
        PredictionSample sample;
        lock.lock();
        try {
            AccuracyHistory history = histories.computeIfAbsent(key,
                    k -> new AccuracyHistory(k, config.getMaxHistorySize()));
            if (!outcome.isSuccess()) {
                history.recordFailure();
                log.debug("Outcome {} failed ({}), not used for accuracy", outcome.getRequestId(),
                        outcome.getErrorKind());
                return;
            }

            CandidatePrediction predicted = prediction.get();
            calibrationStore.recordObservation(key, predicted.getBaseCost(), outcome.getCost(),
                    predicted.getBaseLatencyMs(), outcome.getLatencyMs(), outcome.getQualityScore());

            boolean routedAsDecided = routedAsDecided(decision.get(), key);
            sample = PredictionSample.of(predicted, outcome, routedAsDecided);
            AccuracyMetrics current = history.add(sample, now);
            if (current.getQualityAccuracy() != null) {
                calibrationStore.updateQualityAccuracy(key, current.getQualityAccuracy());
            }
            if (!history.hasBaseline() && history.size() >= config.getMinSampleSize()) {
                history.freezeBaseline(now);
                log.info("Accuracy baseline for {} frozen at {} over {} samples", key,
                        current.getOverallAccuracy(), current.getSampleSize());
            }

            checkAccuracy(key, current);
            checkLatency(key, predicted, outcome);
            checkDrift(history, now);
        } finally {
            lock.unlock();
        }
        notifyListeners(decision.get(), sample);
    }

    /**
     * Register a listener for paired samples. Listeners run on the monitor's worker and must not block.
     */
    public void addSampleListener(SampleListener listener) {
        listeners.add(listener);
    }

    private void notifyListeners(RoutingDecision decision, PredictionSample sample) {
        for (SampleListener listener : listeners) {
            try {
                listener.onSample(decision, sample);
            } catch (RuntimeException e) {
                log.warn("Sample listener failed for {}: {}", decision.getRequestId(), e.getMessage());
            }
        }
    }

    private void checkAccuracy(ModelKey key, AccuracyMetrics current) {
        if (current.getSampleSize() < config.getMinSampleSize()
                || current.getOverallAccuracy() >= config.getAccuracyThreshold()) {
            return;
        }
        AlertSeverity severity = current.getOverallAccuracy() < HIGH_SEVERITY_ACCURACY
                ? AlertSeverity.HIGH : AlertSeverity.MEDIUM;
        alertManager.raise(AlertType.ACCURACY_DEGRADATION, severity, key,
                String.format("Accuracy dropped to %.1f%% (target: %.1f%%)",
                        current.getOverallAccuracy() * 100, config.getAccuracyThreshold() * 100),
                current.getOverallAccuracy());
    }

    private void checkLatency(ModelKey key, CandidatePrediction predicted, ExecutionOutcome outcome) {
        long slow = config.getSampling().getSlowRequestThresholdMs();
        double limit = predicted.getPredictedLatencyMs() * config.getAnomalyLatencyFactor();
        if (outcome.getLatencyMs() <= slow || outcome.getLatencyMs() <= limit) {
            return;
        }
        double ratio = predicted.getPredictedLatencyMs() > 0
                ? (double) outcome.getLatencyMs() / predicted.getPredictedLatencyMs() : outcome.getLatencyMs();
        alertManager.raise(AlertType.PERFORMANCE_ANOMALY, AlertSeverity.MEDIUM, key,
                String.format("Request %s took %dms, predicted %dms", outcome.getRequestId(),
                        outcome.getLatencyMs(), predicted.getPredictedLatencyMs()),
                ratio);
    }

    private void checkDrift(AccuracyHistory history, Instant now) {
        if (!history.hasBaseline()) {
            return;
        }
        DriftDetectionResult result = detect(history, now);
        lastDrift.put(history.getKey(), result);
        if (!result.isDriftDetected() || result.getRecommendedAction() == RecommendedAction.MONITOR) {
            return;
        }
        AlertSeverity severity = result.getRecommendedAction() == RecommendedAction.FALLBACK
                ? AlertSeverity.CRITICAL : AlertSeverity.HIGH;
        alertManager.raise(AlertType.DRIFT_DETECTED, severity, history.getKey(),
                String.format("Performance drift detected: %.1f%% change in %s",
                        result.getDriftMagnitude() * 100, String.join(", ", result.getAffectedMetrics())),
                result.getDriftMagnitude());
        if (result.getRecommendedAction() == RecommendedAction.FALLBACK
                && !calibrationStore.get(history.getKey()).isPenalized()) {
            calibrationStore.penalize(history.getKey());
        }
    }

    private DriftDetectionResult detect(AccuracyHistory history, Instant now) {
        int window = Math.min(config.getRecentWindowSize(), history.samplesSinceBaseline());
        return driftDetector.detect(history.getKey(),
                history.getBaseline(), history.baselineAccuracies(),
                history.recentMetrics(window, now), history.overallAccuracies(window),
                now);
    }

    public Optional<AccuracyMetrics> getAccuracyMetrics(ModelKey key) {
        lock.lock();
        try {
            AccuracyHistory history = histories.get(key);
            return Optional.ofNullable(history != null ? history.getLatest() : null);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drift of the recent window against the stored baseline. Without a baseline the result is MONITOR.
     */
    public DriftDetectionResult detectDrift(ModelKey key) {
        Instant now = clock.instant();
        lock.lock();
        try {
            AccuracyHistory history = histories.get(key);
            if (history == null) {
                throw new ResourceNotFoundException("No accuracy history for " + key);
            }
            if (!history.hasBaseline()) {
                return DriftDetectionResult.noBaseline(key, history.getLatest(), now);
            }
            return detect(history, now);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Replace the drift baseline with the current history.
     */
    public AccuracyMetrics rebaseline(ModelKey key) {
        lock.lock();
        try {
            AccuracyHistory history = histories.get(key);
            if (history == null || history.size() == 0) {
                throw new ResourceNotFoundException("No accuracy history for " + key);
            }
            lastDrift.remove(key);
            AccuracyMetrics baseline = history.freezeBaseline(clock.instant());
            log.info("Accuracy baseline for {} reset to {} over {} samples", key, baseline.getOverallAccuracy(),
                    baseline.getSampleSize());
            return baseline;
        } finally {
            lock.unlock();
        }
    }

    public ModelComparison compareModelPerformance(ModelKey baseline, ModelKey comparison) {
        lock.lock();
        try {
            AccuracyHistory a = histories.get(baseline);
            AccuracyHistory b = histories.get(comparison);
            int window = config.getRecentWindowSize();
            return driftDetector.compare(
                    baseline, a != null ? a.getLatest() : null, a != null ? a.overallAccuracies(window) : List.of(),
                    comparison, b != null ? b.getLatest() : null, b != null ? b.overallAccuracies(window) : List.of());
        } finally {
            lock.unlock();
        }
    }

    public MonitoringInsights getMonitoringInsights() {
        List<AccuracyMetrics> latest = new ArrayList<>();
        List<MonitoringInsights.ModelAccuracy> accuracies = new ArrayList<>();
        long samples = 0;
        long drifted;
        List<Double> overhead;
        lock.lock();
        try {
            for (AccuracyHistory history : histories.values()) {
                samples += history.size();
                if (history.getLatest() != null) {
                    latest.add(history.getLatest());
                    accuracies.add(new MonitoringInsights.ModelAccuracy(history.getKey().toString(),
                            history.getLatest().getOverallAccuracy()));
                }
            }
            drifted = lastDrift.values().stream().filter(DriftDetectionResult::isDriftDetected).count();
            overhead = new ArrayList<>(overheadMs);
        } finally {
            lock.unlock();
        }

        double average = latest.stream().mapToDouble(AccuracyMetrics::getOverallAccuracy).average().orElse(0);
        overhead.sort(Comparator.naturalOrder());
        List<MonitoringInsights.ModelAccuracy> top = accuracies.stream()
                .sorted(Comparator.comparingDouble(MonitoringInsights.ModelAccuracy::getAccuracy).reversed()
                        .thenComparing(MonitoringInsights.ModelAccuracy::getModel))
                .limit(TOP_MODELS)
                .toList();

        return MonitoringInsights.builder()
                .modelsTracked(latest.size())
                .samplesAnalyzed(samples)
                .averageAccuracy(average)
                .driftDetections(Math.max(drifted, alertManager.count(AlertType.DRIFT_DETECTED)))
                .alertsSummary(alertManager.summary())
                .topModels(top)
                .queueSize(pending.get())
                .droppedSamples(droppedSamples.get())
                .averageOverheadMs(overhead.stream().mapToDouble(Double::doubleValue).average().orElse(0))
                .maxOverheadMs(overhead.isEmpty() ? 0 : overhead.get(overhead.size() - 1))
                .p95OverheadMs(overhead.isEmpty() ? 0
                        : overhead.get(Math.min(overhead.size() - 1, (int) Math.floor(overhead.size() * 0.95))))
                .build();
    }

    public int getQueueSize() {
        return pending.get();
    }

    public long getDroppedSamples() {
        return droppedSamples.get();
    }

    private void recordOverhead(double ms) {
        lock.lock();
        try {
            overheadMs.addLast(ms);
            if (overheadMs.size() > OVERHEAD_WINDOW) {
                overheadMs.pollFirst();
            }
        } finally {
            lock.unlock();
        }
    }

    private static Optional<CandidatePrediction> predictionFor(RoutingDecision decision, ModelKey key) {
        if (decision.getAlternatives() != null) {
            for (ScoredCandidate candidate : decision.getAlternatives()) {
                if (candidate.getPrediction().key().equals(key)) {
                    return Optional.of(candidate.getPrediction());
                }
            }
        }
        if (decision.getChosen() != null && decision.getChosen().key().equals(key)) {
            return Optional.of(decision.getChosen());
        }
        return Optional.empty();
    }

    private static boolean routedAsDecided(RoutingDecision decision, ModelKey key) {
        if (decision.getAlternatives() == null || decision.getAlternatives().isEmpty()) {
            return decision.getChosen() != null && decision.getChosen().key().equals(key);
        }
        return decision.getAlternatives().get(0).getPrediction().key().equals(key);
    }
}
