package com.relay.service.monitoring;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.relay.config.RelayProperties;
import com.relay.exception.DuplicateOutcomeException;
import com.relay.exception.ResourceNotFoundException;
import com.relay.model.routing.CandidatePrediction;
import com.relay.model.routing.ErrorKind;
import com.relay.model.routing.ExecutionOutcome;
import com.relay.model.routing.ModelKey;
import com.relay.model.routing.OptimizationStrategy;
import com.relay.model.routing.ProviderType;
import com.relay.model.routing.RoutingDecision;
import com.relay.model.routing.RoutingState;
import com.relay.model.routing.ScoredCandidate;
import com.relay.service.prediction.CalibrationStore;
import com.relay.service.routing.DecisionLedger;
import com.relay.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AccuracyMonitorTest {

    private static final ModelKey KEY = ModelKey.of(ProviderType.OPENAI, "gpt-4o-mini");

    private MutableClock clock;
    private SimpleMeterRegistry registry;
    private RelayProperties properties;
    private DecisionLedger ledger;
    private CalibrationStore calibrationStore;
    private AlertManager alertManager;
    private AccuracyMonitor monitor;
    private List<Runnable> workerTasks;
    private int sequence;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-03-10T12:00:00Z");
        registry = new SimpleMeterRegistry();
        properties = new RelayProperties();
        monitor = build();
    }

    private AccuracyMonitor build() {
        RelayMetrics metrics = new RelayMetrics(registry);
        ledger = new DecisionLedger(Caffeine.newBuilder().build());
        calibrationStore = new CalibrationStore(properties);
        alertManager = new AlertManager(properties, clock, metrics);
        workerTasks = new ArrayList<>();
        AccuracyMonitor built = new AccuracyMonitor(properties,
                new OutcomeRegistry(Caffeine.newBuilder().build()),
                ledger,
                calibrationStore,
                new DriftDetector(properties),
                alertManager,
                new SamplingPolicy(properties, clock),
                metrics,
                clock,
                Schedulers.fromExecutor(workerTasks::add));
        built.start();
        return built;
    }

    /** Runs the worker until nothing is waiting and returns how many outcomes it processed. */
    private int drain() {
        int before = monitor.getQueueSize();
        while (!workerTasks.isEmpty()) {
            workerTasks.remove(0).run();
        }
        return before - monitor.getQueueSize();
    }

    private static CandidatePrediction prediction() {
        return CandidatePrediction.builder()
                .provider(KEY.getProvider())
                .model(KEY.getModel())
                .predictedCost(0.002)
                .predictedLatencyMs(1000)
                .predictedQuality(0.8)
                .confidence(0.5)
                .baseCost(0.002)
                .baseLatencyMs(1000)
                .build();
    }

    /** Records a decision for a fresh request id and returns the id. */
    private String decide() {
        String requestId = "req_" + (++sequence);
        CandidatePrediction prediction = prediction();
        ledger.record(RoutingDecision.builder()
                .requestId(requestId)
                .userId("user-1")
                .provider(KEY.getProvider())
                .model(KEY.getModel())
                .strategy(OptimizationStrategy.BALANCED)
                .chosen(prediction)
                .alternatives(List.of(new ScoredCandidate(prediction, 1.0, 0)))
                .state(RoutingState.DISPATCHED)
                .decidedAt(clock.instant())
                .build());
        return requestId;
    }

    private static ExecutionOutcome outcome(String requestId, double cost, long latencyMs) {
        return ExecutionOutcome.builder()
                .requestId(requestId)
                .provider(KEY.getProvider())
                .model(KEY.getModel())
                .cost(cost)
                .latencyMs(latencyMs)
                .success(true)
                .build();
    }

    private void observe(int count, double cost, long latencyMs) {
        for (int i = 0; i < count; i++) {
            monitor.recordOutcome(outcome(decide(), cost, latencyMs));
        }
        drain();
    }

    @Nested
    @DisplayName("Recording outcomes")
    class Recording {

        @Test
        @DisplayName("should reject a second outcome for the same request")
        void duplicate() {
            String requestId = decide();
            monitor.recordOutcome(outcome(requestId, 0.002, 1000));

            assertThatThrownBy(() -> monitor.recordOutcome(outcome(requestId, 0.003, 900)))
                    .isInstanceOf(DuplicateOutcomeException.class);
            assertThat(monitor.getQueueSize()).isEqualTo(1);
        }

        @Test
        @DisplayName("should register but not queue outcomes when monitoring is disabled")
        void disabled() {
            properties.getMonitoring().setEnabled(false);
            monitor = build();
            String requestId = decide();

            assertThat(monitor.recordOutcome(outcome(requestId, 0.002, 1000))).isFalse();
            assertThat(monitor.getQueueSize()).isZero();
            assertThatThrownBy(() -> monitor.recordOutcome(outcome(requestId, 0.002, 1000)))
                    .isInstanceOf(DuplicateOutcomeException.class);
        }

        @Test
        @DisplayName("should drop the incoming sample when the queue is full")
        void dropWhenFull() {
            properties.getMonitoring().setQueueCapacity(2);
            registry = new SimpleMeterRegistry();
            monitor = build();

            assertThat(monitor.recordOutcome(outcome(decide(), 0.002, 1000))).isTrue();
            assertThat(monitor.recordOutcome(outcome(decide(), 0.002, 1000))).isTrue();
            assertThat(monitor.recordOutcome(outcome(decide(), 0.002, 1000))).isFalse();

            assertThat(monitor.getQueueSize()).isEqualTo(2);
            assertThat(monitor.getDroppedSamples()).isEqualTo(1);
            assertThat(registry.counter("relay.monitoring.dropped_samples").count()).isEqualTo(1.0);
            assertThat(registry.get("relay.monitoring.queue_size").gauge().value()).isEqualTo(2.0);
        }
    }

    @Nested
    @DisplayName("Pairing with decisions")
    class Pairing {

        @Test
        @DisplayName("should score an outcome against its prediction and teach the calibration")
        void paired() {
            monitor.recordOutcome(outcome(decide(), 0.002, 1000));

            assertThat(drain()).isEqualTo(1);

            AccuracyMetrics metrics = monitor.getAccuracyMetrics(KEY).orElseThrow();
            assertThat(metrics.getOverallAccuracy()).isEqualTo(1.0);
            assertThat(metrics.getProviderMatchRate()).isEqualTo(1.0);
            assertThat(metrics.getSampleSize()).isEqualTo(1);
            assertThat(metrics.getQualityAccuracy()).isNull();
            assertThat(calibrationStore.get(KEY).getSampleCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("should fold quality scores into accuracy")
        void quality() {
            monitor.recordOutcome(outcome(decide(), 0.002, 1000).toBuilder().qualityScore(0.6).build());
            drain();

            AccuracyMetrics metrics = monitor.getAccuracyMetrics(KEY).orElseThrow();
            assertThat(metrics.getQualityAccuracy()).isEqualTo(0.8);
            assertThat(calibrationStore.get(KEY).getQualityAccuracy()).isEqualTo(0.8);
        }

        @Test
        @DisplayName("should skip outcomes without a recorded decision")
        void unpaired() {
            monitor.recordOutcome(outcome("req_unknown", 0.002, 1000));

            assertThat(drain()).isEqualTo(1);
            assertThat(monitor.getAccuracyMetrics(KEY)).isEmpty();
        }

        @Test
        @DisplayName("should leave failed outcomes out of accuracy")
        void failures() {
            monitor.recordOutcome(outcome(decide(), 0, 30000).toBuilder()
                    .success(false)
                    .errorKind(ErrorKind.TIMEOUT)
                    .build());
            drain();

            assertThat(monitor.getAccuracyMetrics(KEY)).isEmpty();
            assertThat(calibrationStore.get(KEY).getSampleCount()).isZero();
        }
    }

    @Nested
    @DisplayName("Alerts and drift")
    class AlertsAndDrift {

        @Test
        @DisplayName("should alert on low accuracy once the sample size is reached")
        void accuracyAlert() {
            observe(9, 0.004, 1000);
            assertThat(alertManager.count(AlertType.ACCURACY_DEGRADATION)).isZero();

            observe(1, 0.004, 1000);

            List<Alert> alerts = alertManager.getAlerts(true);
            assertThat(alerts).hasSize(1);
            assertThat(alerts.get(0).getType()).isEqualTo(AlertType.ACCURACY_DEGRADATION);
            assertThat(alerts.get(0).getSeverity()).isEqualTo(AlertSeverity.HIGH);
            assertThat(alerts.get(0).getValue()).isEqualTo(0.75);
        }

        @Test
        @DisplayName("should flag latency far above the prediction")
        void latencyAnomaly() {
            observe(1, 0.002, 6000);

            assertThat(alertManager.count(AlertType.PERFORMANCE_ANOMALY)).isEqualTo(1);
        }

        @Test
        @DisplayName("should detect drift against the frozen baseline and penalize confidence")
        void drift() {
            observe(10, 0.002, 1000);
            assertThat(monitor.detectDrift(KEY).isDriftDetected()).isFalse();

            observe(10, 0.004, 1000);

            DriftDetectionResult result = monitor.detectDrift(KEY);
            assertThat(result.isDriftDetected()).isTrue();
            assertThat(result.getAffectedMetrics()).containsExactly("cost");
            assertThat(result.getRecommendedAction()).isEqualTo(RecommendedAction.FALLBACK);
            assertThat(result.getBaseline().getCostAccuracy()).isEqualTo(1.0);
            assertThat(result.getCurrent().getCostAccuracy()).isEqualTo(0.5);
            assertThat(alertManager.getAlerts(false))
                    .anySatisfy(alert -> {
                        assertThat(alert.getType()).isEqualTo(AlertType.DRIFT_DETECTED);
                        assertThat(alert.getSeverity()).isEqualTo(AlertSeverity.CRITICAL);
                    });
            assertThat(calibrationStore.get(KEY).isPenalized()).isTrue();
            assertThat(monitor.getMonitoringInsights().getDriftDetections()).isEqualTo(1);
        }

        @Test
        @DisplayName("should clear drift after a rebaseline")
        void rebaseline() {
            observe(10, 0.002, 1000);
            observe(10, 0.004, 1000);

            AccuracyMetrics baseline = monitor.rebaseline(KEY);

            assertThat(baseline.getSampleSize()).isEqualTo(20);
            DriftDetectionResult result = monitor.detectDrift(KEY);
            assertThat(result.isDriftDetected()).isFalse();
            assertThat(result.getRecommendedAction()).isEqualTo(RecommendedAction.MONITOR);
        }

        @Test
        @DisplayName("should report no baseline before the minimum sample size")
        void noBaseline() {
            observe(3, 0.002, 1000);

            DriftDetectionResult result = monitor.detectDrift(KEY);

            assertThat(result.getBaseline()).isNull();
            assertThat(result.getRecommendedAction()).isEqualTo(RecommendedAction.MONITOR);
        }

        @Test
        @DisplayName("should reject drift queries for unknown models")
        void unknownModel() {
            assertThatThrownBy(() -> monitor.detectDrift(KEY)).isInstanceOf(ResourceNotFoundException.class);
            assertThatThrownBy(() -> monitor.rebaseline(KEY)).isInstanceOf(ResourceNotFoundException.class);
        }
    }

    @Test
    @DisplayName("should summarize tracked models")
    void insights() {
        observe(2, 0.002, 1000);

        MonitoringInsights insights = monitor.getMonitoringInsights();

        assertThat(insights.getModelsTracked()).isEqualTo(1);
        assertThat(insights.getSamplesAnalyzed()).isEqualTo(2);
        assertThat(insights.getAverageAccuracy()).isEqualTo(1.0);
        assertThat(insights.getTopModels()).extracting(MonitoringInsights.ModelAccuracy::getModel)
                .containsExactly("openai/gpt-4o-mini");
        assertThat(insights.getQueueSize()).isZero();
    }

    @Test
    @DisplayName("should compare two models with too little history as insufficient")
    void compareInsufficient() {
        observe(2, 0.002, 1000);

        ModelComparison comparison = monitor.compareModelPerformance(KEY,
                ModelKey.of(ProviderType.ANTHROPIC, "claude-3-haiku-20240307"));

        assertThat(comparison.getRecommendation()).isEqualTo(ModelComparison.Recommendation.INSUFFICIENT_DATA);
    }
}
