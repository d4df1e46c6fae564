package com.relay.service.experiment;

import com.relay.config.RelayProperties;
import com.relay.exception.ExperimentStateException;
import com.relay.exception.ResourceNotFoundException;
import com.relay.model.routing.RoutingDecision;
import com.relay.model.routing.RoutingRequest;
import com.relay.model.routing.ScoredCandidate;
import com.relay.model.routing.Variant;
import com.relay.service.RoutingRequestFactory;
import com.relay.service.monitoring.AccuracyMonitor;
import com.relay.service.monitoring.PredictionSample;
import com.relay.service.monitoring.SampleListener;
import com.relay.service.prediction.RequestFeatures;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runs two-variant routing experiments.
 *
 * A running experiment takes a share of eligible requests and forces the model of the participant's
 * variant, provided that model survived the caller's constraints. Users keep their variant for the life
 * of the experiment. Results come from the accuracy monitor's paired samples, so only requests that ran
 * on their variant's model count. Analysis runs periodically and on demand; with auto-stop enabled a
 * significant winner above the threshold completes the experiment.
 */
@Slf4j
@Service
public class ExperimentManager implements SampleListener {

    private final RelayProperties.ExperimentConfig settings;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, Experiment> experiments = new LinkedHashMap<>();
    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread thread = new Thread(r, "relay-experiment-analysis");
        thread.setDaemon(true);
        return thread;
    });

    public ExperimentManager(RelayProperties properties, AccuracyMonitor accuracyMonitor, Clock clock) {
        this.settings = properties.getExperiments();
        this.clock = clock;
        accuracyMonitor.addSampleListener(this);
    }

    @PostConstruct
    public void start() {
        if (!settings.isEnabled()) {
            log.info("Routing experiments disabled");
            return;
        }
        long interval = settings.getAnalysisInterval().toMillis();
        scheduler.scheduleWithFixedDelay(this::analyzeRunningSafely, interval, interval, TimeUnit.MILLISECONDS);
        log.info("Experiment analysis every {}", settings.getAnalysisInterval());
    }

    @PreDestroy
    public void shutdown() {
        scheduler.shutdownNow();
    }

    // ========== Lifecycle ==========

    /**
     * Register a new experiment in DRAFT.
     *
     * @throws IllegalArgumentException  if the definition is invalid
     * @throws ExperimentStateException  if the id is taken
     */
    public ExperimentSnapshot create(ExperimentConfig config) {
        config.validate();
        lock.lock();
        try {
            if (experiments.containsKey(config.getId())) {
                throw new ExperimentStateException("Experiment " + config.getId() + " already exists");
            }
            Experiment experiment = new Experiment(config, clock.instant());
            experiments.put(config.getId(), experiment);
            log.info("Created experiment {} ({} vs {}, primary metric {})", config.getId(),
                    config.getVariantA().key(), config.getVariantB().key(), config.getPrimaryMetric().id());
            return ExperimentSnapshot.of(experiment);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Start a draft or resume a paused experiment.
     */
    public ExperimentSnapshot start(String experimentId) {
        lock.lock();
        try {
            Experiment experiment = require(experimentId);
            ExperimentStatus status = experiment.getStatus();
            if (status != ExperimentStatus.DRAFT && status != ExperimentStatus.PAUSED) {
                throw new ExperimentStateException("Experiment " + experimentId + " cannot start from " + status);
            }
            experiment.start(clock.instant());
            log.info("Experiment {} {}", experimentId, status == ExperimentStatus.DRAFT ? "started" : "resumed");
            return ExperimentSnapshot.of(experiment);
        } finally {
            lock.unlock();
        }
    }

    public ExperimentSnapshot pause(String experimentId) {
        lock.lock();
        try {
            Experiment experiment = require(experimentId);
            if (experiment.getStatus() != ExperimentStatus.RUNNING) {
                throw new ExperimentStateException("Experiment " + experimentId + " is not running");
            }
            experiment.pause();
            log.info("Experiment {} paused", experimentId);
            return ExperimentSnapshot.of(experiment);
        } finally {
            lock.unlock();
        }
    }

    public ExperimentSnapshot stop(String experimentId, String reason) {
        lock.lock();
        try {
            Experiment experiment = require(experimentId);
            if (experiment.getStatus().isFinished()) {
                throw new ExperimentStateException("Experiment " + experimentId + " already "
                        + experiment.getStatus().name().toLowerCase());
            }
            String why = reason != null && !reason.isBlank() ? reason : "Manual stop";
            experiment.finish(ExperimentStatus.STOPPED, why, clock.instant());
            log.info("Experiment {} stopped: {}", experimentId, why);
            return ExperimentSnapshot.of(experiment);
        } finally {
            lock.unlock();
        }
    }

    public ExperimentSnapshot get(String experimentId) {
        lock.lock();
        try {
            return ExperimentSnapshot.of(require(experimentId));
        } finally {
            lock.unlock();
        }
    }

    /**
     * @param status only experiments in this status; null for all
     */
    public List<ExperimentSnapshot> list(ExperimentStatus status) {
        lock.lock();
        try {
            return experiments.values().stream()
                    .filter(e -> status == null || e.getStatus() == status)
                    .map(ExperimentSnapshot::of)
                    .toList();
        } finally {
            lock.unlock();
        }
    }

    // ========== Traffic split ==========

    /**
     * Pick the experiment variant this request runs on, if any. Only a variant whose model is among
     * {@code ranked} is ever returned; the first running experiment that applies wins.
     */
    public Optional<ExperimentAssignment> assign(RoutingRequest request, RequestFeatures features,
                                                 List<ScoredCandidate> ranked) {
        if (!settings.isEnabled()) {
            return Optional.empty();
        }
        Instant now = clock.instant();
        lock.lock();
        try {
            for (Experiment experiment : experiments.values()) {
                if (experiment.getStatus() != ExperimentStatus.RUNNING) {
                    continue;
                }
                ExperimentConfig config = experiment.getConfig();
                if (experiment.isExpired(now)) {
                    experiment.finish(ExperimentStatus.STOPPED, "Duration expired", now);
                    log.info("Experiment {} stopped: ran past {}", config.getId(), config.getMaxDuration());
                    continue;
                }
                if (!config.admits(features.getCapability())
                        || bucket(config.getId() + ":" + request.getRequestId()) >= config.getTrafficAllocation()) {
                    continue;
                }
                Variant variant = variantFor(experiment, request);
                ExperimentVariant arm = config.variant(variant);
                ExperimentAssignment assignment = new ExperimentAssignment(config.getId(), variant,
                        arm.getProvider(), arm.getModel());
                if (ranked.stream().noneMatch(assignment::matches)) {
                    log.debug("[{}] Experiment {} variant {} ({}) not admissible, skipping", request.getRequestId(),
                            config.getId(), variant, arm.key());
                    continue;
                }
                return Optional.of(assignment);
            }
            return Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    private Variant variantFor(Experiment experiment, RoutingRequest request) {
        ExperimentConfig config = experiment.getConfig();
        String userId = request.getUserId();
        if (userId == null || RoutingRequestFactory.ANONYMOUS_USER.equals(userId)) {
            return pick(config, request.getRequestId());
        }
        return experiment.getAssignments().computeIfAbsent(userId, user -> pick(config, user));
    }

    private static Variant pick(ExperimentConfig config, String subject) {
        return bucket(config.getId() + "/" + subject) < config.getVariantA().getWeight() ? Variant.A : Variant.B;
    }

    /**
     * Stable position of {@code key} in [0, 1).
     */
    static double bucket(String key) {
        long bits = UUID.nameUUIDFromBytes(key.getBytes(StandardCharsets.UTF_8)).getMostSignificantBits();
        return (bits >>> 11) * 0x1.0p-53;
    }

    // ========== Results and analysis ==========

    @Override
    public void onSample(RoutingDecision decision, PredictionSample sample) {
        if (decision.getExperimentId() == null || decision.getVariant() == null) {
            return;
        }
        lock.lock();
        try {
            Experiment experiment = experiments.get(decision.getExperimentId());
            if (experiment == null || experiment.getStatus() != ExperimentStatus.RUNNING) {
                return;
            }
            ExperimentVariant arm = experiment.getConfig().variant(decision.getVariant());
            if (!arm.key().equals(sample.getOutcome().key())) {
                log.debug("[{}] Ran on {} instead of variant {} ({}), not counted", decision.getRequestId(),
                        sample.getOutcome().key(), decision.getVariant(), arm.key());
                return;
            }
            experiment.addResult(ExperimentResult.of(decision.getVariant(), sample, clock.instant()),
                    settings.getMaxResults(), settings.getRetainedResults());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Analyze an experiment now, completing it when auto-stop finds a winner.
     */
    public ExperimentAnalysis analyze(String experimentId) {
        lock.lock();
        try {
            return analyze(require(experimentId));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Analyze every running experiment that has results since its last analysis.
     *
     * @return number of experiments analyzed
     */
    public int analyzeRunning() {
        lock.lock();
        try {
            int analyzed = 0;
            for (Experiment experiment : experiments.values()) {
                if (experiment.getStatus() == ExperimentStatus.RUNNING && experiment.hasUnanalyzedResults()) {
                    analyze(experiment);
                    analyzed++;
                }
            }
            return analyzed;
        } finally {
            lock.unlock();
        }
    }

    private void analyzeRunningSafely() {
        try {
            int analyzed = analyzeRunning();
            log.debug("Periodic experiment analysis covered {} experiments", analyzed);
        } catch (RuntimeException e) {
            log.error("Periodic experiment analysis failed", e);
        }
    }

    private ExperimentAnalysis analyze(Experiment experiment) {
        Instant now = clock.instant();
        ExperimentConfig config = experiment.getConfig();
        ExperimentAnalysis analysis = ExperimentAnalyzer.analyze(config, List.copyOf(experiment.getResults()), now);
        experiment.analyzed(analysis);
        log.debug("Experiment {}: {} ({})", config.getId(), analysis.getStatus(), analysis.getReason());

        boolean winner = analysis.getStatus() == AnalysisStatus.VARIANT_A_WINS
                || analysis.getStatus() == AnalysisStatus.VARIANT_B_WINS;
        if (config.isAutoStop() && experiment.getStatus() == ExperimentStatus.RUNNING && winner
                && analysis.getConfidence() >= config.getWinnerThreshold()) {
            experiment.finish(ExperimentStatus.COMPLETED, "Winner detected: " + analysis.getReason(), now);
            log.info("Experiment {} completed: {}", config.getId(), analysis.getReason());
        }
        return analysis;
    }

    private Experiment require(String experimentId) {
        Experiment experiment = experiments.get(experimentId);
        if (experiment == null) {
            throw new ResourceNotFoundException("No experiment " + experimentId);
        }
        return experiment;
    }
}
