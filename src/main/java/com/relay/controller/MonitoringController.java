package com.relay.controller;

import com.relay.exception.ResourceNotFoundException;
import com.relay.model.routing.ModelKey;
import com.relay.model.routing.ProviderType;
import com.relay.service.monitoring.AccuracyMetrics;
import com.relay.service.monitoring.AccuracyMonitor;
import com.relay.service.monitoring.Alert;
import com.relay.service.monitoring.AlertManager;
import com.relay.service.monitoring.DriftDetectionResult;
import com.relay.service.monitoring.ModelComparison;
import com.relay.service.monitoring.MonitoringInsights;
import com.relay.service.prediction.UserPatternInsights;
import com.relay.service.prediction.UserPatternTracker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Accuracy, drift and alert feed of the prediction monitor.
 */
@Slf4j
@RestController
@RequestMapping("/v1/monitoring")
public class MonitoringController {

    private final AccuracyMonitor accuracyMonitor;
    private final AlertManager alertManager;
    private final UserPatternTracker userPatternTracker;

    public MonitoringController(AccuracyMonitor accuracyMonitor, AlertManager alertManager,
                                UserPatternTracker userPatternTracker) {
        this.accuracyMonitor = accuracyMonitor;
        this.alertManager = alertManager;
        this.userPatternTracker = userPatternTracker;
    }

    @GetMapping("/alerts")
    public ResponseEntity<List<Alert>> getAlerts(@RequestParam(defaultValue = "false") boolean unresolved) {
        return ResponseEntity.ok(alertManager.getAlerts(unresolved));
    }

    @PostMapping("/alerts/{id}/resolve")
    public ResponseEntity<Alert> resolveAlert(@PathVariable String id) {
        return ResponseEntity.ok(alertManager.resolve(id));
    }

    @GetMapping("/accuracy/{provider}/{model}")
    public ResponseEntity<AccuracyMetrics> getAccuracy(@PathVariable String provider, @PathVariable String model) {
        ModelKey key = key(provider, model);
        return ResponseEntity.ok(accuracyMonitor.getAccuracyMetrics(key)
                .orElseThrow(() -> new ResourceNotFoundException("No accuracy history for " + key)));
    }

    @GetMapping("/drift/{provider}/{model}")
    public ResponseEntity<DriftDetectionResult> getDrift(@PathVariable String provider, @PathVariable String model) {
        return ResponseEntity.ok(accuracyMonitor.detectDrift(key(provider, model)));
    }

    /**
     * Replace the drift baseline with the model's current history.
     */
    @PostMapping("/baselines/{provider}/{model}")
    public ResponseEntity<AccuracyMetrics> rebaseline(@PathVariable String provider, @PathVariable String model) {
        ModelKey key = key(provider, model);
        log.info("Admin: rebaselining {}", key);
        return ResponseEntity.ok(accuracyMonitor.rebaseline(key));
    }

    /**
     * Compare two models, e.g. {@code ?baseline=openai/gpt-4o&comparison=anthropic/claude-3-haiku-20240307}.
     */
    @GetMapping("/compare")
    public ResponseEntity<ModelComparison> compare(@RequestParam String baseline, @RequestParam String comparison) {
        return ResponseEntity.ok(accuracyMonitor.compareModelPerformance(parse(baseline), parse(comparison)));
    }

    /**
     * Pipeline-wide insights; with {@code userId}, that user's learned request pattern as well.
     */
    @GetMapping("/insights")
    public ResponseEntity<MonitoringInsights> getInsights(@RequestParam(required = false) String userId) {
        MonitoringInsights insights = accuracyMonitor.getMonitoringInsights();
        if (userId == null || userId.isBlank()) {
            return ResponseEntity.ok(insights);
        }
        return ResponseEntity.ok(insights.toBuilder()
                .userPatterns(userPatternTracker.analyze(userId).orElse(null))
                .build());
    }

    @GetMapping("/users/{userId}/patterns")
    public ResponseEntity<UserPatternInsights> getUserPatterns(@PathVariable String userId) {
        return ResponseEntity.ok(userPatternTracker.analyze(userId)
                .orElseThrow(() -> new ResourceNotFoundException("No request history for user " + userId)));
    }

    private static ModelKey key(String provider, String model) {
        return ModelKey.of(ProviderType.fromString(provider), model);
    }

    /**
     * Parse {@code provider/model}; the model part may itself contain slashes.
     */
    static ModelKey parse(String value) {
        int slash = value != null ? value.indexOf('/') : -1;
        if (slash <= 0 || slash == value.length() - 1) {
            throw new IllegalArgumentException("Expected provider/model, got: " + value);
        }
        return key(value.substring(0, slash), value.substring(slash + 1));
    }
}
