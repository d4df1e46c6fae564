package com.relay.controller;

import com.relay.model.dto.ExperimentRequest;
import com.relay.service.experiment.ExperimentAnalysis;
import com.relay.service.experiment.ExperimentManager;
import com.relay.service.experiment.ExperimentSnapshot;
import com.relay.service.experiment.ExperimentStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Locale;

/**
 * Administration of routing experiments.
 */
@Slf4j
@RestController
@RequestMapping("/v1/experiments")
public class ExperimentController {

    private final ExperimentManager experimentManager;

    public ExperimentController(ExperimentManager experimentManager) {
        this.experimentManager = experimentManager;
    }

    @PostMapping
    public ResponseEntity<ExperimentSnapshot> create(@RequestBody ExperimentRequest request) {
        log.info("Admin: creating experiment {}", request.getId());
        return ResponseEntity.status(HttpStatus.CREATED).body(experimentManager.create(request.toConfig()));
    }

    @GetMapping
    public ResponseEntity<List<ExperimentSnapshot>> list(@RequestParam(required = false) String status) {
        return ResponseEntity.ok(experimentManager.list(parseStatus(status)));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ExperimentSnapshot> get(@PathVariable String id) {
        return ResponseEntity.ok(experimentManager.get(id));
    }

    @PostMapping("/{id}/start")
    public ResponseEntity<ExperimentSnapshot> start(@PathVariable String id) {
        log.info("Admin: starting experiment {}", id);
        return ResponseEntity.ok(experimentManager.start(id));
    }

    @PostMapping("/{id}/pause")
    public ResponseEntity<ExperimentSnapshot> pause(@PathVariable String id) {
        log.info("Admin: pausing experiment {}", id);
        return ResponseEntity.ok(experimentManager.pause(id));
    }

    @PostMapping("/{id}/stop")
    public ResponseEntity<ExperimentSnapshot> stop(@PathVariable String id,
                                                   @RequestParam(required = false) String reason) {
        log.info("Admin: stopping experiment {}", id);
        return ResponseEntity.ok(experimentManager.stop(id, reason));
    }

    /**
     * Run the analysis now. May complete the experiment when auto-stop is on.
     */
    @GetMapping("/{id}/analysis")
    public ResponseEntity<ExperimentAnalysis> analyze(@PathVariable String id) {
        return ResponseEntity.ok(experimentManager.analyze(id));
    }

    private static ExperimentStatus parseStatus(String status) {
        if (status == null || status.isBlank()) {
            return null;
        }
        try {
            return ExperimentStatus.valueOf(status.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown experiment status: " + status, e);
        }
    }
}
