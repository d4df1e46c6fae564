package com.relay.controller;

import com.relay.model.ChatCompletionRequest;
import com.relay.model.dto.OutcomeSubmission;
import com.relay.model.dto.RoutingResponse;
import com.relay.model.routing.RoutingDecision;
import com.relay.model.routing.RoutingRequest;
import com.relay.service.RoutingHeaderParser;
import com.relay.service.RoutingRequestFactory;
import com.relay.service.RoutingService;
import com.relay.service.routing.DecisionReservation;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Routing API: route-and-execute, decide-only and outcome submission.
 */
@Slf4j
@RestController
@RequestMapping("/v1/routing")
public class RoutingController {

    private final RoutingService routingService;
    private final RoutingHeaderParser headerParser;
    private final RoutingRequestFactory requestFactory;
    private final Clock clock;

    public RoutingController(RoutingService routingService,
                             RoutingHeaderParser headerParser,
                             RoutingRequestFactory requestFactory,
                             Clock clock) {
        this.routingService = routingService;
        this.headerParser = headerParser;
        this.requestFactory = requestFactory;
        this.clock = clock;
    }

    /**
     * Route a request, execute it and explain the decision.
     */
    @PostMapping("/route")
    public Mono<RoutingResponse> route(@RequestBody ChatCompletionRequest request,
                                       @RequestHeader HttpHeaders headers) {
        RoutingRequest routingRequest = requestFactory.create(request.toBuilder().stream(null).build(),
                headerParser.parse(headers));
        log.info("Routing request {} for user {}", routingRequest.getRequestId(), routingRequest.getUserId());
        return routingService.complete(routingRequest).map(RoutingResponse::from);
    }

    /**
     * Decide and reserve capacity without executing.
     */
    @PostMapping("/decisions")
    public ResponseEntity<Map<String, Object>> decide(@RequestBody ChatCompletionRequest request,
                                                      @RequestHeader HttpHeaders headers) {
        RoutingRequest routingRequest = requestFactory.create(request, headerParser.parse(headers));
        DecisionReservation reservation = routingService.decide(routingRequest);
        RoutingDecision decision = reservation.getDecision();
        log.info("Decide-only {} -> {}/{}", decision.getRequestId(), decision.getProvider(), decision.getModel());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("requestId", decision.getRequestId());
        body.put("provider", decision.getProvider());
        body.put("model", decision.getModel());
        body.put("poolId", reservation.getPoolId());
        if (reservation.getQuotaRemaining() != null) {
            body.put("quotaRemaining", reservation.getQuotaRemaining());
        }
        body.put("routingDecision", RoutingResponse.summarize(decision));
        return ResponseEntity.ok(body);
    }

    @GetMapping("/decisions/{requestId}")
    public ResponseEntity<RoutingDecision> getDecision(@PathVariable String requestId) {
        return ResponseEntity.ok(routingService.getDecision(requestId));
    }

    /**
     * Give back the capacity reserved by a decide-only call that will not be executed.
     */
    @DeleteMapping("/decisions/{requestId}")
    public ResponseEntity<Void> releaseReservation(@PathVariable String requestId) {
        routingService.releaseReservation(requestId);
        log.info("Reservation for {} released by caller", requestId);
        return ResponseEntity.noContent().build();
    }

    /**
     * Submit what actually happened. A request id is accepted once.
     */
    @PostMapping("/outcomes")
    public ResponseEntity<Map<String, Object>> submitOutcome(@RequestBody OutcomeSubmission submission) {
        boolean queued = routingService.submitOutcome(submission.toOutcome(clock.instant()));
        log.debug("Outcome {} accepted, queued={}", submission.getRequestId(), queued);
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(Map.of("requestId", submission.getRequestId(), "sampled", queued));
    }
}
