package com.relay.service.routing;

import com.github.benmanes.caffeine.cache.Cache;
import com.relay.model.routing.RoutingDecision;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Recent routing decisions by request id, so outcomes can be paired with their predictions.
 */
@Slf4j
@Component
public class DecisionLedger {

    private final Cache<String, RoutingDecision> decisions;

    public DecisionLedger(Cache<String, RoutingDecision> decisionCache) {
        this.decisions = decisionCache;
    }

    public void record(RoutingDecision decision) {
        decisions.put(decision.getRequestId(), decision);
        log.debug("Recorded decision {} -> {}/{} [{}]", decision.getRequestId(), decision.getProvider(),
                decision.getModel(), decision.getState());
    }

    public Optional<RoutingDecision> find(String requestId) {
        return Optional.ofNullable(decisions.getIfPresent(requestId));
    }

    public long size() {
        return decisions.estimatedSize();
    }
}
