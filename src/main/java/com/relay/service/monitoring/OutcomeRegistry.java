package com.relay.service.monitoring;

import com.github.benmanes.caffeine.cache.Cache;
import com.relay.exception.DuplicateOutcomeException;
import com.relay.model.routing.ExecutionOutcome;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Write-once store of outcomes by request id.
 */
@Component
public class OutcomeRegistry {

    private final Cache<String, ExecutionOutcome> outcomes;

    public OutcomeRegistry(Cache<String, ExecutionOutcome> outcomeCache) {
        this.outcomes = outcomeCache;
    }

    /**
     * @throws DuplicateOutcomeException if an outcome for this request id is already stored
     */
    public void register(ExecutionOutcome outcome) {
        ExecutionOutcome existing = outcomes.asMap().putIfAbsent(outcome.getRequestId(), outcome);
        if (existing != null) {
            throw new DuplicateOutcomeException(outcome.getRequestId());
        }
    }

    public Optional<ExecutionOutcome> find(String requestId) {
        return Optional.ofNullable(outcomes.getIfPresent(requestId));
    }

    public long size() {
        return outcomes.estimatedSize();
    }
}
