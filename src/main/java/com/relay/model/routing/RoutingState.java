package com.relay.model.routing;

/**
 * Per-request routing lifecycle.
 */
public enum RoutingState {
    INIT,
    CANDIDATES_GATHERED,
    QUOTA_FILTERED,
    SCORED,
    DECIDED,
    DISPATCHED,
    FALLBACK_DISPATCHED,
    FAILED;

    public boolean isTerminal() {
        return this == DISPATCHED || this == FALLBACK_DISPATCHED || this == FAILED;
    }
}
