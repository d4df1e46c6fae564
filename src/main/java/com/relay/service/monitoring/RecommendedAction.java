package com.relay.service.monitoring;

/**
 * What to do about detected drift, in increasing severity.
 */
public enum RecommendedAction {
    MONITOR,
    INVESTIGATE,
    ALERT,
    /** Penalize the pair's confidence so routing prefers alternatives. */
    FALLBACK
}
