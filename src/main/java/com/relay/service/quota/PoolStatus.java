package com.relay.service.quota;

public enum PoolStatus {
    ACTIVE,
    EXHAUSTED,
    /** Credential rejected by the provider; out of rotation until the next reset. */
    ERROR
}
