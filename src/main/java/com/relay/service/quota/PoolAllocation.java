package com.relay.service.quota;

import com.relay.model.routing.ProviderType;
import lombok.Getter;
import lombok.ToString;

import java.time.LocalDate;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A committed reservation against one pool, handed to the dispatcher.
 * Can be released at most once, and only on the UTC day it was taken.
 */
@Getter
@ToString
public class PoolAllocation {

    private final String userId;
    private final String poolId;
    private final ProviderType provider;
    @ToString.Exclude
    private final String apiKey;
    private final long units;
    private final LocalDate day;
    /** Remaining instant-tier requests today; null for uncapped tiers. */
    private final Long quotaRemaining;

    @ToString.Exclude
    private final AtomicBoolean released = new AtomicBoolean(false);

    PoolAllocation(String userId, String poolId, ProviderType provider, String apiKey,
                   long units, LocalDate day, Long quotaRemaining) {
        this.userId = userId;
        this.poolId = poolId;
        this.provider = provider;
        this.apiKey = apiKey;
        this.units = units;
        this.day = day;
        this.quotaRemaining = quotaRemaining;
    }

    boolean markReleased() {
        return released.compareAndSet(false, true);
    }

    public boolean isReleased() {
        return released.get();
    }
}
