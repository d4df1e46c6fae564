package com.relay.service.quota;

import com.relay.model.routing.ProviderType;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * One shared provider credential and its daily budget.
 * Mutable, and only ever touched by {@link QuotaPoolManager} while holding its lock.
 */
@Getter
@ToString
public class PoolConfig {

    private final String poolId;
    private final ProviderType provider;
    @ToString.Exclude
    private final String apiKey;
    private final long dailyLimit;
    private final int priority;

    private long usedToday;
    private PoolStatus status = PoolStatus.ACTIVE;
    private Instant lastReset;

    public PoolConfig(String poolId, ProviderType provider, String apiKey, long dailyLimit, int priority, Instant now) {
        if (dailyLimit <= 0) {
            throw new IllegalArgumentException("dailyLimit must be positive for pool " + poolId);
        }
        this.poolId = poolId;
        this.provider = provider;
        this.apiKey = apiKey;
        this.dailyLimit = dailyLimit;
        this.priority = priority;
        this.lastReset = now;
    }

    boolean canServe(long units) {
        return status == PoolStatus.ACTIVE && usedToday + units <= dailyLimit;
    }

    void consume(long units) {
        usedToday += units;
        if (usedToday >= dailyLimit) {
            status = PoolStatus.EXHAUSTED;
        }
    }

    void refund(long units) {
        usedToday = Math.max(0, usedToday - units);
        if (status == PoolStatus.EXHAUSTED && usedToday < dailyLimit) {
            status = PoolStatus.ACTIVE;
        }
    }

    void markError() {
        status = PoolStatus.ERROR;
    }

    void reset(Instant now) {
        usedToday = 0;
        status = PoolStatus.ACTIVE;
        lastReset = now;
    }

    double utilizationPercent() {
        return usedToday * 100.0 / dailyLimit;
    }
}
