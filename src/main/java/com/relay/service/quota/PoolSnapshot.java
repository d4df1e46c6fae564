package com.relay.service.quota;

import com.relay.model.routing.ProviderType;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Point-in-time copy of one pool, safe to hand out.
 */
@Value
@Builder
public class PoolSnapshot {

    String poolId;
    ProviderType provider;
    long dailyLimit;
    long usedToday;
    PoolStatus status;
    int priority;
    double utilizationPercent;
    Instant lastReset;

    static PoolSnapshot of(PoolConfig pool) {
        return PoolSnapshot.builder()
                .poolId(pool.getPoolId())
                .provider(pool.getProvider())
                .dailyLimit(pool.getDailyLimit())
                .usedToday(pool.getUsedToday())
                .status(pool.getStatus())
                .priority(pool.getPriority())
                .utilizationPercent(pool.utilizationPercent())
                .lastReset(pool.getLastReset())
                .build();
    }

    /**
     * Aggregate report across all pools.
     */
    @Value
    public static class Report {
        List<PoolSnapshot> pools;
        int totalUsers;
        long totalRequestsToday;
    }
}
