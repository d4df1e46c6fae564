package com.relay.service.routing;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.github.benmanes.caffeine.cache.Scheduler;
import com.relay.config.RelayProperties;
import com.relay.service.quota.PoolAllocation;
import com.relay.service.quota.QuotaPoolManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.concurrent.TimeUnit;

/**
 * Pool allocations handed out by decide-only routing, held until the caller reports what happened.
 *
 * A held unit goes back to its pool when the caller releases it, when the outcome says no attempt was
 * made, or when no outcome arrives within the reservation timeout. A settled unit stays spent.
 */
@Slf4j
@Component
public class ReservationLedger {

    private final QuotaPoolManager quotaPoolManager;
    private final Cache<String, PoolAllocation> held;

    public ReservationLedger(QuotaPoolManager quotaPoolManager, RelayProperties properties, Clock clock) {
        this.quotaPoolManager = quotaPoolManager;
        this.held = Caffeine.newBuilder()
                .expireAfterWrite(properties.getRouting().getReservationTimeout())
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .executor(Runnable::run)
                .scheduler(Scheduler.systemScheduler())
                .removalListener((String requestId, PoolAllocation allocation, RemovalCause cause) -> {
                    if (cause == RemovalCause.EXPIRED && allocation != null) {
                        log.info("[{}] No outcome reported for reservation on {}, releasing", requestId,
                                allocation.getPoolId());
                        quotaPoolManager.release(allocation);
                    }
                })
                .build();
    }

    public void hold(String requestId, PoolAllocation allocation) {
        held.put(requestId, allocation);
    }

    /**
     * Give the held unit back to its pool.
     *
     * @return false when nothing is held for the request
     */
    public boolean release(String requestId) {
        PoolAllocation allocation = held.asMap().remove(requestId);
        if (allocation == null) {
            return false;
        }
        quotaPoolManager.release(allocation);
        log.debug("[{}] Released reservation on {}", requestId, allocation.getPoolId());
        return true;
    }

    /**
     * The caller attempted the request; the unit stays spent.
     */
    public void settle(String requestId) {
        held.invalidate(requestId);
    }

    public boolean isHeld(String requestId) {
        return held.getIfPresent(requestId) != null;
    }

    /**
     * Release reservations whose timeout has passed now rather than on Caffeine's next sweep.
     */
    public void expireOverdue() {
        held.cleanUp();
    }

    public long size() {
        return held.estimatedSize();
    }
}
