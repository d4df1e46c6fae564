package com.relay.service.quota;

import com.relay.config.RelayProperties;
import com.relay.exception.QuotaExhaustedException;
import com.relay.model.routing.ProviderType;
import com.relay.service.monitoring.RelayMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the shared credential pools and per-user daily quotas.
 *
 * Every read-modify-write happens under one exclusive lock, so allocation is check-then-increment
 * atomically and a daily reset can never interleave with an allocation. Day rollover is detected
 * against the injected clock, both lazily on every call and by {@link DailyResetScheduler}; rolling
 * over is idempotent per UTC day.
 */
@Slf4j
@Service
public class QuotaPoolManager {

    private static final Comparator<PoolConfig> POOL_ORDER = Comparator
            .comparingInt(PoolConfig::getPriority)
            .thenComparingLong(PoolConfig::getUsedToday)
            .thenComparing(PoolConfig::getPoolId);

    private final ReentrantLock lock = new ReentrantLock();
    private final List<PoolConfig> pools = new ArrayList<>();
    private final Map<String, UserQuota> users = new HashMap<>();
    private final Clock clock;
    private final RelayMetrics metrics;
    private final int instantDailyLimit;
    private final double upgradePromptRatio;

    private LocalDate currentDay;

    public QuotaPoolManager(RelayProperties properties, Clock clock, RelayMetrics metrics) {
        this.clock = clock;
        this.metrics = metrics;
        this.instantDailyLimit = properties.getQuota().getInstantDailyLimit();
        this.upgradePromptRatio = properties.getQuota().getUpgradePromptRatio();
        this.currentDay = LocalDate.now(clock);

        Instant now = clock.instant();
        for (RelayProperties.PoolDefinition definition : properties.getPools()) {
            pools.add(new PoolConfig(
                    definition.getPoolId(),
                    ProviderType.fromString(definition.getProvider()),
                    definition.getApiKey(),
                    definition.getDailyLimit(),
                    definition.getPriority(),
                    now));
        }
        log.info("Initialized QuotaPoolManager with {} pools, instant tier cap {}", pools.size(), instantDailyLimit);
    }

    /**
     * Allocate capacity for a user, preferring a provider but falling back to any pool.
     *
     * @throws QuotaExhaustedException when the user's tier cap is reached or no pool can serve the units
     */
    public PoolAllocation getAvailableKey(String userId, ProviderType preferredProvider, long unitsNeeded) {
        validate(userId, unitsNeeded);
        lock.lock();
        try {
            rollOverIfNeeded();
            UserQuota user = resolveUser(userId);
            checkTierCap(user, unitsNeeded);

            Optional<PoolConfig> pool = selectPool(preferredProvider, unitsNeeded);
            if (pool.isEmpty() && preferredProvider != null) {
                log.debug("No {} pool can serve {} units, trying any provider", preferredProvider, unitsNeeded);
                pool = selectPool(null, unitsNeeded);
            }
            if (pool.isEmpty()) {
                metrics.recordQuotaDenial("pools_exhausted");
                throw new QuotaExhaustedException("All pools exhausted for today", UpgradePrompt.poolsExhausted());
            }
            return commit(user, pool.get(), unitsNeeded);
        } finally {
            lock.unlock();
        }
    }

    public PoolAllocation getAvailableKey(String userId) {
        return getAvailableKey(userId, null, 1);
    }

    /**
     * Allocate capacity on one provider only. Used by the router, which handles fallback itself.
     *
     * @throws QuotaExhaustedException when the user's tier cap is reached or that provider has no capacity
     */
    public PoolAllocation reserve(String userId, ProviderType provider, long unitsNeeded) {
        validate(userId, unitsNeeded);
        if (provider == null) {
            throw new IllegalArgumentException("provider is required");
        }
        lock.lock();
        try {
            rollOverIfNeeded();
            UserQuota user = resolveUser(userId);
            checkTierCap(user, unitsNeeded);

            PoolConfig pool = selectPool(provider, unitsNeeded).orElseThrow(() -> {
                metrics.recordQuotaDenial("provider_exhausted");
                return new QuotaExhaustedException("All " + provider.id() + " pools exhausted for today",
                        UpgradePrompt.poolsExhausted());
            });
            return commit(user, pool, unitsNeeded);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Return a reservation that never reached a provider. A second release of the same allocation, or a
     * release after the UTC day rolled over, changes nothing.
     */
    public void release(PoolAllocation allocation) {
        if (allocation == null || !allocation.markReleased()) {
            return;
        }
        lock.lock();
        try {
            rollOverIfNeeded();
            if (!allocation.getDay().equals(currentDay)) {
                log.debug("Ignoring release of {} from {}: counters were reset since", allocation.getPoolId(),
                        allocation.getDay());
                return;
            }
            findPool(allocation.getPoolId()).ifPresent(pool -> pool.refund(allocation.getUnits()));
            UserQuota user = users.get(allocation.getUserId());
            if (user != null) {
                user.refund(allocation.getUnits());
            }
            log.debug("Released {} units on pool {} for user {}", allocation.getUnits(), allocation.getPoolId(),
                    allocation.getUserId());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Read-only check that at least one active pool of this provider can serve the units.
     */
    public boolean hasCapacity(ProviderType provider, long units) {
        lock.lock();
        try {
            rollOverIfNeeded();
            return selectPool(provider, units).isPresent();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Fail fast when the user's tier cap would be exceeded, without allocating anything.
     *
     * @throws QuotaExhaustedException with an upgrade prompt sized by urgency
     */
    public void checkUserQuota(String userId, long units) {
        validate(userId, units);
        lock.lock();
        try {
            rollOverIfNeeded();
            UserQuota user = users.get(userId);
            if (user != null) {
                checkTierCap(user, units);
            } else if (units > instantDailyLimit) {
                checkTierCap(new UserQuota(userId, currentDay), units);
            }
        } finally {
            lock.unlock();
        }
    }

    public void updateUserTier(String userId, UserTier tier) {
        if (userId == null || userId.isBlank() || tier == null) {
            throw new IllegalArgumentException("userId and tier are required");
        }
        lock.lock();
        try {
            rollOverIfNeeded();
            UserQuota user = resolveUser(userId);
            UserTier previous = user.getTier();
            user.setTier(tier);
            log.info("User {} tier changed {} -> {}", userId, previous, tier);
        } finally {
            lock.unlock();
        }
    }

    /**
     * True when an instant-tier user has used at least the configured share (80 %) of the daily cap.
     */
    public boolean shouldShowUpgradePrompt(String userId) {
        lock.lock();
        try {
            rollOverIfNeeded();
            UserQuota user = users.get(userId);
            if (user == null || !user.getTier().isCapped()) {
                return false;
            }
            return user.getRequestsToday() >= instantDailyLimit * upgradePromptRatio;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Prompt to show this user right now, if any.
     */
    public Optional<UpgradePrompt> getUpgradePrompt(String userId) {
        if (!shouldShowUpgradePrompt(userId)) {
            return Optional.empty();
        }
        QuotaStatus status = getQuotaStatus(userId);
        return Optional.of(UpgradePrompt.forRemaining(status.getRemaining().intValue()));
    }

    public QuotaStatus getQuotaStatus(String userId) {
        lock.lock();
        try {
            rollOverIfNeeded();
            UserQuota user = users.get(userId);
            UserTier tier = user != null ? user.getTier() : UserTier.INSTANT;
            long used = user != null ? user.getRequestsToday() : 0;
            int available = (int) pools.stream().filter(p -> p.canServe(1)).count();
            return QuotaStatus.builder()
                    .userId(userId)
                    .tier(tier)
                    .requestsToday(used)
                    .remaining(tier.isCapped() ? Math.max(0, instantDailyLimit - used) : null)
                    .poolStatus(new QuotaStatus.PoolSummary(pools.size(), available))
                    .build();
        } finally {
            lock.unlock();
        }
    }

    public PoolSnapshot.Report getPoolStatus() {
        lock.lock();
        try {
            rollOverIfNeeded();
            List<PoolSnapshot> snapshots = pools.stream().map(PoolSnapshot::of).toList();
            long totalRequests = users.values().stream().mapToLong(UserQuota::getRequestsToday).sum();
            return new PoolSnapshot.Report(snapshots, users.size(), totalRequests);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Take a pool out of rotation until the next reset, typically after the provider rejected its credential.
     */
    public void markPoolError(String poolId) {
        lock.lock();
        try {
            findPool(poolId).ifPresent(pool -> {
                pool.markError();
                log.warn("Pool {} ({}) marked as ERROR until next reset", poolId, pool.getProvider());
            });
        } finally {
            lock.unlock();
        }
    }

    /**
     * Scheduled daily reset. Safe to call at any time: only resets when the UTC day has changed.
     *
     * @return true if counters were reset by this call
     */
    public boolean resetIfNewDay() {
        lock.lock();
        try {
            return rollOverIfNeeded();
        } finally {
            lock.unlock();
        }
    }

    LocalDate getCurrentDay() {
        return currentDay;
    }

    // Callers hold the lock from here on

    private boolean rollOverIfNeeded() {
        LocalDate today = LocalDate.now(clock);
        if (!currentDay.isBefore(today)) {
            return false;
        }
        Instant now = clock.instant();
        pools.forEach(pool -> pool.reset(now));
        users.values().forEach(user -> user.rollOver(today));
        log.info("Daily quota reset: {} -> {}, {} pools and {} users reset", currentDay, today, pools.size(),
                users.size());
        currentDay = today;
        return true;
    }

    private UserQuota resolveUser(String userId) {
        UserQuota user = users.computeIfAbsent(userId, id -> new UserQuota(id, currentDay));
        user.rollOver(currentDay);
        return user;
    }

    private void checkTierCap(UserQuota user, long units) {
        if (!user.getTier().isCapped() || user.getRequestsToday() + units <= instantDailyLimit) {
            return;
        }
        int remaining = (int) (instantDailyLimit - user.getRequestsToday());
        metrics.recordQuotaDenial("instant_cap");
        log.debug("User {} over instant cap: used={}, requested={}", user.getUserId(), user.getRequestsToday(), units);
        String message = remaining <= 0 ? "Daily limit reached" : "Approaching daily limit";
        throw new QuotaExhaustedException(message, UpgradePrompt.forRemaining(remaining));
    }

    private Optional<PoolConfig> selectPool(ProviderType provider, long units) {
        return pools.stream()
                .filter(pool -> provider == null || pool.getProvider() == provider)
                .filter(pool -> pool.canServe(units))
                .min(POOL_ORDER);
    }

    private PoolAllocation commit(UserQuota user, PoolConfig pool, long units) {
        pool.consume(units);
        user.consume(units, clock.instant());
        if (pool.getStatus() == PoolStatus.EXHAUSTED) {
            log.info("Pool {} exhausted for today ({} / {})", pool.getPoolId(), pool.getUsedToday(),
                    pool.getDailyLimit());
        }
        Long remaining = user.getTier().isCapped() ? instantDailyLimit - user.getRequestsToday() : null;
        return new PoolAllocation(user.getUserId(), pool.getPoolId(), pool.getProvider(), pool.getApiKey(),
                units, currentDay, remaining);
    }

    private Optional<PoolConfig> findPool(String poolId) {
        return pools.stream().filter(p -> p.getPoolId().equals(poolId)).findFirst();
    }

    private static void validate(String userId, long units) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId is required");
        }
        if (units < 1) {
            throw new IllegalArgumentException("unitsNeeded must be >= 1");
        }
    }
}
