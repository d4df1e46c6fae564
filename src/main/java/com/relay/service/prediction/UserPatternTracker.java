package com.relay.service.prediction;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.relay.config.RelayProperties;
import com.relay.model.routing.CapabilityClass;
import com.relay.model.routing.ProviderType;
import com.relay.model.routing.ScoredCandidate;
import com.relay.service.RoutingRequestFactory;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Per-user history of routed requests.
 *
 * Keeps the last few decisions for each identified user and derives a pattern id from the most
 * recent ones: the dominant request type plus whether the user's prompts tend to be complex.
 * Anonymous traffic is not tracked. Users idle past the retention window are forgotten.
 */
@Slf4j
@Component
public class UserPatternTracker {

    static final double COMPLEX_THRESHOLD = 0.5;

    private final RelayProperties.PredictionConfig config;
    private final Clock clock;
    private final Cache<String, UserHistory> users;

    public UserPatternTracker(RelayProperties properties, Clock clock) {
        this.config = properties.getPrediction();
        this.clock = clock;
        this.users = Caffeine.newBuilder()
                .maximumSize(config.getMaxTrackedUsers())
                .expireAfterAccess(config.getUserRetention())
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .executor(Runnable::run)
                .build();
    }

    /**
     * Remember a routed request.
     *
     * @param chosen the candidate the request was routed to
     * @param ranked every admissible candidate, used to measure what the choice saved
     */
    public void record(String userId, RequestFeatures features, ScoredCandidate chosen, List<ScoredCandidate> ranked) {
        if (isAnonymous(userId)) {
            return;
        }
        double dearest = ranked.stream()
                .mapToDouble(c -> c.getPrediction().getPredictedCost())
                .max()
                .orElse(chosen.getPrediction().getPredictedCost());
        Entry entry = new Entry(features.getCapability(), features.getComplexityScore(), chosen.getProvider(),
                chosen.getPrediction().getPredictedCost(), dearest, clock.instant());
        users.get(userId, id -> new UserHistory()).add(entry, config.getUserHistorySize());
    }

    /**
     * The user's current pattern, e.g. {@code code_complex}; empty below the minimum request count.
     */
    public Optional<String> patternId(String userId) {
        if (isAnonymous(userId)) {
            return Optional.empty();
        }
        UserHistory history = users.getIfPresent(userId);
        return history != null ? patternOf(history.snapshot()) : Optional.empty();
    }

    public Optional<UserPatternInsights> analyze(String userId) {
        if (isAnonymous(userId)) {
            return Optional.empty();
        }
        UserHistory history = users.getIfPresent(userId);
        if (history == null) {
            return Optional.empty();
        }
        List<Entry> entries = history.snapshot();
        if (entries.isEmpty()) {
            return Optional.empty();
        }
        int total = entries.size();

        Map<CapabilityClass, Integer> types = new EnumMap<>(CapabilityClass.class);
        Map<ProviderType, Integer> providers = new EnumMap<>(ProviderType.class);
        double complexity = 0;
        double spent = 0;
        double dearest = 0;
        for (Entry entry : entries) {
            if (entry.getCapability() != null) {
                types.merge(entry.getCapability(), 1, Integer::sum);
            }
            providers.merge(entry.getProvider(), 1, Integer::sum);
            complexity += entry.getComplexity();
            spent += entry.getCost();
            dearest += entry.getDearestCost();
        }

        List<UserPatternInsights.TypeShare> typeShares = types.entrySet().stream()
                .sorted(Map.Entry.<CapabilityClass, Integer>comparingByValue().reversed()
                        .thenComparing(Map.Entry.<CapabilityClass, Integer>comparingByKey()))
                .map(e -> new UserPatternInsights.TypeShare(e.getKey(), e.getValue(), (double) e.getValue() / total))
                .toList();
        List<UserPatternInsights.ProviderShare> providerShares = providers.entrySet().stream()
                .sorted(Map.Entry.<ProviderType, Integer>comparingByValue().reversed()
                        .thenComparing(Map.Entry.<ProviderType, Integer>comparingByKey()))
                .map(e -> new UserPatternInsights.ProviderShare(e.getKey(), e.getValue(),
                        (double) e.getValue() / total))
                .toList();

        return Optional.of(UserPatternInsights.builder()
                .userId(userId)
                .requestsTracked(total)
                .commonRequestTypes(typeShares)
                .preferredProviders(providerShares)
                .averageComplexity(complexity / total)
                .costSavingsPercent(dearest > 0 ? (dearest - spent) / dearest * 100 : 0)
                .patternId(patternOf(entries).orElse(null))
                .lastSeen(entries.get(total - 1).getAt())
                .build());
    }

    public long trackedUsers() {
        users.cleanUp();
        return users.estimatedSize();
    }

    private Optional<String> patternOf(List<Entry> entries) {
        if (entries.size() < config.getMinPatternRequests()) {
            return Optional.empty();
        }
        List<Entry> recent = entries.subList(Math.max(0, entries.size() - config.getUserPatternWindow()),
                entries.size());
        Map<CapabilityClass, Integer> counts = new EnumMap<>(CapabilityClass.class);
        recent.forEach(e -> counts.merge(e.getCapability() != null ? e.getCapability() : CapabilityClass.CHAT,
                1, Integer::sum));
        // Ties go to the type declared first
        CapabilityClass dominant = counts.entrySet().stream()
                .max(Map.Entry.<CapabilityClass, Integer>comparingByValue().thenComparing(
                        Map.Entry.<CapabilityClass, Integer>comparingByKey(Comparator.reverseOrder())))
                .map(Map.Entry::getKey)
                .orElse(CapabilityClass.CHAT);
        double complexity = recent.stream().mapToDouble(Entry::getComplexity).average().orElse(0);
        return Optional.of(dominant.name().toLowerCase() + (complexity > COMPLEX_THRESHOLD ? "_complex" : "_simple"));
    }

    private static boolean isAnonymous(String userId) {
        return userId == null || userId.isBlank() || RoutingRequestFactory.ANONYMOUS_USER.equals(userId);
    }

    @Value
    static class Entry {
        CapabilityClass capability;
        double complexity;
        ProviderType provider;
        double cost;
        double dearestCost;
        Instant at;
    }

    private static final class UserHistory {

        private final Deque<Entry> entries = new ArrayDeque<>();

        synchronized void add(Entry entry, int capacity) {
            entries.addLast(entry);
            while (entries.size() > capacity) {
                entries.removeFirst();
            }
        }

        synchronized List<Entry> snapshot() {
            return new ArrayList<>(entries);
        }
    }
}
