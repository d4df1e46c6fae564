package com.relay.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.relay.model.routing.ExecutionOutcome;
import com.relay.model.routing.RoutingDecision;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Clock and in-memory stores shared by the routing engine and the accuracy monitor.
 */
@Configuration
public class EngineConfiguration {

    private final RelayProperties properties;

    public EngineConfiguration(RelayProperties properties) {
        this.properties = properties;
    }

    /**
     * Quota days roll over at UTC midnight.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Cache<String, RoutingDecision> decisionCache() {
        return Caffeine.newBuilder()
                .maximumSize(properties.getRouting().getDecisionCacheSize())
                .expireAfterWrite(properties.getRouting().getDecisionRetention())
                .recordStats()
                .build();
    }

    @Bean
    public Cache<String, ExecutionOutcome> outcomeCache() {
        return Caffeine.newBuilder()
                .maximumSize(properties.getMonitoring().getOutcomeCacheSize())
                .expireAfterWrite(properties.getMonitoring().getOutcomeRetention())
                .recordStats()
                .build();
    }
}
