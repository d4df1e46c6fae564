package com.relay.service;

import com.relay.model.RelayHeaders;
import com.relay.model.RoutingHints;
import com.relay.model.routing.OptimizationStrategy;
import com.relay.model.routing.ProviderType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;

/**
 * Parses routing hint headers from HTTP requests.
 *
 * Allows clients to steer routing per request with headers like:
 * - x-relay-user: quota identity
 * - x-relay-optimize-for: cost, speed, quality or balanced
 * - x-relay-max-cost / x-relay-min-quality / x-relay-max-response-time-ms: hard constraints
 * - x-relay-preferred-providers / x-relay-exclude-providers: comma-separated provider ids
 *
 * Malformed values are rejected with {@link IllegalArgumentException} rather than ignored, since a
 * silently dropped constraint could route a request somewhere the caller ruled out.
 */
@Slf4j
@Service
public class RoutingHeaderParser {

    /**
     * Parse routing hints from HTTP headers.
     *
     * @param headers HTTP request headers
     * @return parsed hints (never null)
     */
    public RoutingHints parse(HttpHeaders headers) {
        RoutingHints.RoutingHintsBuilder builder = RoutingHints.builder();

        String user = headers.getFirst(RelayHeaders.USER);
        if (user != null && !user.isBlank()) {
            builder.userId(user.trim());
        }

        String strategy = headers.getFirst(RelayHeaders.OPTIMIZE_FOR);
        if (strategy != null && !strategy.isBlank()) {
            builder.optimizeFor(OptimizationStrategy.fromString(strategy));
            log.debug("Optimization override via header: {}", strategy);
        }

        builder.maxCost(parseDouble(headers, RelayHeaders.MAX_COST));
        builder.minQuality(parseDouble(headers, RelayHeaders.MIN_QUALITY));
        builder.maxResponseTimeMs(parseLong(headers, RelayHeaders.MAX_RESPONSE_TIME_MS));
        builder.preferredProviders(parseProviders(headers.getFirst(RelayHeaders.PREFERRED_PROVIDERS)));
        builder.excludeProviders(parseProviders(headers.getFirst(RelayHeaders.EXCLUDE_PROVIDERS)));

        return builder.build();
    }

    /**
     * Parse a comma-separated provider list. Null or blank yields null.
     */
    Set<ProviderType> parseProviders(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        Set<ProviderType> providers = EnumSet.noneOf(ProviderType.class);
        Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(name -> !name.isEmpty())
                .map(ProviderType::fromString)
                .forEach(providers::add);
        return providers.isEmpty() ? null : providers;
    }

    private Double parseDouble(HttpHeaders headers, String name) {
        String value = headers.getFirst(name);
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + name + ": " + value, e);
        }
    }

    private Long parseLong(HttpHeaders headers, String name) {
        String value = headers.getFirst(name);
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + name + ": " + value, e);
        }
    }
}
