package com.relay.model;

/**
 * HTTP headers for routing hints and provenance.
 *
 * Request headers override the matching body fields. Response headers tell the client where
 * the request actually went.
 */
public class RelayHeaders {

    // ========== Request Routing Headers ==========

    /**
     * Caller identity for quota accounting. Falls back to the body's {@code user} field.
     *
     * Example: x-relay-user: user-42
     */
    public static final String USER = "x-relay-user";

    /**
     * Optimization strategy.
     * Values: "cost", "speed", "quality", "balanced"
     */
    public static final String OPTIMIZE_FOR = "x-relay-optimize-for";

    /**
     * Hard cap on predicted cost in USD.
     *
     * Example: x-relay-max-cost: 0.001
     */
    public static final String MAX_COST = "x-relay-max-cost";

    /**
     * Minimum predicted quality in [0, 1].
     */
    public static final String MIN_QUALITY = "x-relay-min-quality";

    /**
     * Hard cap on predicted latency; also the dispatch timeout.
     */
    public static final String MAX_RESPONSE_TIME_MS = "x-relay-max-response-time-ms";

    /**
     * Comma-separated provider ids to restrict routing to.
     *
     * Example: x-relay-preferred-providers: anthropic,openai
     */
    public static final String PREFERRED_PROVIDERS = "x-relay-preferred-providers";

    /**
     * Comma-separated provider ids never to route to.
     */
    public static final String EXCLUDE_PROVIDERS = "x-relay-exclude-providers";

    // ========== Response Provenance Headers ==========

    /** Provider that served the response. */
    public static final String PROVIDER = "x-relay-provider";

    /** Model that served the response. */
    public static final String MODEL = "x-relay-model";

    /** Request id, for submitting the outcome later. */
    public static final String REQUEST_ID = "x-relay-request-id";

    /**
     * Whether the response came from the fallback candidate.
     * Value: "true" or "false"
     */
    public static final String FALLBACK = "x-relay-fallback";

    /** Remaining instant-tier requests today. Absent for uncapped tiers. */
    public static final String QUOTA_REMAINING = "x-relay-quota-remaining";

    private RelayHeaders() {
        // Utility class, no instantiation
    }
}
