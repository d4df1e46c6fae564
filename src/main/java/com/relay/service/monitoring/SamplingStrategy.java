package com.relay.service.monitoring;

/**
 * How outcomes are thinned before accuracy processing under load.
 */
public enum SamplingStrategy {
    /** Fixed base rate. */
    UNIFORM,
    /** Base rate scaled down in proportion to request volume above the threshold. */
    ADAPTIVE,
    /** Stepped rates by request volume. */
    TIERED
}
