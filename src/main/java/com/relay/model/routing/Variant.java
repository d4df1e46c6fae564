package com.relay.model.routing;

/**
 * Arm of a two-variant routing experiment.
 */
public enum Variant {
    A,
    B
}
