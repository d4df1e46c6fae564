package com.relay.model.routing;

/**
 * How a provider frames incremental output on the wire.
 */
public enum FramingMode {
    /** Server-sent events: "data:" lines, events separated by a blank line. */
    SSE,
    /** One JSON document per line. */
    NDJSON
}
