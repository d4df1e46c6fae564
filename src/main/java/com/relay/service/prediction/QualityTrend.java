package com.relay.service.prediction;

public enum QualityTrend {
    IMPROVING,
    STABLE,
    DEGRADING
}
