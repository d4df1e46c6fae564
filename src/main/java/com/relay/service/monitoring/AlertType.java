package com.relay.service.monitoring;

public enum AlertType {
    ACCURACY_DEGRADATION,
    DRIFT_DETECTED,
    PERFORMANCE_ANOMALY
}
