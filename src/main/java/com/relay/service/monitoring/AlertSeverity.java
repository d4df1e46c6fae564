package com.relay.service.monitoring;

public enum AlertSeverity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL
}
