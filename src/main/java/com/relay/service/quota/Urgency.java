package com.relay.service.quota;

public enum Urgency {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL
}
