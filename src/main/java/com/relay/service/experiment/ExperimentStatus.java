package com.relay.service.experiment;

public enum ExperimentStatus {
    DRAFT,
    RUNNING,
    PAUSED,
    COMPLETED,
    STOPPED;

    public boolean isFinished() {
        return this == COMPLETED || this == STOPPED;
    }
}
