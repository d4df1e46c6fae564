package com.relay.service.experiment;

public enum AnalysisStatus {
    INSUFFICIENT_DATA,
    NO_SIGNIFICANT_DIFFERENCE,
    VARIANT_A_WINS,
    VARIANT_B_WINS
}
