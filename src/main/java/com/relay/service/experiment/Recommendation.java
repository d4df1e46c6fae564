package com.relay.service.experiment;

public enum Recommendation {
    CONTINUE_TEST,
    CHOOSE_VARIANT_A,
    CHOOSE_VARIANT_B
}
