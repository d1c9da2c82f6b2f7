package com.flightcover.policy;

public enum ClaimOutcome {
    NONE,
    PAID,
    DENIED
}
