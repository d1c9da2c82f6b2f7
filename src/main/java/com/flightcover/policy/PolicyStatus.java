package com.flightcover.policy;

public enum PolicyStatus {
    ACTIVE,
    TERMINATED,
    CLAIMED
}
