package com.flightcover.policy;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Flight status as last reported by the oracle. {@code OTHER} is also written
 * by the evaluator when a policy is denied for lack of data.
 */
public enum FlightStatus {
    NORMAL("normal"),
    CANCELED("canceled"),
    OTHER("other");

    private final String value;

    FlightStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static FlightStatus fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        return Arrays.stream(values())
            .filter(v -> v.value.equalsIgnoreCase(raw))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown flight status: " + raw));
    }
}
