package com.flightcover.access;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum Role {
    /** Supplies observed flight data. */
    ORACLE("oracle"),
    /** Operates the book: evaluation, sweeps, withdrawals; may also act as oracle. */
    ADMIN("admin");

    private final String value;

    Role(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static Role fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        return Arrays.stream(values())
            .filter(v -> v.value.equalsIgnoreCase(raw.trim()))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown role: " + raw));
    }
}
