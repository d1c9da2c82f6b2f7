package com.flightcover.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flightcover.policy.FlightStatus;

import java.time.Instant;

/**
 * Observed flight data. {@code actual_arrival} may be omitted while the
 * arrival is unknown, e.g. for a cancellation.
 */
public record FlightInfoRequest(
    @JsonProperty("actual_arrival") Instant actualArrival,
    @JsonProperty("flight_status") FlightStatus flightStatus
) {}
