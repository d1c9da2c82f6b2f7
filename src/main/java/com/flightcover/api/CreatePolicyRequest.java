package com.flightcover.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.time.Instant;

public record CreatePolicyRequest(
    @JsonProperty("holder") String holder,
    @JsonProperty("flight_code") String flightCode,
    @JsonProperty("scheduled_departure") Instant scheduledDeparture,
    @JsonProperty("scheduled_arrival") Instant scheduledArrival,
    @JsonProperty("paid_amount") BigDecimal paidAmount
) {}
