package com.flightcover.api;

import com.fasterxml.jackson.annotation.JsonProperty;

public record WithdrawalRequest(
    @JsonProperty("destination") String destination
) {}
