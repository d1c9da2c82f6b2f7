package com.flightcover.claim;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SweepSummary(
    Instant evaluatedAt,
    int evaluated,
    int awaiting,
    int denied,
    int claimed,
    int failed
) {}
