package com.flightcover.claim;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.flightcover.policy.ClaimOutcome;
import com.flightcover.policy.FlightStatus;
import com.flightcover.policy.Policy;
import com.flightcover.policy.PolicyStatus;

import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record EvaluationResult(
    long policyId,
    PolicyStatus status,
    ClaimOutcome claimOutcome,
    FlightStatus observedFlightStatus,
    String ruleId,
    String reasonCode,
    String payoutReference,
    Instant evaluatedAt
) {

    static EvaluationResult of(Policy policy, String ruleId, String reasonCode, Instant evaluatedAt) {
        return new EvaluationResult(policy.id(), policy.status(), policy.claimOutcome(),
            policy.observedFlightStatus(), ruleId, reasonCode, policy.payoutReference(), evaluatedAt);
    }
}
