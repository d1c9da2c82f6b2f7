package com.flightcover.claim;

import com.flightcover.policy.Policy;

import java.time.Instant;

public class AwaitingDataRule implements ClaimRule {

    @Override
    public String ruleId() {
        return "awaiting-data";
    }

    @Override
    public RuleResult evaluate(Policy policy, Instant now) {
        if (!policy.hasArrivalData()) {
            return new RuleResult.Decide("AWAITING_FLIGHT_DATA", new ClaimDecision.AwaitData());
        }
        return new RuleResult.Pass();
    }
}
