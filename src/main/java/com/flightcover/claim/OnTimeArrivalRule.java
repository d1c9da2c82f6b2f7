package com.flightcover.claim;

import com.flightcover.policy.Policy;

import java.time.Instant;

/**
 * Arrival at or before scheduled arrival + delay threshold is on time.
 */
public class OnTimeArrivalRule implements ClaimRule {

    @Override
    public String ruleId() {
        return "arrived-on-time";
    }

    @Override
    public RuleResult evaluate(Policy policy, Instant now) {
        if (policy.hasArrivalData() && !policy.actualArrival().isAfter(policy.latestOnTimeArrival())) {
            return new RuleResult.Decide("ARRIVED_WITHIN_THRESHOLD",
                new ClaimDecision.Deny(policy.observedFlightStatus()));
        }
        return new RuleResult.Pass();
    }
}
