package com.flightcover.claim;

import com.flightcover.policy.Policy;

import java.time.Instant;

public class LateArrivalRule implements ClaimRule {

    @Override
    public String ruleId() {
        return "arrived-late";
    }

    @Override
    public RuleResult evaluate(Policy policy, Instant now) {
        if (policy.hasArrivalData() && policy.actualArrival().isAfter(policy.latestOnTimeArrival())) {
            return new RuleResult.Decide("DELAY_THRESHOLD_EXCEEDED",
                new ClaimDecision.Pay(policy.claimAmount()));
        }
        return new RuleResult.Pass();
    }
}
