package com.flightcover.claim;

import com.flightcover.policy.FlightStatus;
import com.flightcover.policy.Policy;

import java.time.Instant;

/**
 * A canceled flight never pays, whatever the timing.
 */
public class CancellationRule implements ClaimRule {

    @Override
    public String ruleId() {
        return "flight-canceled";
    }

    @Override
    public RuleResult evaluate(Policy policy, Instant now) {
        if (policy.observedFlightStatus() == FlightStatus.CANCELED) {
            return new RuleResult.Decide("FLIGHT_CANCELED",
                new ClaimDecision.Deny(FlightStatus.CANCELED));
        }
        return new RuleResult.Pass();
    }
}
