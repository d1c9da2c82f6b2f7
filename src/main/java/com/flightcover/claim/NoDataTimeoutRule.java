package com.flightcover.claim;

import com.flightcover.policy.FlightStatus;
import com.flightcover.policy.Policy;

import java.time.Duration;
import java.time.Instant;

/**
 * Denies a policy whose arrival was never reported within the grace period
 * after the scheduled arrival. The flight status is recorded as OTHER so the
 * denial is not mistaken for an on-time arrival.
 */
public class NoDataTimeoutRule implements ClaimRule {

    private final Duration gracePeriod;

    public NoDataTimeoutRule(Duration gracePeriod) {
        this.gracePeriod = gracePeriod;
    }

    @Override
    public String ruleId() {
        return "no-data-timeout";
    }

    @Override
    public RuleResult evaluate(Policy policy, Instant now) {
        if (policy.hasArrivalData()) {
            return new RuleResult.Pass();
        }
        Instant deadline = policy.scheduledArrival().plus(gracePeriod);
        if (!now.isBefore(deadline)) {
            return new RuleResult.Decide("NO_FLIGHT_DATA",
                new ClaimDecision.Deny(FlightStatus.OTHER));
        }
        return new RuleResult.Pass();
    }
}
