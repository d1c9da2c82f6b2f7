package com.flightcover.claim;

import com.flightcover.policy.FlightStatus;

import java.math.BigDecimal;

/**
 * What evaluation does with an ACTIVE policy.
 */
public sealed interface ClaimDecision {

    /** Stay ACTIVE; only the evaluation timestamp moves. */
    record AwaitData() implements ClaimDecision {}

    /** Terminate with a denied claim, recording the given flight status. */
    record Deny(FlightStatus recordedFlightStatus) implements ClaimDecision {}

    /** Pay the amount to the holder, then mark the policy CLAIMED. */
    record Pay(BigDecimal amount) implements ClaimDecision {}
}
