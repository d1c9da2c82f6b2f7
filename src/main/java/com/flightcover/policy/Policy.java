package com.flightcover.policy;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;

/**
 * One flight-delay insurance policy.
 *
 * Instances are immutable snapshots; every mutation produces a new snapshot
 * that the store swaps in under the policy's lock. {@code actualArrival} is
 * null while the arrival is unknown.
 *
 * Invariants:
 * - claimOutcome == NONE iff status == ACTIVE
 * - a policy that left ACTIVE is never written again
 * - premium, claimAmount and delayThreshold are fixed at creation
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record Policy(
    long id,
    String holder,
    String flightCode,
    Instant scheduledDeparture,
    Instant scheduledArrival,
    Instant actualArrival,
    Instant createdAt,
    Instant lastEvaluatedAt,
    Duration delayThreshold,
    BigDecimal premium,
    BigDecimal claimAmount,
    PolicyStatus status,
    ClaimOutcome claimOutcome,
    FlightStatus observedFlightStatus,
    String payoutReference
) {

    /** How long after scheduled arrival an unreported flight stays open. */
    public static final Duration NO_DATA_TIMEOUT = Duration.ofHours(72);

    /**
     * A freshly purchased policy: ACTIVE, no outcome, NORMAL status, unknown arrival.
     */
    public static Policy open(long id, String holder, String flightCode,
                              Instant scheduledDeparture, Instant scheduledArrival,
                              PolicyTerms terms, Instant createdAt) {
        return new Policy(id, holder, flightCode, scheduledDeparture, scheduledArrival,
            null, createdAt, createdAt,
            terms.delayThreshold(), terms.premium(), terms.claimAmount(),
            PolicyStatus.ACTIVE, ClaimOutcome.NONE, FlightStatus.NORMAL, null);
    }

    @JsonIgnore
    public boolean isActive() {
        return status == PolicyStatus.ACTIVE;
    }

    @JsonIgnore
    public boolean hasArrivalData() {
        return actualArrival != null;
    }

    /** Latest arrival that still counts as on time. */
    @JsonIgnore
    public Instant latestOnTimeArrival() {
        return scheduledArrival.plus(delayThreshold);
    }

    public Policy withFlightInfo(Instant arrival, FlightStatus flightStatus, Instant touchedAt) {
        return new Policy(id, holder, flightCode, scheduledDeparture, scheduledArrival,
            arrival, createdAt, touchedAt, delayThreshold, premium, claimAmount,
            status, claimOutcome, flightStatus, payoutReference);
    }

    public Policy touched(Instant at) {
        return new Policy(id, holder, flightCode, scheduledDeparture, scheduledArrival,
            actualArrival, createdAt, at, delayThreshold, premium, claimAmount,
            status, claimOutcome, observedFlightStatus, payoutReference);
    }

    public Policy denied(FlightStatus recordedFlightStatus, Instant at) {
        return new Policy(id, holder, flightCode, scheduledDeparture, scheduledArrival,
            actualArrival, createdAt, at, delayThreshold, premium, claimAmount,
            PolicyStatus.TERMINATED, ClaimOutcome.DENIED, recordedFlightStatus, null);
    }

    public Policy claimed(String settledReference, Instant at) {
        return new Policy(id, holder, flightCode, scheduledDeparture, scheduledArrival,
            actualArrival, createdAt, at, delayThreshold, premium, claimAmount,
            PolicyStatus.CLAIMED, ClaimOutcome.PAID, observedFlightStatus, settledReference);
    }
}
