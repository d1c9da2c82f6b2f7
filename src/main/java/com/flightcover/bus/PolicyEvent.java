package com.flightcover.bus;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;
import java.util.Map;

/**
 * Notification emitted by a policy operation. {@code sequenceNumber} is
 * assigned by the event log on append; {@code policyId} and {@code holder}
 * are null for events that concern no single policy (withdrawals).
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PolicyEvent(
    Long sequenceNumber,
    String eventId,
    PolicyEventType type,
    Long policyId,
    String holder,
    Instant occurredAt,
    Map<String, Object> details
) {

    public PolicyEvent withSequenceNumber(long assigned) {
        return new PolicyEvent(assigned, eventId, type, policyId, holder, occurredAt, details);
    }
}
