package com.flightcover.bus;

public enum PolicyEventType {
    POLICY_CREATED,
    FLIGHT_INFO_UPDATED,
    AWAITING_DATA,
    POLICY_DENIED,
    POLICY_CLAIMED,
    PAYOUT_FAILED,
    FUNDS_WITHDRAWN
}
