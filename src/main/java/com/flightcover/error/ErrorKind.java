package com.flightcover.error;

/**
 * Error kinds surfaced to callers. The name is the machine-readable code
 * returned by the REST layer.
 */
public enum ErrorKind {

    INVALID_SCHEDULE(true),
    INCORRECT_PREMIUM(true),
    POLICY_NOT_FOUND(true),
    POLICY_NOT_ACTIVE(true),
    UNAUTHORIZED(true),
    SETTLEMENT_FAILURE(false);

    private final boolean recoverable;

    ErrorKind(boolean recoverable) {
        this.recoverable = recoverable;
    }

    /** Recoverable kinds are expected outcomes of a well-behaved caller, not system faults. */
    public boolean isRecoverable() {
        return recoverable;
    }
}
