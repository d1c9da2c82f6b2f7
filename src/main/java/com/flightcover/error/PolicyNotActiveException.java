package com.flightcover.error;

/**
 * Thrown when ingest or evaluation targets a policy that already reached a
 * terminal status. Pollers are expected to stop on this error.
 */
public class PolicyNotActiveException extends PolicyException {

    private final long policyId;

    public PolicyNotActiveException(long policyId, Object status) {
        super(ErrorKind.POLICY_NOT_ACTIVE, "policy " + policyId + " is " + status + ", not ACTIVE");
        this.policyId = policyId;
    }

    public long getPolicyId() {
        return policyId;
    }
}
