package com.flightcover.error;

public class PolicyNotFoundException extends PolicyException {

    public PolicyNotFoundException(long policyId) {
        super(ErrorKind.POLICY_NOT_FOUND, "policy not found: " + policyId);
    }
}
