package com.flightcover.settlement;

import java.math.BigDecimal;

public record PayoutInstruction(
    long policyId,
    String holder,
    BigDecimal amount,
    String reference
) {

    /** One claim per policy, so the reference is derived from the policy id alone. */
    public static PayoutInstruction forClaim(long policyId, String holder, BigDecimal amount) {
        return new PayoutInstruction(policyId, holder, amount, "claim-" + policyId);
    }
}
