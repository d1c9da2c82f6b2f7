package com.flightcover.policy;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Objects;

/**
 * Immutable snapshot of the configured policy defaults, copied into every
 * policy at creation.
 */
public record PolicyTerms(
    Duration delayThreshold,
    BigDecimal premium,
    BigDecimal claimAmount
) {

    public PolicyTerms {
        Objects.requireNonNull(delayThreshold, "delayThreshold");
        Objects.requireNonNull(premium, "premium");
        Objects.requireNonNull(claimAmount, "claimAmount");
        if (delayThreshold.isNegative() || delayThreshold.isZero()) {
            throw new IllegalStateException("delay threshold must be positive, got " + delayThreshold);
        }
        if (premium.signum() <= 0) {
            throw new IllegalStateException("premium must be positive, got " + premium);
        }
        if (claimAmount.signum() <= 0) {
            throw new IllegalStateException("claim amount must be positive, got " + claimAmount);
        }
    }
}
