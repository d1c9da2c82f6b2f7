package com.flightcover.policy;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Policy defaults bound from {@code flightcover.policy.*}. Read once by
 * {@link PolicyService}; later changes do not reach existing policies.
 */
@Configuration
@ConfigurationProperties(prefix = "flightcover.policy")
public class PolicyDefaults {

    private Duration delayThreshold = Duration.ofHours(4);
    private BigDecimal premium = new BigDecimal("25.00");
    private BigDecimal claimAmount = new BigDecimal("250.00");

    public Duration getDelayThreshold() { return delayThreshold; }
    public void setDelayThreshold(Duration delayThreshold) { this.delayThreshold = delayThreshold; }

    public BigDecimal getPremium() { return premium; }
    public void setPremium(BigDecimal premium) { this.premium = premium; }

    public BigDecimal getClaimAmount() { return claimAmount; }
    public void setClaimAmount(BigDecimal claimAmount) { this.claimAmount = claimAmount; }

    public PolicyTerms toTerms() {
        return new PolicyTerms(delayThreshold, premium, claimAmount);
    }
}
