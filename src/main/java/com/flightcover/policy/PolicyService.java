package com.flightcover.policy;

import com.flightcover.bus.PolicyEventPublisher;
import com.flightcover.bus.PolicyEventType;
import com.flightcover.error.IncorrectPremiumException;
import com.flightcover.error.InvalidScheduleException;
import com.flightcover.error.PolicyNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Policy purchase and read-only queries.
 */
@Service
public class PolicyService {

    private static final Logger log = LoggerFactory.getLogger(PolicyService.class);

    private final PolicyStore store;
    private final PolicyEventPublisher publisher;
    private final PolicyTerms terms;
    private final Clock clock;

    public PolicyService(PolicyStore store,
                         PolicyEventPublisher publisher,
                         PolicyDefaults defaults,
                         Clock clock) {
        this.store = store;
        this.publisher = publisher;
        this.terms = defaults.toTerms();
        this.clock = clock;
        log.info("Policy terms: delay_threshold={}, premium={}, claim_amount={}",
            terms.delayThreshold(), terms.premium(), terms.claimAmount());
    }

    /**
     * Creates an ACTIVE policy for the holder.
     *
     * @param paidAmount the purchase payment; must equal the configured premium
     * @return the stored policy with its newly assigned id
     * @throws InvalidScheduleException if the arrival is not after the departure
     * @throws IncorrectPremiumException if the payment differs from the premium
     */
    public Policy createPolicy(String holder, String flightCode,
                               Instant scheduledDeparture, Instant scheduledArrival,
                               BigDecimal paidAmount) {
        requireText(holder, "holder is required");
        requireText(flightCode, "flight_code is required");
        if (scheduledDeparture == null || scheduledArrival == null) {
            throw new IllegalArgumentException("scheduled_departure and scheduled_arrival are required");
        }
        if (!scheduledArrival.isAfter(scheduledDeparture)) {
            throw new InvalidScheduleException(scheduledDeparture, scheduledArrival);
        }
        // every deadline evaluation computes must stay representable
        Duration horizon = terms.delayThreshold().compareTo(Policy.NO_DATA_TIMEOUT) > 0
            ? terms.delayThreshold()
            : Policy.NO_DATA_TIMEOUT;
        if (scheduledArrival.isAfter(Instant.MAX.minus(horizon))) {
            throw new InvalidScheduleException(scheduledArrival, horizon);
        }
        if (paidAmount == null || paidAmount.compareTo(terms.premium()) != 0) {
            throw new IncorrectPremiumException(paidAmount, terms.premium());
        }

        Instant now = clock.instant();
        Policy policy = store.create(holder, id -> Policy.open(
            id, holder, flightCode, scheduledDeparture, scheduledArrival, terms, now));

        log.info("Policy {} created for holder={} flight={}", policy.id(), holder, flightCode);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("flight_code", flightCode);
        details.put("premium", policy.premium());
        details.put("claim_amount", policy.claimAmount());
        publisher.publish(PolicyEventType.POLICY_CREATED, policy, details);
        return policy;
    }

    public Policy getPolicy(long policyId) {
        return store.findById(policyId)
            .orElseThrow(() -> new PolicyNotFoundException(policyId));
    }

    /** Ids in creation order; empty for an unknown holder. */
    public List<Long> getPoliciesByHolder(String holder) {
        if (holder == null) {
            return List.of();
        }
        return store.findIdsByHolder(holder);
    }

    private void requireText(String value, String message) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(message);
        }
    }
}
