package com.flightcover.claim;

import com.flightcover.access.Caller;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Periodic trigger for {@link ClaimEvaluator#evaluateAllActive}. Off unless
 * {@code flightcover.evaluation.sweep.enabled} is set.
 */
@Component
public class ClaimEvaluationScheduler {

    private static final Logger log = LoggerFactory.getLogger(ClaimEvaluationScheduler.class);

    private final ClaimEvaluator claimEvaluator;
    private final Clock clock;
    private final boolean enabled;

    public ClaimEvaluationScheduler(ClaimEvaluator claimEvaluator,
                                    Clock clock,
                                    @Value("${flightcover.evaluation.sweep.enabled:false}") boolean enabled) {
        this.claimEvaluator = claimEvaluator;
        this.clock = clock;
        this.enabled = enabled;
        log.info("Claim evaluation sweep enabled={}", enabled);
    }

    @Scheduled(fixedDelayString = "${flightcover.evaluation.sweep.interval-ms:60000}")
    public void sweep() {
        if (!enabled) {
            return;
        }
        try {
            claimEvaluator.evaluateAllActive(Caller.system(), clock.instant());
        } catch (RuntimeException ex) {
            log.error("Claim evaluation sweep failed", ex);
        }
    }
}
