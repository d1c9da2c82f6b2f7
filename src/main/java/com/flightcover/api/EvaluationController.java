package com.flightcover.api;

import com.flightcover.claim.ClaimEvaluator;
import com.flightcover.claim.EvaluationResult;
import com.flightcover.claim.SweepSummary;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Instant;

/**
 * Claim evaluation triggers. {@code now} defaults to the service clock.
 *
 * POST /v1/policies/{policyId}/evaluations
 * POST /v1/evaluations/sweep
 */
@RestController
@RequestMapping("/v1")
public class EvaluationController {

    private final ClaimEvaluator claimEvaluator;
    private final Clock clock;

    public EvaluationController(ClaimEvaluator claimEvaluator, Clock clock) {
        this.claimEvaluator = claimEvaluator;
        this.clock = clock;
    }

    @PostMapping("/policies/{policyId}/evaluations")
    public EvaluationResult evaluate(@PathVariable long policyId,
                                     @RequestParam(required = false)
                                     @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant now,
                                     @RequestHeader(value = CallerHeaders.CALLER_ID, required = false) String callerId,
                                     @RequestHeader(value = CallerHeaders.CALLER_ROLES, required = false) String roles) {
        return claimEvaluator.evaluate(
            CallerHeaders.resolve(callerId, roles),
            policyId,
            now != null ? now : clock.instant()
        );
    }

    @PostMapping("/evaluations/sweep")
    public SweepSummary sweep(@RequestParam(required = false)
                              @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant now,
                              @RequestHeader(value = CallerHeaders.CALLER_ID, required = false) String callerId,
                              @RequestHeader(value = CallerHeaders.CALLER_ROLES, required = false) String roles) {
        return claimEvaluator.evaluateAllActive(
            CallerHeaders.resolve(callerId, roles),
            now != null ? now : clock.instant()
        );
    }
}
