package com.flightcover.claim;

import com.flightcover.policy.Policy;

import java.time.Instant;

/**
 * One step of the claim decision procedure. Rules are pure: they read the
 * policy and the supplied time, and never touch the store or the ledger.
 */
public interface ClaimRule {

    /** Unique identifier, e.g. "flight-canceled". */
    String ruleId();

    RuleResult evaluate(Policy policy, Instant now);

    sealed interface RuleResult {
        /** The rule does not apply; the next rule decides. */
        record Pass() implements RuleResult {}
        record Decide(String reasonCode, ClaimDecision decision) implements RuleResult {}
    }
}
