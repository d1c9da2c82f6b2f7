package com.flightcover.claim;

import com.flightcover.access.AccessGuard;
import com.flightcover.access.Caller;
import com.flightcover.access.Role;
import com.flightcover.bus.PolicyEvent;
import com.flightcover.bus.PolicyEventPublisher;
import com.flightcover.bus.PolicyEventType;
import com.flightcover.error.PolicyNotActiveException;
import com.flightcover.error.PolicyNotFoundException;
import com.flightcover.error.SettlementFailureException;
import com.flightcover.policy.Policy;
import com.flightcover.policy.PolicyLocks;
import com.flightcover.policy.PolicyStatus;
import com.flightcover.policy.PolicyStore;
import com.flightcover.settlement.PayoutInstruction;
import com.flightcover.settlement.SettlementGateway;
import com.flightcover.settlement.SettlementResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Claim evaluator: the policy lifecycle state machine.
 *
 * ACTIVE is the only non-terminal status. Each evaluation runs the rules in
 * order and applies the first decision:
 * - AwaitData: stay ACTIVE, move lastEvaluatedAt
 * - Deny: TERMINATED / DENIED
 * - Pay: instruct the payout, and only after the ledger confirms it mark CLAIMED / PAID
 *
 * A failed payout leaves the policy untouched and ACTIVE, so CLAIMED always
 * means funds moved; the next evaluation retries with the same payout
 * reference. Evaluations of one policy are serialized by its lock, which
 * together with the ACTIVE check gives at most one payout per policy.
 * Notifications are logged under the lock and delivered to subscribers
 * after it is released.
 */
public class ClaimEvaluator {

    private static final Logger log = LoggerFactory.getLogger(ClaimEvaluator.class);

    private final List<ClaimRule> rules;
    private final PolicyStore store;
    private final PolicyLocks locks;
    private final AccessGuard accessGuard;
    private final SettlementGateway settlementGateway;
    private final PolicyEventPublisher publisher;

    public ClaimEvaluator(List<ClaimRule> rules,
                          PolicyStore store,
                          PolicyLocks locks,
                          AccessGuard accessGuard,
                          SettlementGateway settlementGateway,
                          PolicyEventPublisher publisher) {
        if (rules.isEmpty()) {
            throw new IllegalArgumentException("at least one claim rule is required");
        }
        this.rules = List.copyOf(rules);
        this.store = store;
        this.locks = locks;
        this.accessGuard = accessGuard;
        this.settlementGateway = settlementGateway;
        this.publisher = publisher;
    }

    /**
     * Evaluates one policy at the given time.
     *
     * @throws PolicyNotFoundException if no such policy exists
     * @throws PolicyNotActiveException if the policy is already terminal
     * @throws SettlementFailureException if a due payout did not complete; the policy stays ACTIVE
     */
    public EvaluationResult evaluate(Caller caller, long policyId, Instant now) {
        accessGuard.require(caller, "evaluate policies", Role.ADMIN);
        if (now == null) {
            throw new IllegalArgumentException("evaluation time is required");
        }

        List<PolicyEvent> recorded = new ArrayList<>();
        try {
            return locks.withLock(policyId, () -> {
                Policy policy = store.findById(policyId)
                    .orElseThrow(() -> new PolicyNotFoundException(policyId));
                if (!policy.isActive()) {
                    throw new PolicyNotActiveException(policyId, policy.status());
                }
                return apply(policy, now, recorded);
            });
        } finally {
            recorded.forEach(publisher::dispatch);
        }
    }

    /**
     * Evaluates every policy that is ACTIVE when the sweep starts. Policies
     * that turn terminal concurrently are skipped; settlement failures are
     * counted and left for the next sweep.
     */
    public SweepSummary evaluateAllActive(Caller caller, Instant now) {
        accessGuard.require(caller, "evaluate policies", Role.ADMIN);
        if (now == null) {
            throw new IllegalArgumentException("evaluation time is required");
        }

        int evaluated = 0;
        int awaiting = 0;
        int denied = 0;
        int claimed = 0;
        int failed = 0;

        for (Policy policy : store.findByStatus(PolicyStatus.ACTIVE)) {
            try {
                EvaluationResult result = evaluate(caller, policy.id(), now);
                evaluated++;
                switch (result.status()) {
                    case ACTIVE -> awaiting++;
                    case TERMINATED -> denied++;
                    case CLAIMED -> claimed++;
                }
            } catch (PolicyNotActiveException ex) {
                log.debug("Policy {} left ACTIVE during sweep, skipping", policy.id());
            } catch (SettlementFailureException ex) {
                failed++;
            }
        }

        SweepSummary summary = new SweepSummary(now, evaluated, awaiting, denied, claimed, failed);
        if (denied > 0 || claimed > 0 || failed > 0) {
            log.info("Sweep at {}: evaluated={}, awaiting={}, denied={}, claimed={}, failed={}",
                now, evaluated, awaiting, denied, claimed, failed);
        }
        return summary;
    }

    private EvaluationResult apply(Policy policy, Instant now, List<PolicyEvent> recorded) {
        for (ClaimRule rule : rules) {
            ClaimRule.RuleResult result = rule.evaluate(policy, now);
            if (result instanceof ClaimRule.RuleResult.Decide decide) {
                ClaimDecision decision = decide.decision();
                if (decision instanceof ClaimDecision.AwaitData) {
                    return awaitData(policy, rule, decide.reasonCode(), now, recorded);
                }
                if (decision instanceof ClaimDecision.Deny deny) {
                    return deny(policy, rule, decide.reasonCode(), deny, now, recorded);
                }
                if (decision instanceof ClaimDecision.Pay pay) {
                    return pay(policy, rule, decide.reasonCode(), pay, now, recorded);
                }
            }
        }
        throw new IllegalStateException("no claim rule decided policy " + policy.id());
    }

    private EvaluationResult awaitData(Policy policy, ClaimRule rule, String reasonCode, Instant now,
                                       List<PolicyEvent> recorded) {
        Policy touched = policy.touched(now);
        store.save(touched);

        log.debug("Policy {} awaiting flight data (scheduled arrival {})", policy.id(), policy.scheduledArrival());
        recorded.add(publisher.record(PolicyEventType.AWAITING_DATA, touched, details(rule, reasonCode)));
        return EvaluationResult.of(touched, rule.ruleId(), reasonCode, now);
    }

    private EvaluationResult deny(Policy policy, ClaimRule rule, String reasonCode,
                                  ClaimDecision.Deny deny, Instant now, List<PolicyEvent> recorded) {
        Policy terminated = policy.denied(deny.recordedFlightStatus(), now);
        store.save(terminated);

        log.info("Policy {} denied: rule={} reason={}", policy.id(), rule.ruleId(), reasonCode);
        Map<String, Object> details = details(rule, reasonCode);
        details.put("flight_status", terminated.observedFlightStatus().getValue());
        recorded.add(publisher.record(PolicyEventType.POLICY_DENIED, terminated, details));
        return EvaluationResult.of(terminated, rule.ruleId(), reasonCode, now);
    }

    private EvaluationResult pay(Policy policy, ClaimRule rule, String reasonCode,
                                 ClaimDecision.Pay pay, Instant now, List<PolicyEvent> recorded) {
        PayoutInstruction instruction = PayoutInstruction.forClaim(policy.id(), policy.holder(), pay.amount());

        SettlementResult settlement;
        try {
            settlement = settlementGateway.payout(instruction);
        } catch (RuntimeException ex) {
            payoutFailed(policy, rule, instruction, ex.getMessage(), recorded);
            throw new SettlementFailureException(
                "payout " + instruction.reference() + " for policy " + policy.id() + " failed", ex);
        }
        if (settlement == null || !settlement.success()) {
            String reason = settlement != null ? settlement.failureReason() : "no settlement result";
            payoutFailed(policy, rule, instruction, reason, recorded);
            throw new SettlementFailureException(
                "payout " + instruction.reference() + " for policy " + policy.id() + " failed: " + reason);
        }

        Policy claimed = policy.claimed(settlement.reference(), now);
        store.save(claimed);

        log.info("Policy {} claimed: paid {} to {} (reference={})",
            policy.id(), pay.amount(), policy.holder(), settlement.reference());
        Map<String, Object> details = details(rule, reasonCode);
        details.put("amount", pay.amount());
        details.put("payout_reference", settlement.reference());
        recorded.add(publisher.record(PolicyEventType.POLICY_CLAIMED, claimed, details));
        return EvaluationResult.of(claimed, rule.ruleId(), reasonCode, now);
    }

    private void payoutFailed(Policy policy, ClaimRule rule, PayoutInstruction instruction, String reason,
                              List<PolicyEvent> recorded) {
        log.warn("Payout {} of {} to {} failed, policy {} stays ACTIVE: {}",
            instruction.reference(), instruction.amount(), instruction.holder(), policy.id(), reason);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("rule_id", rule.ruleId());
        details.put("amount", instruction.amount());
        details.put("payout_reference", instruction.reference());
        details.put("failure_reason", reason);
        recorded.add(publisher.record(PolicyEventType.PAYOUT_FAILED, policy, details));
    }

    private Map<String, Object> details(ClaimRule rule, String reasonCode) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("rule_id", rule.ruleId());
        details.put("reason_code", reasonCode);
        return details;
    }
}
