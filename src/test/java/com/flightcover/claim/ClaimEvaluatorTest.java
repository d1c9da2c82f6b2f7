package com.flightcover.claim;

import com.flightcover.access.AccessGuard;
import com.flightcover.access.Caller;
import com.flightcover.access.Role;
import com.flightcover.bus.InMemoryPolicyEventLog;
import com.flightcover.bus.PolicyEvent;
import com.flightcover.bus.PolicyEventFilter;
import com.flightcover.bus.PolicyEventPublisher;
import com.flightcover.bus.PolicyEventType;
import com.flightcover.error.PolicyNotActiveException;
import com.flightcover.error.PolicyNotFoundException;
import com.flightcover.error.SettlementFailureException;
import com.flightcover.error.UnauthorizedException;
import com.flightcover.ingest.FlightInfoIngestService;
import com.flightcover.policy.ClaimOutcome;
import com.flightcover.policy.FlightStatus;
import com.flightcover.policy.InMemoryPolicyStore;
import com.flightcover.policy.Policy;
import com.flightcover.policy.PolicyDefaults;
import com.flightcover.policy.PolicyLocks;
import com.flightcover.policy.PolicyService;
import com.flightcover.policy.PolicyStatus;
import com.flightcover.settlement.PayoutInstruction;
import com.flightcover.settlement.SettlementGateway;
import com.flightcover.settlement.SettlementResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ClaimEvaluatorTest {

    private static final Instant DEPARTURE = Instant.ofEpochSecond(1000);
    private static final Instant ARRIVAL = Instant.ofEpochSecond(2000);
    private static final Duration NO_DATA_TIMEOUT = Duration.ofHours(72);

    private static final Caller ADMIN = Caller.of("admin-1", Role.ADMIN);
    private static final Caller ORACLE = Caller.of("oracle-1", Role.ORACLE);

    private Clock clock;
    private InMemoryPolicyStore store;
    private InMemoryPolicyEventLog eventLog;
    private PolicyEventPublisher publisher;
    private PolicyLocks locks;
    private AccessGuard accessGuard;
    private PolicyService policyService;
    private FlightInfoIngestService ingest;
    private RecordingGateway gateway;
    private ClaimEvaluator evaluator;

    @BeforeEach
    void setUp() {
        clock = Clock.fixed(Instant.ofEpochSecond(500), ZoneOffset.UTC);
        store = new InMemoryPolicyStore();
        eventLog = new InMemoryPolicyEventLog();
        publisher = new PolicyEventPublisher(eventLog, clock);
        locks = new PolicyLocks();
        accessGuard = new AccessGuard();
        policyService = new PolicyService(store, publisher, new PolicyDefaults(), clock);
        ingest = new FlightInfoIngestService(store, locks, accessGuard, publisher, clock);
        gateway = new RecordingGateway();
        evaluator = evaluatorWith(gateway);
    }

    @Nested
    @DisplayName("Decision procedure")
    class DecisionProcedure {

        @Test
        @DisplayName("No data before the timeout: stays ACTIVE and emits AWAITING_DATA")
        void noDataBeforeTimeout_remainsActive() {
            Policy policy = purchase("holder-a");
            Instant now = ARRIVAL.plus(Duration.ofHours(1));

            EvaluationResult result = evaluator.evaluate(ADMIN, policy.id(), now);

            assertEquals(PolicyStatus.ACTIVE, result.status());
            assertEquals(ClaimOutcome.NONE, result.claimOutcome());
            assertEquals("AWAITING_FLIGHT_DATA", result.reasonCode());
            Policy stored = stored(policy.id());
            assertEquals(now, stored.lastEvaluatedAt());
            assertEquals(FlightStatus.NORMAL, stored.observedFlightStatus());
            assertEquals(1, events(policy.id(), PolicyEventType.AWAITING_DATA).size());
            assertTrue(gateway.instructions.isEmpty());
        }

        @Test
        @DisplayName("Arrival exactly at scheduled arrival is on time")
        void arrivalAtSchedule_isDenied() {
            Policy policy = purchase("holder-a");
            ingest.updateFlightInfo(ORACLE, policy.id(), Instant.ofEpochSecond(2000), FlightStatus.NORMAL);

            EvaluationResult result = evaluator.evaluate(ADMIN, policy.id(), Instant.ofEpochSecond(3000));

            assertEquals(PolicyStatus.TERMINATED, result.status());
            assertEquals(ClaimOutcome.DENIED, result.claimOutcome());
            assertEquals("ARRIVED_WITHIN_THRESHOLD", result.reasonCode());
            assertTrue(gateway.instructions.isEmpty());
        }

        @Test
        @DisplayName("Arrival exactly at the delay threshold is still on time")
        void arrivalAtThreshold_isDenied() {
            Policy policy = purchase("holder-a");
            ingest.updateFlightInfo(ORACLE, policy.id(), Instant.ofEpochSecond(2000 + 14400), FlightStatus.NORMAL);

            EvaluationResult result = evaluator.evaluate(ADMIN, policy.id(), Instant.ofEpochSecond(20000));

            assertEquals(ClaimOutcome.DENIED, result.claimOutcome());
            assertTrue(gateway.instructions.isEmpty());
        }

        @Test
        @DisplayName("Arrival one second past the threshold pays")
        void arrivalJustPastThreshold_pays() {
            Policy policy = purchase("holder-a");
            ingest.updateFlightInfo(ORACLE, policy.id(), Instant.ofEpochSecond(2000 + 14401), FlightStatus.NORMAL);

            EvaluationResult result = evaluator.evaluate(ADMIN, policy.id(), Instant.ofEpochSecond(20000));

            assertEquals(PolicyStatus.CLAIMED, result.status());
            assertEquals(1, gateway.instructions.size());
        }

        @Test
        @DisplayName("Late arrival: CLAIMED/PAID with exactly one payout of the claim amount")
        void lateArrival_paysOnce() {
            Policy policy = purchase("holder-a");
            ingest.updateFlightInfo(ORACLE, policy.id(), Instant.ofEpochSecond(20000), FlightStatus.NORMAL);

            EvaluationResult result = evaluator.evaluate(ADMIN, policy.id(), Instant.ofEpochSecond(21000));

            assertEquals(PolicyStatus.CLAIMED, result.status());
            assertEquals(ClaimOutcome.PAID, result.claimOutcome());
            assertEquals("DELAY_THRESHOLD_EXCEEDED", result.reasonCode());
            assertEquals(1, gateway.instructions.size());
            PayoutInstruction instruction = gateway.instructions.get(0);
            assertEquals("holder-a", instruction.holder());
            assertEquals(0, new BigDecimal("250.00").compareTo(instruction.amount()));
            assertEquals("claim-" + policy.id(), instruction.reference());
            assertEquals("claim-" + policy.id(), stored(policy.id()).payoutReference());
            assertEquals(1, events(policy.id(), PolicyEventType.POLICY_CLAIMED).size());
        }

        @Test
        @DisplayName("No data past 72h: TERMINATED/DENIED with flight status forced to OTHER")
        void noDataPastTimeout_deniedAsOther() {
            Policy policy = purchase("holder-a");

            EvaluationResult result = evaluator.evaluate(ADMIN, policy.id(),
                ARRIVAL.plus(NO_DATA_TIMEOUT).plusSeconds(1));

            assertEquals(PolicyStatus.TERMINATED, result.status());
            assertEquals(ClaimOutcome.DENIED, result.claimOutcome());
            assertEquals(FlightStatus.OTHER, result.observedFlightStatus());
            assertEquals("NO_FLIGHT_DATA", result.reasonCode());
        }

        @Test
        @DisplayName("Timeout boundary: denied exactly at 72h, still awaiting one second before")
        void timeoutBoundary() {
            Policy before = purchase("holder-a");
            Policy at = purchase("holder-a");

            EvaluationResult stillOpen = evaluator.evaluate(ADMIN, before.id(),
                ARRIVAL.plus(NO_DATA_TIMEOUT).minusSeconds(1));
            EvaluationResult closed = evaluator.evaluate(ADMIN, at.id(), ARRIVAL.plus(NO_DATA_TIMEOUT));

            assertEquals(PolicyStatus.ACTIVE, stillOpen.status());
            assertEquals(PolicyStatus.TERMINATED, closed.status());
        }

        @Test
        @DisplayName("Canceled flight with unknown arrival is denied")
        void canceledWithoutArrival_isDenied() {
            Policy policy = purchase("holder-a");
            ingest.updateFlightInfo(ORACLE, policy.id(), null, FlightStatus.CANCELED);

            EvaluationResult result = evaluator.evaluate(ADMIN, policy.id(), Instant.ofEpochSecond(2500));

            assertEquals(PolicyStatus.TERMINATED, result.status());
            assertEquals(ClaimOutcome.DENIED, result.claimOutcome());
            assertEquals(FlightStatus.CANCELED, result.observedFlightStatus());
            assertEquals("FLIGHT_CANCELED", result.reasonCode());
        }

        @Test
        @DisplayName("Canceled flight never pays, even with a late arrival")
        void canceledWithLateArrival_neverPays() {
            Policy policy = purchase("holder-a");
            ingest.updateFlightInfo(ORACLE, policy.id(), Instant.ofEpochSecond(90000), FlightStatus.CANCELED);

            EvaluationResult result = evaluator.evaluate(ADMIN, policy.id(), Instant.ofEpochSecond(95000));

            assertEquals(ClaimOutcome.DENIED, result.claimOutcome());
            assertTrue(gateway.instructions.isEmpty());
        }

        @Test
        @DisplayName("Cancellation takes priority over the no-data timeout")
        void cancellationBeforeTimeout() {
            Policy policy = purchase("holder-a");
            ingest.updateFlightInfo(ORACLE, policy.id(), null, FlightStatus.CANCELED);

            EvaluationResult result = evaluator.evaluate(ADMIN, policy.id(),
                ARRIVAL.plus(NO_DATA_TIMEOUT).plusSeconds(10));

            assertEquals("FLIGHT_CANCELED", result.reasonCode());
            assertEquals(FlightStatus.CANCELED, result.observedFlightStatus());
        }

        @Test
        @DisplayName("Last ingest wins before evaluation")
        void lastWriteWins() {
            Policy policy = purchase("holder-a");
            ingest.updateFlightInfo(ORACLE, policy.id(), Instant.ofEpochSecond(20000), FlightStatus.NORMAL);
            ingest.updateFlightInfo(ORACLE, policy.id(), Instant.ofEpochSecond(2100), FlightStatus.NORMAL);

            EvaluationResult result = evaluator.evaluate(ADMIN, policy.id(), Instant.ofEpochSecond(30000));

            assertEquals(ClaimOutcome.DENIED, result.claimOutcome());
            assertTrue(gateway.instructions.isEmpty());
        }
    }

    @Nested
    @DisplayName("Terminal policies")
    class TerminalPolicies {

        @Test
        @DisplayName("Denied policy rejects further evaluation and ingest without changing")
        void deniedPolicy_isFrozen() {
            Policy policy = purchase("holder-a");
            ingest.updateFlightInfo(ORACLE, policy.id(), Instant.ofEpochSecond(2000), FlightStatus.NORMAL);
            evaluator.evaluate(ADMIN, policy.id(), Instant.ofEpochSecond(3000));
            Policy terminal = stored(policy.id());

            assertThrows(PolicyNotActiveException.class,
                () -> evaluator.evaluate(ADMIN, policy.id(), Instant.ofEpochSecond(4000)));
            assertThrows(PolicyNotActiveException.class,
                () -> ingest.updateFlightInfo(ORACLE, policy.id(), Instant.ofEpochSecond(90000), FlightStatus.NORMAL));

            assertEquals(terminal, stored(policy.id()));
        }

        @Test
        @DisplayName("Repeated evaluation of a claimed policy issues no further payout")
        void claimedPolicy_noSecondPayout() {
            Policy policy = purchase("holder-a");
            ingest.updateFlightInfo(ORACLE, policy.id(), Instant.ofEpochSecond(20000), FlightStatus.NORMAL);
            evaluator.evaluate(ADMIN, policy.id(), Instant.ofEpochSecond(21000));
            Policy claimed = stored(policy.id());

            for (int i = 0; i < 5; i++) {
                long at = 22000 + i;
                assertThrows(PolicyNotActiveException.class,
                    () -> evaluator.evaluate(ADMIN, policy.id(), Instant.ofEpochSecond(at)));
            }

            assertEquals(1, gateway.instructions.size());
            assertEquals(claimed, stored(policy.id()));
        }

        @Test
        @DisplayName("Outcome is NONE exactly while the policy is ACTIVE")
        void outcomeMatchesStatus() {
            Policy awaiting = purchase("holder-a");
            Policy onTime = purchase("holder-a");
            Policy late = purchase("holder-a");
            Policy timedOut = purchase("holder-a");
            assertOutcomeInvariant(stored(awaiting.id()));

            ingest.updateFlightInfo(ORACLE, onTime.id(), Instant.ofEpochSecond(2000), FlightStatus.NORMAL);
            ingest.updateFlightInfo(ORACLE, late.id(), Instant.ofEpochSecond(50000), FlightStatus.NORMAL);
            assertOutcomeInvariant(stored(onTime.id()));

            evaluator.evaluate(ADMIN, awaiting.id(), Instant.ofEpochSecond(2500));
            evaluator.evaluate(ADMIN, onTime.id(), Instant.ofEpochSecond(2500));
            evaluator.evaluate(ADMIN, late.id(), Instant.ofEpochSecond(60000));
            evaluator.evaluate(ADMIN, timedOut.id(), ARRIVAL.plus(NO_DATA_TIMEOUT));

            for (Policy p : List.of(awaiting, onTime, late, timedOut)) {
                assertOutcomeInvariant(stored(p.id()));
            }
        }
    }

    @Nested
    @DisplayName("Rejected calls")
    class RejectedCalls {

        @Test
        void oracleCannotEvaluate() {
            Policy policy = purchase("holder-a");
            ingest.updateFlightInfo(ORACLE, policy.id(), Instant.ofEpochSecond(20000), FlightStatus.NORMAL);
            Policy before = stored(policy.id());

            assertThrows(UnauthorizedException.class,
                () -> evaluator.evaluate(ORACLE, policy.id(), Instant.ofEpochSecond(21000)));

            assertEquals(before, stored(policy.id()));
            assertTrue(gateway.instructions.isEmpty());
        }

        @Test
        void unknownPolicy_isNotFound() {
            assertThrows(PolicyNotFoundException.class,
                () -> evaluator.evaluate(ADMIN, 404L, Instant.ofEpochSecond(21000)));
        }
    }

    @Nested
    @DisplayName("Settlement reconciliation")
    class SettlementReconciliation {

        @Test
        @DisplayName("Failed payout leaves the policy ACTIVE and unchanged; the retry pays once")
        void failedPayout_keepsPolicyActive_thenRetrySucceeds() {
            SettlementGateway flaky = mock(SettlementGateway.class);
            when(flaky.payout(any(PayoutInstruction.class)))
                .thenReturn(SettlementResult.failed("claim-1", "ledger offline"))
                .thenReturn(SettlementResult.succeeded("claim-1", new BigDecimal("250.00")));
            ClaimEvaluator flakyEvaluator = evaluatorWith(flaky);

            Policy policy = purchase("holder-a");
            ingest.updateFlightInfo(ORACLE, policy.id(), Instant.ofEpochSecond(20000), FlightStatus.NORMAL);
            Policy before = stored(policy.id());

            SettlementFailureException ex = assertThrows(SettlementFailureException.class,
                () -> flakyEvaluator.evaluate(ADMIN, policy.id(), Instant.ofEpochSecond(21000)));
            assertTrue(ex.getMessage().contains("ledger offline"));
            assertEquals(before, stored(policy.id()));
            assertEquals(1, events(policy.id(), PolicyEventType.PAYOUT_FAILED).size());
            assertTrue(events(policy.id(), PolicyEventType.POLICY_CLAIMED).isEmpty());

            EvaluationResult retry = flakyEvaluator.evaluate(ADMIN, policy.id(), Instant.ofEpochSecond(22000));

            assertEquals(PolicyStatus.CLAIMED, retry.status());
            assertEquals(ClaimOutcome.PAID, retry.claimOutcome());
            verify(flaky, times(2)).payout(PayoutInstruction.forClaim(policy.id(), "holder-a", before.claimAmount()));
        }

        @Test
        @DisplayName("Gateway exception surfaces as SettlementFailure with the cause attached")
        void gatewayException_isSettlementFailure() {
            SettlementGateway broken = mock(SettlementGateway.class);
            IllegalStateException cause = new IllegalStateException("connection reset");
            when(broken.payout(any(PayoutInstruction.class))).thenThrow(cause);
            ClaimEvaluator brokenEvaluator = evaluatorWith(broken);

            Policy policy = purchase("holder-a");
            ingest.updateFlightInfo(ORACLE, policy.id(), Instant.ofEpochSecond(20000), FlightStatus.NORMAL);

            SettlementFailureException ex = assertThrows(SettlementFailureException.class,
                () -> brokenEvaluator.evaluate(ADMIN, policy.id(), Instant.ofEpochSecond(21000)));

            assertSame(cause, ex.getCause());
            Policy after = stored(policy.id());
            assertEquals(PolicyStatus.ACTIVE, after.status());
            assertEquals(ClaimOutcome.NONE, after.claimOutcome());
            assertNull(after.payoutReference());
        }
    }

    @Nested
    @DisplayName("Concurrency")
    class Concurrency {

        @Test
        @DisplayName("Concurrent evaluations of one late policy pay exactly once")
        void concurrentEvaluations_payOnce() throws Exception {
            Policy policy = purchase("holder-a");
            ingest.updateFlightInfo(ORACLE, policy.id(), Instant.ofEpochSecond(20000), FlightStatus.NORMAL);

            int threads = 16;
            ExecutorService pool = Executors.newFixedThreadPool(threads);
            CountDownLatch start = new CountDownLatch(1);
            List<Future<EvaluationResult>> futures = new ArrayList<>();
            try {
                for (int i = 0; i < threads; i++) {
                    Callable<EvaluationResult> task = () -> {
                        start.await();
                        return evaluator.evaluate(ADMIN, policy.id(), Instant.ofEpochSecond(21000));
                    };
                    futures.add(pool.submit(task));
                }
                start.countDown();

                int succeeded = 0;
                int rejected = 0;
                for (Future<EvaluationResult> future : futures) {
                    try {
                        future.get(10, TimeUnit.SECONDS);
                        succeeded++;
                    } catch (ExecutionException ex) {
                        assertInstanceOf(PolicyNotActiveException.class, ex.getCause());
                        rejected++;
                    }
                }

                assertEquals(1, succeeded);
                assertEquals(threads - 1, rejected);
                assertEquals(1, gateway.instructions.size());
            } finally {
                pool.shutdownNow();
            }
        }

        @Test
        @DisplayName("A blocked notification subscriber does not hold the policy lock")
        void slowSubscriber_doesNotBlockNextWriter() throws Exception {
            Policy policy = purchase("holder-a");
            CountDownLatch subscriberEntered = new CountDownLatch(1);
            CountDownLatch releaseSubscriber = new CountDownLatch(1);
            publisher.subscribe(event -> {
                if (event.type() == PolicyEventType.AWAITING_DATA) {
                    subscriberEntered.countDown();
                    try {
                        releaseSubscriber.await(10, TimeUnit.SECONDS);
                    } catch (InterruptedException ex) {
                        Thread.currentThread().interrupt();
                    }
                }
            });

            ExecutorService pool = Executors.newFixedThreadPool(2);
            try {
                Future<EvaluationResult> evaluation = pool.submit(
                    () -> evaluator.evaluate(ADMIN, policy.id(), ARRIVAL.plus(Duration.ofHours(1))));
                assertTrue(subscriberEntered.await(5, TimeUnit.SECONDS));

                Future<Policy> update = pool.submit(() -> ingest.updateFlightInfo(
                    ORACLE, policy.id(), Instant.ofEpochSecond(20000), FlightStatus.NORMAL));

                Policy updated = update.get(2, TimeUnit.SECONDS);
                assertEquals(Instant.ofEpochSecond(20000), updated.actualArrival());
                assertFalse(evaluation.isDone());

                releaseSubscriber.countDown();
                assertEquals(PolicyStatus.ACTIVE, evaluation.get(5, TimeUnit.SECONDS).status());
            } finally {
                releaseSubscriber.countDown();
                pool.shutdownNow();
            }
        }
    }

    @Nested
    @DisplayName("Sweep")
    class Sweep {

        @Test
        @DisplayName("Sweep evaluates every ACTIVE policy once and skips terminal ones")
        void sweep_countsOutcomes() {
            Policy awaiting = purchase("holder-a");
            Policy onTime = purchase("holder-b");
            Policy late = purchase("holder-c");
            Policy alreadyDenied = purchase("holder-d");
            ingest.updateFlightInfo(ORACLE, onTime.id(), Instant.ofEpochSecond(2000), FlightStatus.NORMAL);
            ingest.updateFlightInfo(ORACLE, late.id(), Instant.ofEpochSecond(20000), FlightStatus.NORMAL);
            ingest.updateFlightInfo(ORACLE, alreadyDenied.id(), null, FlightStatus.CANCELED);
            evaluator.evaluate(ADMIN, alreadyDenied.id(), Instant.ofEpochSecond(2000));

            SweepSummary summary = evaluator.evaluateAllActive(ADMIN, Instant.ofEpochSecond(21000));

            assertEquals(3, summary.evaluated());
            assertEquals(1, summary.awaiting());
            assertEquals(1, summary.denied());
            assertEquals(1, summary.claimed());
            assertEquals(0, summary.failed());
            assertEquals(PolicyStatus.ACTIVE, stored(awaiting.id()).status());
        }

        @Test
        @DisplayName("Settlement failures are counted, not thrown")
        void sweep_countsSettlementFailures() {
            SettlementGateway refusing = mock(SettlementGateway.class);
            when(refusing.payout(any(PayoutInstruction.class)))
                .thenReturn(SettlementResult.failed("claim", "insufficient reserve"));
            ClaimEvaluator refusingEvaluator = evaluatorWith(refusing);

            Policy late = purchase("holder-a");
            ingest.updateFlightInfo(ORACLE, late.id(), Instant.ofEpochSecond(20000), FlightStatus.NORMAL);

            SweepSummary summary = refusingEvaluator.evaluateAllActive(ADMIN, Instant.ofEpochSecond(21000));

            assertEquals(0, summary.evaluated());
            assertEquals(1, summary.failed());
            assertEquals(PolicyStatus.ACTIVE, stored(late.id()).status());
        }

        @Test
        void sweep_rejectsMissingTimeBeforeTouchingPolicies() {
            Policy first = purchase("holder-a");
            Policy second = purchase("holder-b");

            assertThrows(IllegalArgumentException.class, () -> evaluator.evaluateAllActive(ADMIN, null));

            assertEquals(first, stored(first.id()));
            assertEquals(second, stored(second.id()));
            assertTrue(events(first.id(), PolicyEventType.AWAITING_DATA).isEmpty());
        }

        @Test
        void sweep_requiresAdmin() {
            assertThrows(UnauthorizedException.class,
                () -> evaluator.evaluateAllActive(ORACLE, Instant.ofEpochSecond(21000)));
        }
    }

    // ---- helpers ----

    private ClaimEvaluator evaluatorWith(SettlementGateway settlementGateway) {
        return new ClaimEvaluator(ClaimRules.standard(), store, locks, accessGuard, settlementGateway, publisher);
    }

    private Policy purchase(String holder) {
        return policyService.createPolicy(holder, "FC-101", DEPARTURE, ARRIVAL, new BigDecimal("25.00"));
    }

    private Policy stored(long policyId) {
        return store.findById(policyId).orElseThrow();
    }

    private List<PolicyEvent> events(long policyId, PolicyEventType type) {
        return eventLog.query(PolicyEventFilter.forPolicy(policyId).withType(type), 100);
    }

    private void assertOutcomeInvariant(Policy policy) {
        assertEquals(policy.status() == PolicyStatus.ACTIVE, policy.claimOutcome() == ClaimOutcome.NONE,
            "claim outcome must be NONE iff status is ACTIVE: " + policy);
    }

    /** Always-successful gateway that records every instruction it receives. */
    private static class RecordingGateway implements SettlementGateway {

        final List<PayoutInstruction> instructions = new CopyOnWriteArrayList<>();

        @Override
        public SettlementResult payout(PayoutInstruction instruction) {
            instructions.add(instruction);
            return SettlementResult.succeeded(instruction.reference(), instruction.amount());
        }

        @Override
        public SettlementResult withdrawAll(String destination) {
            return SettlementResult.succeeded("withdrawal", BigDecimal.ZERO);
        }
    }
}
