package com.flightcover.settlement;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ReserveSettlementGatewayTest {

    private final Clock clock = Clock.fixed(Instant.ofEpochSecond(1000), ZoneOffset.UTC);

    @Test
    void payout_drawsFromReserve() {
        ReserveSettlementGateway gateway = new ReserveSettlementGateway(new BigDecimal("300.00"), clock);

        SettlementResult result = gateway.payout(PayoutInstruction.forClaim(1L, "holder-a", new BigDecimal("250.00")));

        assertTrue(result.success());
        assertEquals("claim-1", result.reference());
        assertEquals(0, gateway.reserve().compareTo(new BigDecimal("50.00")));
    }

    @Test
    void payout_failsWhenReserveIsShort() {
        ReserveSettlementGateway gateway = new ReserveSettlementGateway(new BigDecimal("100.00"), clock);

        SettlementResult result = gateway.payout(PayoutInstruction.forClaim(1L, "holder-a", new BigDecimal("250.00")));

        assertFalse(result.success());
        assertEquals("insufficient reserve", result.failureReason());
        assertEquals(0, gateway.reserve().compareTo(new BigDecimal("100.00")));
        assertTrue(gateway.journal().isEmpty());
    }

    @Test
    void repeatedReference_paysOnce() {
        ReserveSettlementGateway gateway = new ReserveSettlementGateway(new BigDecimal("1000.00"), clock);
        PayoutInstruction instruction = PayoutInstruction.forClaim(7L, "holder-a", new BigDecimal("250.00"));

        SettlementResult first = gateway.payout(instruction);
        SettlementResult second = gateway.payout(instruction);

        assertEquals(first, second);
        assertEquals(0, gateway.reserve().compareTo(new BigDecimal("750.00")));
        assertEquals(1, gateway.journal().size());
    }

    @Test
    void shortPayout_canBeRetriedAfterDeposit() {
        ReserveSettlementGateway gateway = new ReserveSettlementGateway(BigDecimal.ZERO, clock);
        PayoutInstruction instruction = PayoutInstruction.forClaim(3L, "holder-a", new BigDecimal("250.00"));

        assertFalse(gateway.payout(instruction).success());
        gateway.deposit("premium-9", "holder-b", new BigDecimal("300.00"));

        assertTrue(gateway.payout(instruction).success());
    }

    @Test
    void withdrawAll_drainsReserve() {
        ReserveSettlementGateway gateway = new ReserveSettlementGateway(new BigDecimal("100.00"), clock);
        gateway.deposit("premium-1", "holder-a", new BigDecimal("25.00"));

        SettlementResult result = gateway.withdrawAll("treasury");

        assertTrue(result.success());
        assertEquals(0, result.amount().compareTo(new BigDecimal("125.00")));
        assertEquals(0, gateway.reserve().signum());

        List<LedgerEntry> journal = gateway.journal();
        assertEquals(2, journal.size());
        assertEquals(LedgerEntry.Kind.PREMIUM_DEPOSIT, journal.get(0).kind());
        assertEquals(LedgerEntry.Kind.WITHDRAWAL, journal.get(1).kind());
        assertEquals("treasury", journal.get(1).counterparty());
        assertEquals(0, journal.get(1).reserveAfter().signum());
    }

    @Test
    void withdrawAll_onEmptyReserveSucceedsWithZero() {
        ReserveSettlementGateway gateway = new ReserveSettlementGateway(BigDecimal.ZERO, clock);

        SettlementResult result = gateway.withdrawAll("treasury");

        assertTrue(result.success());
        assertEquals(0, result.amount().signum());
    }

    @Test
    void negativeInitialReserve_isRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> new ReserveSettlementGateway(new BigDecimal("-1"), clock));
    }

    @Test
    void nonPositiveDeposit_isRejected() {
        ReserveSettlementGateway gateway = new ReserveSettlementGateway(BigDecimal.ZERO, clock);

        assertThrows(IllegalArgumentException.class, () -> gateway.deposit("premium-1", "holder-a", BigDecimal.ZERO));
    }
}
