package com.flightcover.settlement;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * In-process ledger holding the book's reserve. Premiums are deposited into
 * the reserve, payouts and withdrawals are drawn from it, and every movement
 * is journaled.
 */
public class ReserveSettlementGateway implements SettlementGateway {

    private static final Logger log = LoggerFactory.getLogger(ReserveSettlementGateway.class);

    private final Clock clock;
    private final List<LedgerEntry> journal = new ArrayList<>();
    private final Map<String, SettlementResult> settledPayouts = new HashMap<>();
    private BigDecimal reserve;

    public ReserveSettlementGateway(BigDecimal initialReserve, Clock clock) {
        if (initialReserve == null || initialReserve.signum() < 0) {
            throw new IllegalArgumentException("initial reserve must be zero or positive, got " + initialReserve);
        }
        this.reserve = initialReserve;
        this.clock = clock;
    }

    public synchronized void deposit(String reference, String payer, BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("deposit amount must be positive, got " + amount);
        }
        reserve = reserve.add(amount);
        record(LedgerEntry.Kind.PREMIUM_DEPOSIT, reference, payer, amount);
    }

    @Override
    public synchronized SettlementResult payout(PayoutInstruction instruction) {
        SettlementResult previous = settledPayouts.get(instruction.reference());
        if (previous != null) {
            log.info("Payout {} already settled, returning original receipt", instruction.reference());
            return previous;
        }
        if (instruction.amount().compareTo(reserve) > 0) {
            log.warn("Payout {} of {} exceeds reserve {}", instruction.reference(), instruction.amount(), reserve);
            return SettlementResult.failed(instruction.reference(), "insufficient reserve");
        }

        reserve = reserve.subtract(instruction.amount());
        record(LedgerEntry.Kind.PAYOUT, instruction.reference(), instruction.holder(), instruction.amount());
        SettlementResult result = SettlementResult.succeeded(instruction.reference(), instruction.amount());
        settledPayouts.put(instruction.reference(), result);
        return result;
    }

    @Override
    public synchronized SettlementResult withdrawAll(String destination) {
        String reference = "withdrawal-" + UUID.randomUUID();
        BigDecimal amount = reserve;
        reserve = BigDecimal.ZERO;
        record(LedgerEntry.Kind.WITHDRAWAL, reference, destination, amount);
        return SettlementResult.succeeded(reference, amount);
    }

    public synchronized BigDecimal reserve() {
        return reserve;
    }

    public synchronized List<LedgerEntry> journal() {
        return List.copyOf(journal);
    }

    private void record(LedgerEntry.Kind kind, String reference, String counterparty, BigDecimal amount) {
        journal.add(new LedgerEntry(kind, reference, counterparty, amount, reserve, clock.instant()));
    }
}
