package com.flightcover.settlement;

import java.math.BigDecimal;
import java.time.Instant;

public record LedgerEntry(
    Kind kind,
    String reference,
    String counterparty,
    BigDecimal amount,
    BigDecimal reserveAfter,
    Instant recordedAt
) {

    public enum Kind {
        PREMIUM_DEPOSIT,
        PAYOUT,
        WITHDRAWAL
    }
}
