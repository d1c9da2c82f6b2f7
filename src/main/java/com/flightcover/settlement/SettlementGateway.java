package com.flightcover.settlement;

/**
 * External ledger that moves funds on behalf of the policy book.
 *
 * Both calls may fail, either by returning a failed {@link SettlementResult}
 * or by throwing. A payout instruction's reference is an idempotency key:
 * re-submitting a reference that already settled must return the original
 * receipt without moving funds again.
 */
public interface SettlementGateway {

    /** Transfers {@code instruction.amount()} to {@code instruction.holder()}. */
    SettlementResult payout(PayoutInstruction instruction);

    /** Transfers the whole free balance to {@code destination}. */
    SettlementResult withdrawAll(String destination);
}
