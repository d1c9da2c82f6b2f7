package com.flightcover.settlement;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.math.BigDecimal;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SettlementResult(
    boolean success,
    String reference,
    BigDecimal amount,
    String failureReason
) {

    public static SettlementResult succeeded(String reference, BigDecimal amount) {
        return new SettlementResult(true, reference, amount, null);
    }

    public static SettlementResult failed(String reference, String reason) {
        return new SettlementResult(false, reference, BigDecimal.ZERO, reason);
    }
}
