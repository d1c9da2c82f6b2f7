package com.flightcover.error;

public class SettlementFailureException extends PolicyException {

    public SettlementFailureException(String message) {
        super(ErrorKind.SETTLEMENT_FAILURE, message);
    }

    public SettlementFailureException(String message, Throwable cause) {
        super(ErrorKind.SETTLEMENT_FAILURE, message, cause);
    }
}
