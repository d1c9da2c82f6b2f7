package com.flightcover.error;

public class UnauthorizedException extends PolicyException {

    public UnauthorizedException(String callerId, String operation) {
        super(ErrorKind.UNAUTHORIZED, "caller '" + callerId + "' is not allowed to " + operation);
    }
}
