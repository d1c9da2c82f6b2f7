package com.flightcover.error;

/**
 * Base exception for every rejected policy operation. A rejected operation
 * leaves all policy state unchanged.
 */
public abstract class PolicyException extends RuntimeException {

    private final ErrorKind kind;

    protected PolicyException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected PolicyException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
