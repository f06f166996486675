package com.linkvault.sync.aggregator;

/**
 * Failure reported by, or while talking to, the upstream aggregator. Messages never contain access secrets.
 */
public abstract class AggregatorException extends RuntimeException {

    private final String errorCode;

    protected AggregatorException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected AggregatorException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String errorCode() {
        return errorCode;
    }
}
