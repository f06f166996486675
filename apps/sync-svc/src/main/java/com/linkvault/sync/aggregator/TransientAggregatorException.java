package com.linkvault.sync.aggregator;

public class TransientAggregatorException extends AggregatorException {

    public TransientAggregatorException(String errorCode, String message) {
        super(errorCode, message);
    }

    public TransientAggregatorException(String errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }
}
