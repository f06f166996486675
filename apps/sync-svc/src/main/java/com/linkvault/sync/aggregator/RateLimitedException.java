package com.linkvault.sync.aggregator;

public class RateLimitedException extends AggregatorException {

    public RateLimitedException(String errorCode, String message) {
        super(errorCode, message);
    }
}
