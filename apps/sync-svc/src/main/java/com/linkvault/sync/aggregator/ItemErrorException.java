package com.linkvault.sync.aggregator;

/**
 * Non-retryable failure tied to one item (invalid token, unsupported product, malformed request and the like).
 */
public class ItemErrorException extends AggregatorException {

    public ItemErrorException(String errorCode, String message) {
        super(errorCode, message);
    }
}
