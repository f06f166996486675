package com.linkvault.sync.aggregator;

/**
 * The institution wants the user to re-authenticate. Recoverable only by the user relinking.
 */
public class ItemLoginRequiredException extends AggregatorException {

    public ItemLoginRequiredException(String errorCode, String message) {
        super(errorCode, message);
    }
}
