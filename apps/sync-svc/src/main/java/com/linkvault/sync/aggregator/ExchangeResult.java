package com.linkvault.sync.aggregator;

/**
 * Outcome of a public-token exchange. {@code rawSecret} must be sealed by the vault before it is stored anywhere.
 */
public record ExchangeResult(String rawSecret, String itemId, String institutionId, String institutionName) {

    @Override
    public String toString() {
        return "ExchangeResult[itemId=" + itemId + ", institutionId=" + institutionId
                + ", institutionName=" + institutionName + "]";
    }
}
