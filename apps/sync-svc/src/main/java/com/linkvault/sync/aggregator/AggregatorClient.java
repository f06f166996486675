package com.linkvault.sync.aggregator;

import com.linkvault.sync.model.AccountSnapshot;
import java.util.List;
import java.util.UUID;

/**
 * Narrow view of the upstream financial-data aggregator. Implementations retry transient and rate-limited failures
 * themselves; whatever escapes is an {@link AggregatorException} the caller should attribute to one connection.
 */
public interface AggregatorClient {

    LinkToken createLinkToken(UUID userId);

    ExchangeResult exchangePublicToken(String publicToken);

    List<AccountSnapshot> fetchBalances(String rawSecret);

    /**
     * @param cursor position in the change feed, {@code null} for the start of history
     */
    TransactionsSyncPage syncTransactions(String rawSecret, String cursor);

    /**
     * Invalidates the item upstream so the secret can no longer be used.
     */
    void removeItem(String rawSecret);
}
