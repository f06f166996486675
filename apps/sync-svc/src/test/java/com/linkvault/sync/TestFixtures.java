package com.linkvault.sync;

import com.linkvault.sync.config.LinkvaultProperties;
import com.linkvault.sync.model.AccountSnapshot;
import com.linkvault.sync.model.Balances;
import com.linkvault.sync.model.TransactionRecord;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

public final class TestFixtures {

    public static final String KEY_1 = "MDEyMzQ1Njc4OWFiY2RlZjAxMjM0NTY3ODlhYmNkZWY=";
    public static final String KEY_2 = "ZmVkY2JhOTg3NjU0MzIxMGZlZGNiYTk4NzY1NDMyMTA=";

    private TestFixtures() {
    }

    public static LinkvaultProperties properties() {
        return properties("http://127.0.0.1:9", Duration.ofHours(24), 4, 50);
    }

    public static LinkvaultProperties properties(Duration cacheTtl, int maxConcurrency, int maxIterations) {
        return properties("http://127.0.0.1:9", cacheTtl, maxConcurrency, maxIterations);
    }

    public static LinkvaultProperties properties(String plaidBaseUrl, Duration cacheTtl, int maxConcurrency, int maxIterations) {
        return new LinkvaultProperties(
                new LinkvaultProperties.Plaid("client-id", "client-secret", "sandbox", plaidBaseUrl, null, null, null,
                        2, Duration.ofMillis(5), Duration.ofSeconds(5)),
                new LinkvaultProperties.Vault("k1", Map.of("k1", KEY_1)),
                new LinkvaultProperties.Accounts(cacheTtl),
                new LinkvaultProperties.Sync(maxConcurrency, maxIterations, Duration.ofSeconds(2)),
                new LinkvaultProperties.Security(null)
        );
    }

    public static AccountSnapshot account(String accountId, String name, String current) {
        return new AccountSnapshot(null, null, accountId, name, null, "depository", "checking", "0000",
                new Balances(null, current == null ? null : new BigDecimal(current), null, "USD"));
    }

    public static TransactionRecord transaction(String transactionId, String accountId, String amount, LocalDate date, boolean pending) {
        return new TransactionRecord(transactionId, null, accountId, new BigDecimal(amount), "USD", date, null, pending,
                "Purchase " + transactionId, List.of("Shops"), "Merchant", null, null);
    }
}
