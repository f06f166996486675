package com.linkvault.sync.model;

import static org.assertj.core.api.Assertions.assertThat;

import com.linkvault.sync.TestFixtures;
import com.linkvault.sync.connection.ConnectionStatus;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class ConsolidatedAccountsCacheTest {

    private static final Instant UPDATED = Instant.parse("2024-05-01T00:00:00Z");
    private final UUID owner = UUID.randomUUID();

    @Test
    void totalsCountOnlyHealthyInstitutions() {
        ConsolidatedAccountsCache cache = ConsolidatedAccountsCache.of(owner, List.of(
                healthy("a", TestFixtures.account("a1", "Checking", "100.005"), TestFixtures.account("a2", "Card", null)),
                InstitutionAccounts.failed("b", "ins_b", "Bank B", ConnectionStatus.LOGIN_REQUIRED, "login"),
                new InstitutionAccounts("c", "ins_c", "Bank C", ConnectionStatus.ACTIVE, "temporarily unavailable",
                        List.of(TestFixtures.account("c1", "Savings", "999.00")))
        ), UPDATED, false);

        assertThat(cache.totalBalance()).isEqualByComparingTo("100.01");
        assertThat(cache.accountCount()).isEqualTo(2);
        assertThat(cache.banksCount()).isEqualTo(3);
        assertThat(cache.hasPartialFailure()).isTrue();
    }

    @Test
    void expiresExactlyAtTtl() {
        ConsolidatedAccountsCache cache = ConsolidatedAccountsCache.empty(owner, UPDATED);
        Duration ttl = Duration.ofHours(24);

        assertThat(cache.isExpired(UPDATED.plus(ttl).minusMillis(1), ttl)).isFalse();
        assertThat(cache.isExpired(UPDATED.plus(ttl), ttl)).isTrue();
    }

    @Test
    void removingConnectionRecomputesTotalsAndKeepsTimestamp() {
        ConsolidatedAccountsCache cache = ConsolidatedAccountsCache.of(owner, List.of(
                healthy("a", TestFixtures.account("a1", "Checking", "10.00")),
                healthy("b", TestFixtures.account("b1", "Savings", "20.00"))
        ), UPDATED, false).markStale();

        ConsolidatedAccountsCache remaining = cache.withoutConnection("a");

        assertThat(remaining.totalBalance()).isEqualByComparingTo("20.00");
        assertThat(remaining.accountCount()).isEqualTo(1);
        assertThat(remaining.lastUpdated()).isEqualTo(UPDATED);
        assertThat(remaining.stale()).isTrue();
    }

    private static InstitutionAccounts healthy(String id, AccountSnapshot... accounts) {
        return new InstitutionAccounts(id, "ins_" + id, "Bank " + id, ConnectionStatus.ACTIVE, null, List.of(accounts));
    }
}
