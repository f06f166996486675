package com.linkvault.sync.model;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Derived per-owner view over every live connection. Totals are always recomputed from {@code institutions}
 * through {@link #of}, never patched in place.
 */
public record ConsolidatedAccountsCache(
        UUID ownerUserId,
        List<InstitutionAccounts> institutions,
        BigDecimal totalBalance,
        int accountCount,
        Instant lastUpdated,
        boolean stale
) {
    public ConsolidatedAccountsCache {
        institutions = institutions == null ? List.of() : List.copyOf(institutions);
    }

    public static ConsolidatedAccountsCache of(UUID ownerUserId, List<InstitutionAccounts> institutions,
                                               Instant lastUpdated, boolean stale) {
        BigDecimal total = institutions.stream()
                .map(InstitutionAccounts::currentTotal)
                .reduce(BigDecimal.ZERO, BigDecimal::add)
                .setScale(2, RoundingMode.HALF_UP);
        int count = institutions.stream().mapToInt(InstitutionAccounts::contributingAccountCount).sum();
        return new ConsolidatedAccountsCache(ownerUserId, institutions, total, count, lastUpdated, stale);
    }

    public static ConsolidatedAccountsCache empty(UUID ownerUserId, Instant now) {
        return of(ownerUserId, List.of(), now, false);
    }

    public ConsolidatedAccountsCache markStale() {
        return new ConsolidatedAccountsCache(ownerUserId, institutions, totalBalance, accountCount, lastUpdated, true);
    }

    public ConsolidatedAccountsCache withoutConnection(String connectionId) {
        List<InstitutionAccounts> remaining = institutions.stream()
                .filter(institution -> !institution.connectionId().equals(connectionId))
                .toList();
        return of(ownerUserId, remaining, lastUpdated, stale);
    }

    public boolean isExpired(Instant now, Duration ttl) {
        return lastUpdated == null || !now.isBefore(lastUpdated.plus(ttl));
    }

    public boolean hasPartialFailure() {
        return institutions.stream().anyMatch(institution -> !institution.contributesToTotals());
    }

    public int banksCount() {
        return institutions.size();
    }
}
