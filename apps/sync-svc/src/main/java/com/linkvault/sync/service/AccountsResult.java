package com.linkvault.sync.service;

import com.linkvault.sync.model.ConnectionFailure;
import com.linkvault.sync.model.ConsolidatedAccountsCache;
import java.util.List;

/**
 * @param fromStored {@code true} when served from the cache without contacting the aggregator
 */
public record AccountsResult(ConsolidatedAccountsCache cache, boolean fromStored) {

    public List<ConnectionFailure> failures() {
        return cache.institutions().stream()
                .filter(institution -> !institution.contributesToTotals())
                .map(institution -> new ConnectionFailure(institution.connectionId(), institution.institutionName(),
                        institution.status(), institution.errorMessage()))
                .toList();
    }

    public boolean partialFailure() {
        return cache.hasPartialFailure();
    }
}
