package com.linkvault.sync.model;

import java.util.UUID;

/**
 * One account and its balances as reported by the aggregator. Owner and connection are stamped on by the
 * account sync once the snapshot is attributed to a linked connection.
 */
public record AccountSnapshot(
        UUID ownerUserId,
        String connectionId,
        String accountId,
        String name,
        String officialName,
        String type,
        String subtype,
        String mask,
        Balances balances
) {
    public AccountSnapshot attachTo(UUID owner, String connection) {
        return new AccountSnapshot(owner, connection, accountId, name, officialName, type, subtype, mask, balances);
    }
}
