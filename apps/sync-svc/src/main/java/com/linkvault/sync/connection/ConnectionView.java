package com.linkvault.sync.connection;

import com.linkvault.sync.model.SyncInfo;
import java.time.Instant;

/**
 * Caller-facing projection of a {@link BankConnection}; carries no secret material.
 */
public record ConnectionView(
        String connectionId,
        String institutionId,
        String institutionName,
        ConnectionStatus status,
        String statusReason,
        Instant createdAt,
        Instant lastUsedAt,
        SyncInfo accountSync,
        SyncInfo transactionSync
) {
}
