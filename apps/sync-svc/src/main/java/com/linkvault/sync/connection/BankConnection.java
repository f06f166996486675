package com.linkvault.sync.connection;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.linkvault.sync.model.SyncInfo;
import java.time.Instant;
import java.util.UUID;

/**
 * Persisted form of one linked institution. The secret is only ever held sealed; revocation wipes it.
 */
public record BankConnection(
        String connectionId,
        UUID ownerUserId,
        String institutionId,
        String institutionName,
        String fingerprint,
        String encryptedSecret,
        ConnectionStatus status,
        String statusReason,
        Instant createdAt,
        Instant lastUsedAt,
        SyncInfo accountSync,
        SyncInfo transactionSync
) {
    public BankConnection {
        accountSync = accountSync == null ? SyncInfo.never() : accountSync;
        transactionSync = transactionSync == null ? SyncInfo.never() : transactionSync;
    }

    @JsonIgnore
    public boolean isRevoked() {
        return status == ConnectionStatus.REVOKED;
    }

    public BankConnection withStatus(ConnectionStatus newStatus, String reason) {
        return new BankConnection(connectionId, ownerUserId, institutionId, institutionName, fingerprint,
                encryptedSecret, newStatus, reason, createdAt, lastUsedAt, accountSync, transactionSync);
    }

    public BankConnection usedAt(Instant when) {
        return new BankConnection(connectionId, ownerUserId, institutionId, institutionName, fingerprint,
                encryptedSecret, status, statusReason, createdAt, when, accountSync, transactionSync);
    }

    public BankConnection withAccountSync(SyncInfo info) {
        return new BankConnection(connectionId, ownerUserId, institutionId, institutionName, fingerprint,
                encryptedSecret, status, statusReason, createdAt, lastUsedAt, info, transactionSync);
    }

    public BankConnection withTransactionSync(SyncInfo info) {
        return new BankConnection(connectionId, ownerUserId, institutionId, institutionName, fingerprint,
                encryptedSecret, status, statusReason, createdAt, lastUsedAt, accountSync, info);
    }

    public BankConnection revoked(Instant when) {
        return new BankConnection(connectionId, ownerUserId, institutionId, institutionName, fingerprint,
                null, ConnectionStatus.REVOKED, "revoked by owner", createdAt, when, accountSync, transactionSync);
    }

    public ConnectionView toView() {
        return new ConnectionView(connectionId, institutionId, institutionName, status, statusReason, createdAt,
                lastUsedAt, accountSync, transactionSync);
    }
}
