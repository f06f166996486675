package com.linkvault.sync.service;

import com.linkvault.sync.aggregator.AggregatorClient;
import com.linkvault.sync.aggregator.AggregatorException;
import com.linkvault.sync.config.LinkvaultProperties;
import com.linkvault.sync.connection.BankConnection;
import com.linkvault.sync.connection.ConnectionNotFoundException;
import com.linkvault.sync.connection.ConnectionRegistry;
import com.linkvault.sync.model.ConnectionFailure;
import com.linkvault.sync.model.TransactionRecord;
import com.linkvault.sync.security.CredentialException;
import com.linkvault.sync.storage.DocumentKeys;
import com.linkvault.sync.storage.StorageGateway;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Stops a connection's in-flight syncs, then removes it together with everything derived from it: its
 * transactions, its cursor and its share of the accounts snapshot.
 */
@Service
public class RevocationCoordinator {

    private static final Logger log = LoggerFactory.getLogger(RevocationCoordinator.class);

    private final ConnectionRegistry registry;
    private final AggregatorClient aggregator;
    private final StorageGateway storage;
    private final SyncTaskRegistry syncTasks;
    private final AccountSyncEngine accountSync;
    private final Duration revokeWaitTimeout;

    public RevocationCoordinator(
            ConnectionRegistry registry,
            AggregatorClient aggregator,
            StorageGateway storage,
            SyncTaskRegistry syncTasks,
            AccountSyncEngine accountSync,
            LinkvaultProperties properties
    ) {
        this.registry = registry;
        this.aggregator = aggregator;
        this.storage = storage;
        this.syncTasks = syncTasks;
        this.accountSync = accountSync;
        this.revokeWaitTimeout = properties.sync().revokeWaitTimeout();
    }

    /**
     * Revokes one connection. Revoking an already revoked connection succeeds without doing anything.
     *
     * @return {@code true} if this call revoked the connection
     * @throws ConnectionNotFoundException when the user never had the connection
     */
    public boolean revoke(UUID userId, String connectionId) {
        BankConnection connection = registry.findConnection(userId, connectionId)
                .orElseThrow(() -> new ConnectionNotFoundException(connectionId));
        if (connection.isRevoked()) {
            log.debug("Connection {} is already revoked", connectionId);
            return false;
        }
        if (!syncTasks.cancelAndAwait(userId, connectionId, revokeWaitTimeout)) {
            log.warn("Sync of connection {} did not stop within {}; revoking anyway", connectionId, revokeWaitTimeout);
        }
        String secret;
        List<String> transactionKeys;
        boolean revoked;
        try {
            secret = openSecretQuietly(connection);
            transactionKeys = storage.query(userId, DocumentKeys.TRANSACTION, TransactionRecord.class,
                            record -> connectionId.equals(record.connectionId()))
                    .stream()
                    .map(record -> DocumentKeys.transaction(record.transactionId()))
                    .toList();
            revoked = registry.revoke(userId, connectionId, batch -> {
                transactionKeys.forEach(batch::delete);
                batch.delete(DocumentKeys.cursor(connectionId));
            });
        } finally {
            // syncs re-check the connection's status once started, so the gate is only needed while revoking
            syncTasks.reopen(userId, connectionId);
        }
        if (!revoked) {
            return false;
        }
        accountSync.removeConnection(userId, connectionId);
        log.info("Removed {} transaction(s) of revoked connection {}", transactionKeys.size(), connectionId);
        if (secret != null) {
            removeRemoteItem(connectionId, secret);
        }
        return true;
    }

    /**
     * Revokes each listed connection independently. Failures are reported, never thrown.
     */
    public RevocationReport revokeMany(UUID userId, List<String> connectionIds) {
        int successCount = 0;
        List<ConnectionFailure> failures = new ArrayList<>();
        for (String connectionId : new LinkedHashSet<>(connectionIds)) {
            try {
                if (revoke(userId, connectionId)) {
                    successCount++;
                }
            } catch (ConnectionNotFoundException ex) {
                failures.add(new ConnectionFailure(connectionId, null, null, "connection not found"));
            } catch (RuntimeException ex) {
                log.error("Revocation of connection {} failed", connectionId, ex);
                String institution = registry.findConnection(userId, connectionId)
                        .map(BankConnection::institutionName)
                        .orElse(null);
                failures.add(new ConnectionFailure(connectionId, institution, null, "revocation failed: " + ex.getMessage()));
            }
        }
        log.info("Revoked {} connection(s) for user {}, {} failure(s)", successCount, userId, failures.size());
        return new RevocationReport(successCount, failures);
    }

    public RevocationReport revokeAll(UUID userId) {
        List<String> connectionIds = registry.liveConnections(userId).stream()
                .map(BankConnection::connectionId)
                .toList();
        return revokeMany(userId, connectionIds);
    }

    private String openSecretQuietly(BankConnection connection) {
        try {
            return registry.openSecret(connection);
        } catch (CredentialException ex) {
            log.warn("Skipping remote removal of connection {}: credential unreadable", connection.connectionId());
            return null;
        }
    }

    private void removeRemoteItem(String connectionId, String secret) {
        try {
            aggregator.removeItem(secret);
        } catch (AggregatorException ex) {
            log.warn("Aggregator could not remove item {} ({}); local data already deleted", connectionId, ex.errorCode());
        }
    }
}
