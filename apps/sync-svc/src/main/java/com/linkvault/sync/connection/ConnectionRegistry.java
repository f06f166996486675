package com.linkvault.sync.connection;

import com.linkvault.sync.concurrent.StripedLocks;
import com.linkvault.sync.model.SyncInfo;
import com.linkvault.sync.security.CredentialException;
import com.linkvault.sync.security.CredentialVault;
import com.linkvault.sync.storage.DocumentKeys;
import com.linkvault.sync.storage.StorageBatch;
import com.linkvault.sync.storage.StorageGateway;
import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Owns every {@link BankConnection}. All mutations of a single connection are serialized and none of them can
 * bring a revoked connection back to life.
 */
@Service
public class ConnectionRegistry {

    private static final Logger log = LoggerFactory.getLogger(ConnectionRegistry.class);

    private final StorageGateway storage;
    private final CredentialVault vault;
    private final Clock clock;
    private final StripedLocks connectionLocks = new StripedLocks(64);
    private final StripedLocks createLocks = new StripedLocks(16);

    @Autowired
    public ConnectionRegistry(StorageGateway storage, CredentialVault vault) {
        this(storage, vault, Clock.systemUTC());
    }

    public ConnectionRegistry(StorageGateway storage, CredentialVault vault, Clock clock) {
        this.storage = storage;
        this.vault = vault;
        this.clock = clock;
    }

    public String createConnection(UUID userId, InstitutionInfo institution, String rawSecret) {
        if (rawSecret == null || rawSecret.isBlank()) {
            throw new IllegalArgumentException("access secret must be provided");
        }
        String fingerprint = institution.fingerprint();
        ReentrantLock lock = createLocks.lockFor(userId);
        lock.lock();
        try {
            for (BankConnection existing : liveConnections(userId)) {
                if (existing.connectionId().equals(institution.itemId()) || existing.fingerprint().equals(fingerprint)) {
                    throw new DuplicateConnectionException(existing.connectionId(), institution.institutionName());
                }
            }
            Instant now = clock.instant();
            BankConnection connection = new BankConnection(
                    institution.itemId(),
                    userId,
                    institution.institutionId(),
                    institution.institutionName(),
                    fingerprint,
                    vault.encrypt(rawSecret),
                    ConnectionStatus.ACTIVE,
                    null,
                    now,
                    now,
                    SyncInfo.never(),
                    SyncInfo.never()
            );
            storage.put(userId, DocumentKeys.connection(connection.connectionId()), connection);
            log.info("Linked connection {} ({}) for user {}", connection.connectionId(), connection.institutionId(), userId);
            return connection.connectionId();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Non-revoked connections, oldest first. The returned views never carry secrets.
     */
    public List<ConnectionView> listConnections(UUID userId) {
        return liveConnections(userId).stream().map(BankConnection::toView).toList();
    }

    /**
     * Non-revoked connections with their sealed secret, for the sync engines.
     */
    public List<BankConnection> liveConnections(UUID userId) {
        return storage.query(userId, DocumentKeys.CONNECTION, BankConnection.class, connection -> !connection.isRevoked())
                .stream()
                .sorted(Comparator.comparing(BankConnection::createdAt, Comparator.nullsLast(Comparator.naturalOrder()))
                        .thenComparing(BankConnection::connectionId))
                .toList();
    }

    public Optional<BankConnection> findConnection(UUID userId, String connectionId) {
        return storage.get(userId, DocumentKeys.connection(connectionId), BankConnection.class);
    }

    /**
     * @throws ConnectionNotFoundException when the connection is unknown or revoked
     */
    public BankConnection requireLiveConnection(UUID userId, String connectionId) {
        return findConnection(userId, connectionId)
                .filter(connection -> !connection.isRevoked())
                .orElseThrow(() -> new ConnectionNotFoundException(connectionId));
    }

    /**
     * Opens the sealed secret. A connection whose secret cannot be opened is unusable, so it is moved to
     * {@link ConnectionStatus#ERROR} before the failure is rethrown.
     */
    public String openSecret(BankConnection connection) {
        try {
            return vault.decrypt(connection.encryptedSecret());
        } catch (CredentialException ex) {
            log.warn("Credential for connection {} could not be opened", connection.connectionId());
            markError(connection.ownerUserId(), connection.connectionId(), "stored credential could not be decrypted");
            throw ex;
        }
    }

    public void markLoginRequired(UUID userId, String connectionId, String reason) {
        update(userId, connectionId, connection -> connection.withStatus(ConnectionStatus.LOGIN_REQUIRED, reason));
    }

    public void markError(UUID userId, String connectionId, String reason) {
        update(userId, connectionId, connection -> connection.withStatus(ConnectionStatus.ERROR, reason));
    }

    /**
     * Records a successful round trip with the aggregator; clears any earlier login or error state.
     */
    public void markActive(UUID userId, String connectionId) {
        Instant now = clock.instant();
        update(userId, connectionId, connection -> connection.withStatus(ConnectionStatus.ACTIVE, null).usedAt(now));
    }

    public void recordAccountSync(UUID userId, String connectionId, UnaryOperator<SyncInfo> change) {
        update(userId, connectionId, connection -> connection.withAccountSync(change.apply(connection.accountSync())));
    }

    public void recordTransactionSync(UUID userId, String connectionId, UnaryOperator<SyncInfo> change) {
        update(userId, connectionId, connection -> connection.withTransactionSync(change.apply(connection.transactionSync())));
    }

    /**
     * Soft-deletes the connection: status becomes revoked and the sealed secret is wiped. {@code cascade} adds the
     * derived-state deletions, which are applied in the same atomic batch.
     *
     * @return {@code false} when the connection was already revoked (nothing is written)
     * @throws ConnectionNotFoundException when the connection never existed
     */
    public boolean revoke(UUID userId, String connectionId, Consumer<StorageBatch.Builder> cascade) {
        ReentrantLock lock = lockFor(userId, connectionId);
        lock.lock();
        try {
            BankConnection connection = findConnection(userId, connectionId)
                    .orElseThrow(() -> new ConnectionNotFoundException(connectionId));
            if (connection.isRevoked()) {
                log.debug("Connection {} already revoked", connectionId);
                return false;
            }
            StorageBatch.Builder batch = StorageBatch.builder()
                    .put(DocumentKeys.connection(connectionId), connection.revoked(clock.instant()));
            cascade.accept(batch);
            storage.apply(userId, batch.build());
            log.info("Revoked connection {} for user {}", connectionId, userId);
            return true;
        } finally {
            lock.unlock();
        }
    }

    private void update(UUID userId, String connectionId, UnaryOperator<BankConnection> change) {
        ReentrantLock lock = lockFor(userId, connectionId);
        lock.lock();
        try {
            Optional<BankConnection> current = findConnection(userId, connectionId);
            if (current.isEmpty() || current.get().isRevoked()) {
                log.debug("Skipping update of missing or revoked connection {}", connectionId);
                return;
            }
            storage.put(userId, DocumentKeys.connection(connectionId), change.apply(current.get()));
        } finally {
            lock.unlock();
        }
    }

    private ReentrantLock lockFor(UUID userId, String connectionId) {
        return connectionLocks.lockFor(userId + "/" + connectionId);
    }
}
