package com.linkvault.sync.service;

import com.linkvault.sync.aggregator.AggregatorClient;
import com.linkvault.sync.aggregator.TransactionsSyncPage;
import com.linkvault.sync.concurrent.StripedLocks;
import com.linkvault.sync.config.LinkvaultProperties;
import com.linkvault.sync.connection.BankConnection;
import com.linkvault.sync.connection.ConnectionRegistry;
import com.linkvault.sync.connection.ConnectionView;
import com.linkvault.sync.model.ConnectionFailure;
import com.linkvault.sync.model.SyncCursor;
import com.linkvault.sync.model.SyncInfo;
import com.linkvault.sync.model.TransactionRecord;
import com.linkvault.sync.storage.DocumentKeys;
import com.linkvault.sync.storage.StorageBatch;
import com.linkvault.sync.storage.StorageException;
import com.linkvault.sync.storage.StorageGateway;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Cursor-based incremental transaction sync. Each page of added, modified and removed transactions is written
 * together with the advanced cursor in one atomic batch, so a failed write leaves the cursor where it was and the
 * next sync replays the same page. Syncs of one connection never overlap.
 */
@Service
public class TransactionSyncEngine {

    private static final Logger log = LoggerFactory.getLogger(TransactionSyncEngine.class);

    private final ConnectionRegistry registry;
    private final AggregatorClient aggregator;
    private final StorageGateway storage;
    private final ConnectionFanOut fanOut;
    private final SyncTaskRegistry syncTasks;
    private final ConnectionFailureRecorder failures;
    private final Executor executor;
    private final int maxIterations;
    private final Clock clock;
    private final StripedLocks connectionLocks = new StripedLocks(64);

    @Autowired
    public TransactionSyncEngine(
            ConnectionRegistry registry,
            AggregatorClient aggregator,
            StorageGateway storage,
            ConnectionFanOut fanOut,
            SyncTaskRegistry syncTasks,
            ConnectionFailureRecorder failures,
            @Qualifier("syncExecutor") Executor executor,
            LinkvaultProperties properties
    ) {
        this(registry, aggregator, storage, fanOut, syncTasks, failures, executor, properties, Clock.systemUTC());
    }

    TransactionSyncEngine(
            ConnectionRegistry registry,
            AggregatorClient aggregator,
            StorageGateway storage,
            ConnectionFanOut fanOut,
            SyncTaskRegistry syncTasks,
            ConnectionFailureRecorder failures,
            Executor executor,
            LinkvaultProperties properties,
            Clock clock
    ) {
        this.registry = registry;
        this.aggregator = aggregator;
        this.storage = storage;
        this.fanOut = fanOut;
        this.syncTasks = syncTasks;
        this.failures = failures;
        this.executor = executor;
        this.maxIterations = properties.sync().maxIterations();
        this.clock = clock;
    }

    /**
     * Pulls every change since the stored cursor, or from the start of history when there is none.
     */
    public SyncResult sync(UUID userId, String connectionId) {
        BankConnection connection = registry.requireLiveConnection(userId, connectionId);
        return runTracked(connection, false);
    }

    /**
     * Deletes the connection's transactions and cursor, then syncs from the start of history. Destructive; only
     * ever invoked on explicit user request.
     */
    public SyncResult forceFullResync(UUID userId, String connectionId) {
        BankConnection connection = registry.requireLiveConnection(userId, connectionId);
        return runTracked(connection, true);
    }

    /**
     * Schedules {@link #forceFullResync} on the sync executor and returns immediately. Progress is visible through
     * the connection's transaction sync record.
     */
    public ConnectionView startFullResync(UUID userId, String connectionId) {
        return schedule(userId, connectionId, true);
    }

    /**
     * Schedules the first incremental sync of a freshly linked connection.
     */
    public ConnectionView startInitialSync(UUID userId, String connectionId) {
        return schedule(userId, connectionId, false);
    }

    /**
     * Syncs every live connection with bounded concurrency. Connection failures are collected, not thrown.
     *
     * @throws StorageException when results could not be persisted for some connection
     */
    public SyncAllResult syncAll(UUID userId) {
        List<BankConnection> connections = registry.liveConnections(userId);
        List<ConnectionFanOut.Outcome<BankConnection, SyncResult>> outcomes =
                fanOut.run(connections, connection -> runTracked(connection, false));
        List<SyncResult> results = new ArrayList<>();
        List<ConnectionFailure> failed = new ArrayList<>();
        StorageException storageFailure = null;
        for (ConnectionFanOut.Outcome<BankConnection, SyncResult> outcome : outcomes) {
            RuntimeException failure = outcome.failure();
            if (outcome.succeeded()) {
                results.add(outcome.value());
            } else if (ConnectionFailureRecorder.isConnectionFailure(failure)) {
                failed.add(failures.describe(outcome.item(), failure));
            } else if (failure instanceof SyncCancelledException) {
                log.debug("Transaction sync of connection {} cancelled", outcome.item().connectionId());
            } else if (failure instanceof StorageException storageError) {
                if (storageFailure == null) {
                    storageFailure = storageError;
                }
            } else {
                throw failure;
            }
        }
        if (storageFailure != null) {
            throw storageFailure;
        }
        log.info("Synced transactions for user {}: {} succeeded, {} failed", userId, results.size(), failed.size());
        return new SyncAllResult(results, failed);
    }

    private ConnectionView schedule(UUID userId, String connectionId, boolean fromScratch) {
        BankConnection connection = registry.requireLiveConnection(userId, connectionId);
        registry.recordTransactionSync(userId, connectionId, info -> SyncInfo.pending(clock.instant()));
        executor.execute(() -> {
            try {
                SyncResult result = runTracked(connection, fromScratch);
                log.info("Background {} of connection {} finished: {} change(s)",
                        fromScratch ? "resync" : "sync", connectionId, result.totalProcessed());
            } catch (RuntimeException ex) {
                log.warn("Background {} of connection {} failed: {}",
                        fromScratch ? "resync" : "sync", connectionId, ex.getMessage());
            }
        });
        return registry.findConnection(userId, connectionId).map(BankConnection::toView).orElseGet(connection::toView);
    }

    private SyncResult runTracked(BankConnection connection, boolean fromScratch) {
        UUID userId = connection.ownerUserId();
        String connectionId = connection.connectionId();
        CancellationToken token = syncTasks.begin(userId, connectionId);
        ReentrantLock lock = connectionLocks.lockFor(userId + "/" + connectionId);
        lock.lock();
        try {
            token.throwIfCancelled();
            // the connection may have been revoked between lookup and start
            BankConnection current = registry.findConnection(userId, connectionId)
                    .filter(found -> !found.isRevoked())
                    .orElseThrow(() -> new SyncCancelledException("Connection " + connectionId + " was revoked"));
            registry.recordTransactionSync(userId, connectionId, info -> info.syncing(clock.instant()));
            try {
                if (fromScratch) {
                    clearTransactions(current);
                }
                SyncResult result = pullChanges(current, token, fromScratch);
                registry.markActive(userId, connectionId);
                registry.recordTransactionSync(userId, connectionId, info -> info.completed(clock.instant()));
                return result;
            } catch (RuntimeException ex) {
                recordFailure(connection, ex);
                throw ex;
            }
        } finally {
            lock.unlock();
            syncTasks.finish(userId, connectionId, token);
        }
    }

    private SyncResult pullChanges(BankConnection connection, CancellationToken token, boolean fromScratch) {
        UUID userId = connection.ownerUserId();
        String connectionId = connection.connectionId();
        String secret = registry.openSecret(connection);
        String cursor = fromScratch ? null : storage.get(userId, DocumentKeys.cursor(connectionId), SyncCursor.class)
                .map(SyncCursor::cursorToken)
                .orElse(null);
        int added = 0;
        int modified = 0;
        int removed = 0;
        int pages = 0;
        boolean hasMore = true;
        while (hasMore && pages < maxIterations) {
            token.throwIfCancelled();
            TransactionsSyncPage page = aggregator.syncTransactions(secret, cursor);
            token.throwIfCancelled();
            applyPage(connection, page);
            added += page.added().size();
            modified += page.modified().size();
            removed += page.removedTransactionIds().size();
            if (page.nextCursor() != null) {
                cursor = page.nextCursor();
            }
            hasMore = page.hasMore();
            pages++;
        }
        if (hasMore) {
            log.warn("Transaction sync of connection {} stopped after {} page(s) with more changes pending", connectionId, pages);
        }
        log.info("Synced connection {}: {} added, {} modified, {} removed over {} page(s)",
                connectionId, added, modified, removed, pages);
        return new SyncResult(connectionId, connection.institutionName(), added, modified, removed, hasMore, pages);
    }

    /**
     * Writes one page and the cursor that follows it as a single unit, in the order the aggregator reported them.
     */
    private void applyPage(BankConnection connection, TransactionsSyncPage page) {
        String connectionId = connection.connectionId();
        StorageBatch.Builder batch = StorageBatch.builder();
        for (TransactionRecord record : page.added()) {
            batch.put(DocumentKeys.transaction(record.transactionId()), record.attachTo(connectionId));
        }
        for (TransactionRecord record : page.modified()) {
            batch.put(DocumentKeys.transaction(record.transactionId()), record.attachTo(connectionId));
        }
        for (String transactionId : page.removedTransactionIds()) {
            batch.delete(DocumentKeys.transaction(transactionId));
        }
        if (page.nextCursor() != null) {
            batch.put(DocumentKeys.cursor(connectionId), new SyncCursor(connectionId, page.nextCursor(), clock.instant()));
        }
        StorageBatch operations = batch.build();
        if (!operations.isEmpty()) {
            storage.apply(connection.ownerUserId(), operations);
        }
    }

    private void clearTransactions(BankConnection connection) {
        UUID userId = connection.ownerUserId();
        String connectionId = connection.connectionId();
        StorageBatch.Builder batch = StorageBatch.builder();
        List<TransactionRecord> existing = storage.query(userId, DocumentKeys.TRANSACTION, TransactionRecord.class,
                record -> connectionId.equals(record.connectionId()));
        existing.forEach(record -> batch.delete(DocumentKeys.transaction(record.transactionId())));
        batch.delete(DocumentKeys.cursor(connectionId));
        storage.apply(userId, batch.build());
        log.info("Cleared {} transaction(s) and the cursor of connection {}", existing.size(), connectionId);
    }

    private void recordFailure(BankConnection connection, RuntimeException failure) {
        if (ConnectionFailureRecorder.isConnectionFailure(failure)) {
            failures.record(connection, SyncKind.TRANSACTIONS, failure);
            return;
        }
        if (failure instanceof StorageException) {
            log.error("Could not persist transactions of connection {}", connection.connectionId(), failure);
        }
        String reason = failure instanceof SyncCancelledException ? "sync cancelled" : "sync could not be completed";
        try {
            failures.recordSyncFailure(connection, SyncKind.TRANSACTIONS, reason);
        } catch (StorageException bookkeeping) {
            log.warn("Could not record failed sync of connection {}: {}", connection.connectionId(), bookkeeping.getMessage());
        }
    }
}
