package com.linkvault.sync.service;

import com.linkvault.sync.aggregator.AggregatorClient;
import com.linkvault.sync.aggregator.AggregatorException;
import com.linkvault.sync.concurrent.StripedLocks;
import com.linkvault.sync.config.LinkvaultProperties;
import com.linkvault.sync.connection.BankConnection;
import com.linkvault.sync.connection.ConnectionRegistry;
import com.linkvault.sync.connection.ConnectionStatus;
import com.linkvault.sync.model.AccountSnapshot;
import com.linkvault.sync.model.ConnectionFailure;
import com.linkvault.sync.model.ConsolidatedAccountsCache;
import com.linkvault.sync.model.InstitutionAccounts;
import com.linkvault.sync.security.CredentialException;
import com.linkvault.sync.storage.DocumentKeys;
import com.linkvault.sync.storage.StorageGateway;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Serves the consolidated accounts view. Reads come from the cached snapshot while it is younger than the TTL and
 * not marked stale; otherwise every live connection is fetched concurrently and the results are merged into a new
 * snapshot. Every write to the snapshot happens under a per-user lock.
 */
@Service
public class AccountSyncEngine {

    private static final Logger log = LoggerFactory.getLogger(AccountSyncEngine.class);

    private final ConnectionRegistry registry;
    private final AggregatorClient aggregator;
    private final StorageGateway storage;
    private final ConnectionFanOut fanOut;
    private final SyncTaskRegistry syncTasks;
    private final ConnectionFailureRecorder failures;
    private final Duration cacheTtl;
    private final Clock clock;
    private final SingleFlight<UUID, AccountsResult> refreshes = new SingleFlight<>();
    private final StripedLocks userLocks = new StripedLocks(32);

    @Autowired
    public AccountSyncEngine(
            ConnectionRegistry registry,
            AggregatorClient aggregator,
            StorageGateway storage,
            ConnectionFanOut fanOut,
            SyncTaskRegistry syncTasks,
            ConnectionFailureRecorder failures,
            LinkvaultProperties properties
    ) {
        this(registry, aggregator, storage, fanOut, syncTasks, failures, properties, Clock.systemUTC());
    }

    AccountSyncEngine(
            ConnectionRegistry registry,
            AggregatorClient aggregator,
            StorageGateway storage,
            ConnectionFanOut fanOut,
            SyncTaskRegistry syncTasks,
            ConnectionFailureRecorder failures,
            LinkvaultProperties properties,
            Clock clock
    ) {
        this.registry = registry;
        this.aggregator = aggregator;
        this.storage = storage;
        this.fanOut = fanOut;
        this.syncTasks = syncTasks;
        this.failures = failures;
        this.cacheTtl = properties.accounts().cacheTtl();
        this.clock = clock;
    }

    public AccountsResult getAccounts(UUID userId, boolean forceRefresh) {
        if (!forceRefresh) {
            Optional<ConsolidatedAccountsCache> cached = peekCache(userId);
            if (cached.isPresent() && isFresh(cached.get())) {
                log.debug("Serving cached accounts for user {}", userId);
                return new AccountsResult(cached.get(), true);
            }
        }
        return refreshes.execute(userId, () -> refresh(userId));
    }

    /**
     * Reads the stored snapshot without refreshing it.
     */
    public Optional<ConsolidatedAccountsCache> peekCache(UUID userId) {
        return storage.get(userId, DocumentKeys.ACCOUNTS_CACHE, ConsolidatedAccountsCache.class);
    }

    public AccountsDataInfo dataInfo(UUID userId) {
        Optional<ConsolidatedAccountsCache> cached = peekCache(userId);
        if (cached.isEmpty() || cached.get().lastUpdated() == null) {
            return AccountsDataInfo.none();
        }
        ConsolidatedAccountsCache cache = cached.get();
        Duration age = Duration.between(cache.lastUpdated(), clock.instant());
        double ageHours = BigDecimal.valueOf(age.toMillis())
                .divide(BigDecimal.valueOf(Duration.ofHours(1).toMillis()), 2, RoundingMode.HALF_UP)
                .doubleValue();
        return new AccountsDataInfo(true, cache.lastUpdated(), ageHours, cache.isExpired(clock.instant(), cacheTtl),
                cache.stale(), cache.accountCount(), cache.totalBalance());
    }

    /**
     * Forces the next read to refresh, for example after a new connection was linked.
     */
    public void markStale(UUID userId) {
        withUserLock(userId, () -> {
            peekCache(userId).ifPresent(cache -> storage.put(userId, DocumentKeys.ACCOUNTS_CACHE, cache.markStale()));
            return null;
        });
    }

    /**
     * Drops a revoked connection from the snapshot and recomputes the totals. No aggregator calls are made.
     */
    public void removeConnection(UUID userId, String connectionId) {
        withUserLock(userId, () -> {
            peekCache(userId).ifPresent(cache ->
                    storage.put(userId, DocumentKeys.ACCOUNTS_CACHE, cache.withoutConnection(connectionId)));
            return null;
        });
    }

    private boolean isFresh(ConsolidatedAccountsCache cache) {
        return !cache.stale() && !cache.isExpired(clock.instant(), cacheTtl);
    }

    private AccountsResult refresh(UUID userId) {
        List<BankConnection> connections = registry.liveConnections(userId);
        log.info("Refreshing accounts for user {} across {} connection(s)", userId, connections.size());
        List<ConnectionFanOut.Outcome<BankConnection, InstitutionAccounts>> outcomes =
                fanOut.run(connections, connection -> fetchInstitution(userId, connection));
        List<InstitutionAccounts> institutions = new ArrayList<>(outcomes.size());
        for (ConnectionFanOut.Outcome<BankConnection, InstitutionAccounts> outcome : outcomes) {
            if (outcome.succeeded()) {
                institutions.add(outcome.value());
            } else if (outcome.failure() instanceof SyncCancelledException) {
                log.debug("Account fetch for connection {} cancelled", outcome.item().connectionId());
            } else {
                throw outcome.failure();
            }
        }
        ConsolidatedAccountsCache merged = merge(userId, institutions);
        return new AccountsResult(merged, false);
    }

    private InstitutionAccounts fetchInstitution(UUID userId, BankConnection connection) {
        String connectionId = connection.connectionId();
        CancellationToken token = syncTasks.begin(userId, connectionId);
        try {
            token.throwIfCancelled();
            BankConnection current = registry.findConnection(userId, connectionId)
                    .filter(found -> !found.isRevoked())
                    .orElseThrow(() -> new SyncCancelledException("Connection " + connectionId + " was revoked"));
            registry.recordAccountSync(userId, connectionId, info -> info.syncing(clock.instant()));
            try {
                String secret = registry.openSecret(current);
                List<AccountSnapshot> accounts = aggregator.fetchBalances(secret);
                token.throwIfCancelled();
                registry.markActive(userId, connectionId);
                registry.recordAccountSync(userId, connectionId, info -> info.completed(clock.instant()));
                return new InstitutionAccounts(connectionId, connection.institutionId(), connection.institutionName(),
                        ConnectionStatus.ACTIVE, null,
                        accounts.stream().map(account -> account.attachTo(userId, connectionId)).toList());
            } catch (AggregatorException | CredentialException ex) {
                ConnectionFailure failure = failures.record(connection, SyncKind.ACCOUNTS, ex);
                return InstitutionAccounts.failed(connectionId, connection.institutionId(), connection.institutionName(),
                        failure.status(), failure.reason());
            }
        } finally {
            syncTasks.finish(userId, connectionId, token);
        }
    }

    private ConsolidatedAccountsCache merge(UUID userId, List<InstitutionAccounts> fetched) {
        return withUserLock(userId, () -> {
            // connections revoked while the fetch was running must not reappear
            Set<String> live = registry.liveConnections(userId).stream()
                    .map(BankConnection::connectionId)
                    .collect(Collectors.toSet());
            List<InstitutionAccounts> kept = fetched.stream()
                    .filter(institution -> live.contains(institution.connectionId()))
                    .toList();
            Set<String> merged = kept.stream().map(InstitutionAccounts::connectionId).collect(Collectors.toSet());
            boolean stale = !merged.containsAll(live);
            ConsolidatedAccountsCache cache = ConsolidatedAccountsCache.of(userId, kept, clock.instant(), stale);
            storage.put(userId, DocumentKeys.ACCOUNTS_CACHE, cache);
            log.info("Merged {} institution(s) for user {}: {} account(s), total {}",
                    kept.size(), userId, cache.accountCount(), cache.totalBalance());
            return cache;
        });
    }

    private <T> T withUserLock(UUID userId, Supplier<T> action) {
        return userLocks.withLock(userId, action);
    }
}
