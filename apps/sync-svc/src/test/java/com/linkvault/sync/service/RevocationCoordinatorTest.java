package com.linkvault.sync.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.linkvault.sync.TestFixtures;
import com.linkvault.sync.aggregator.AggregatorClient;
import com.linkvault.sync.aggregator.TransactionsSyncPage;
import com.linkvault.sync.aggregator.TransientAggregatorException;
import com.linkvault.sync.connection.ConnectionNotFoundException;
import com.linkvault.sync.connection.ConnectionStatus;
import com.linkvault.sync.model.ConsolidatedAccountsCache;
import com.linkvault.sync.model.InstitutionAccounts;
import com.linkvault.sync.model.TransactionRecord;
import com.linkvault.sync.storage.DocumentKeys;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

class RevocationCoordinatorTest {

    @Mock
    private AggregatorClient aggregator;

    private ExecutorService executor;
    private SyncHarness harness;
    private RevocationCoordinator coordinator;
    private final UUID userId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        executor = Executors.newFixedThreadPool(4);
        harness = new SyncHarness(aggregator, TestFixtures.properties(), executor);
        coordinator = harness.revocation;
        harness.link(userId, "a", "Bank A");
        harness.link(userId, "b", "Bank B");
        when(aggregator.fetchBalances("access-a")).thenReturn(List.of(TestFixtures.account("a1", "Checking", "100.00")));
        when(aggregator.fetchBalances("access-b")).thenReturn(List.of(TestFixtures.account("b1", "Savings", "50.00")));
        when(aggregator.syncTransactions("access-a", null)).thenReturn(page("ta-1", "ta-2"));
        when(aggregator.syncTransactions("access-b", null)).thenReturn(page("tb-1"));
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void revokeCascadesToDerivedState() {
        harness.transactionSync.syncAll(userId);
        harness.accountSync.getAccounts(userId, false);

        boolean revoked = coordinator.revoke(userId, "a");

        assertThat(revoked).isTrue();
        assertThat(harness.registry.findConnection(userId, "a").orElseThrow().status()).isEqualTo(ConnectionStatus.REVOKED);
        assertThat(harness.registry.findConnection(userId, "a").orElseThrow().encryptedSecret()).isNull();
        assertThat(transactions()).extracting(TransactionRecord::transactionId).containsExactly("tb-1");
        assertThat(harness.storage.get(userId, DocumentKeys.cursor("a"), Object.class)).isEmpty();
        assertThat(harness.storage.get(userId, DocumentKeys.cursor("b"), Object.class)).isPresent();

        ConsolidatedAccountsCache cache = harness.accountSync.peekCache(userId).orElseThrow();
        assertThat(cache.institutions()).extracting(InstitutionAccounts::connectionId).containsExactly("b");
        assertThat(cache.totalBalance()).isEqualByComparingTo("50.00");
        verify(aggregator).removeItem("access-a");
        verify(aggregator, never()).removeItem("access-b");
    }

    @Test
    void revokingTwiceIsANoOp() {
        assertThat(coordinator.revoke(userId, "a")).isTrue();
        assertThat(coordinator.revoke(userId, "a")).isFalse();

        verify(aggregator, times(1)).removeItem(anyString());
        assertThatThrownBy(() -> coordinator.revoke(userId, "never-linked")).isInstanceOf(ConnectionNotFoundException.class);
    }

    @Test
    void revokeAllTwiceReportsNothingTheSecondTime() {
        RevocationReport first = coordinator.revokeAll(userId);
        RevocationReport second = coordinator.revokeAll(userId);

        assertThat(first.successCount()).isEqualTo(2);
        assertThat(first.failures()).isEmpty();
        assertThat(second.successCount()).isZero();
        assertThat(second.failures()).isEmpty();
        assertThat(harness.registry.listConnections(userId)).isEmpty();
    }

    @Test
    void revokeManyReportsUnknownIdsAndSkipsDuplicates() {
        RevocationReport report = coordinator.revokeMany(userId, List.of("a", "a", "ghost"));

        assertThat(report.successCount()).isEqualTo(1);
        assertThat(report.failures()).singleElement().satisfies(failure -> {
            assertThat(failure.connectionId()).isEqualTo("ghost");
            assertThat(failure.reason()).isEqualTo("connection not found");
        });
        assertThat(harness.registry.listConnections(userId)).hasSize(1);
    }

    @Test
    void remoteRemovalFailureDoesNotBlockLocalRevocation() {
        harness.transactionSync.sync(userId, "a");
        doThrow(new TransientAggregatorException("INSTITUTION_DOWN", "down")).when(aggregator).removeItem("access-a");

        assertThat(coordinator.revoke(userId, "a")).isTrue();

        assertThat(transactions()).isEmpty();
        assertThat(harness.registry.listConnections(userId)).hasSize(1);
    }

    @Test
    void failedRevocationLeavesConnectionFullyUsable() {
        harness.storage.failBatchesMatching(batch -> true);

        RevocationReport report = coordinator.revokeMany(userId, List.of("a"));

        assertThat(report.successCount()).isZero();
        assertThat(report.failures()).singleElement().satisfies(failure -> {
            assertThat(failure.connectionId()).isEqualTo("a");
            assertThat(failure.reason()).contains("simulated storage outage");
        });
        assertThat(harness.registry.findConnection(userId, "a").orElseThrow().status()).isEqualTo(ConnectionStatus.ACTIVE);

        harness.storage.stopFailing();

        SyncResult sync = harness.transactionSync.sync(userId, "a");
        ConsolidatedAccountsCache cache = harness.accountSync.getAccounts(userId, true).cache();

        assertThat(sync.added()).isEqualTo(2);
        assertThat(cache.institutions()).extracting(InstitutionAccounts::connectionId).containsExactly("a", "b");
        assertThat(cache.accountCount()).isEqualTo(2);
        assertThat(cache.totalBalance()).isEqualByComparingTo("150.00");
        assertThat(cache.stale()).isFalse();
    }

    @Test
    void revokeWaitsForRunningSyncAndLeavesNothingBehind() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(aggregator.syncTransactions("access-a", null)).thenAnswer(invocation -> {
            entered.countDown();
            release.await(5, TimeUnit.SECONDS);
            return page("ta-late");
        });

        ExecutorService callers = Executors.newFixedThreadPool(2);
        try {
            Future<?> sync = callers.submit(() -> harness.transactionSync.sync(userId, "a"));
            assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();
            Future<Boolean> revoke = callers.submit(() -> coordinator.revoke(userId, "a"));
            release.countDown();

            assertThat(revoke.get(5, TimeUnit.SECONDS)).isTrue();
            try {
                sync.get(5, TimeUnit.SECONDS);
            } catch (ExecutionException ex) {
                assertThat(ex.getCause()).isInstanceOf(SyncCancelledException.class);
            }
        } finally {
            callers.shutdownNow();
        }

        assertThat(transactions()).isEmpty();
        assertThat(harness.storage.get(userId, DocumentKeys.cursor("a"), Object.class)).isEmpty();
        assertThat(harness.registry.findConnection(userId, "a").orElseThrow().status()).isEqualTo(ConnectionStatus.REVOKED);
        assertThat(harness.syncTasks.isRunning(userId, "a")).isFalse();
    }

    @Test
    void revokedConnectionCannotBeSyncedAgain() {
        coordinator.revoke(userId, "a");

        assertThatThrownBy(() -> harness.transactionSync.sync(userId, "a")).isInstanceOf(ConnectionNotFoundException.class);
        assertThat(harness.transactionSync.syncAll(userId).results()).extracting(SyncResult::connectionId).containsExactly("b");
        assertThat(harness.accountSync.getAccounts(userId, true).cache().institutions())
                .extracting(InstitutionAccounts::connectionId).containsExactly("b");
    }

    private List<TransactionRecord> transactions() {
        return harness.storage.query(userId, DocumentKeys.TRANSACTION, TransactionRecord.class, record -> true);
    }

    private static TransactionsSyncPage page(String... ids) {
        List<TransactionRecord> added = Arrays.stream(ids)
                .map(id -> TestFixtures.transaction(id, "acc-1", "1.00", LocalDate.of(2024, 4, 30), false))
                .toList();
        return new TransactionsSyncPage(added, List.of(), List.of(), "cursor-" + ids[0], false);
    }
}
