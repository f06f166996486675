package com.linkvault.sync.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.linkvault.sync.MutableClock;
import com.linkvault.sync.TestFixtures;
import com.linkvault.sync.connection.ConnectionRegistry;
import com.linkvault.sync.connection.InstitutionInfo;
import com.linkvault.sync.model.TransactionRecord;
import com.linkvault.sync.security.AesGcmCredentialVault;
import com.linkvault.sync.storage.DocumentKeys;
import com.linkvault.sync.storage.InMemoryStorageGateway;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TransactionQueryServiceTest {

    private final UUID userId = UUID.randomUUID();
    private InMemoryStorageGateway storage;
    private TransactionQueryService service;

    @BeforeEach
    void setUp() {
        storage = new InMemoryStorageGateway();
        MutableClock clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        ConnectionRegistry registry = new ConnectionRegistry(storage, new AesGcmCredentialVault(TestFixtures.properties()), clock);
        registry.createConnection(userId, new InstitutionInfo("item-1", "ins_1", "Chase", List.of()), "access-1");
        service = new TransactionQueryService(storage, registry, clock);

        store("t-today", "acc-1", LocalDate.of(2024, 5, 1));
        store("t-week", "acc-2", LocalDate.of(2024, 4, 24));
        store("t-week-b", "acc-1", LocalDate.of(2024, 4, 24));
        store("t-old", "acc-1", LocalDate.of(2024, 1, 1));
    }

    @Test
    void listsWindowNewestFirst() {
        TransactionListing listing = service.recentTransactions(userId, 30);

        assertThat(listing.transactions()).extracting(TransactionRecord::transactionId)
                .containsExactly("t-today", "t-week", "t-week-b");
        assertThat(listing.startDate()).isEqualTo(LocalDate.of(2024, 4, 1));
        assertThat(listing.endDate()).isEqualTo(LocalDate.of(2024, 5, 1));
        assertThat(listing.institutionNames()).containsEntry("item-1", "Chase");
    }

    @Test
    void filtersByAccount() {
        TransactionListing listing = service.accountTransactions(userId, "acc-2", 30);

        assertThat(listing.transactions()).extracting(TransactionRecord::transactionId).containsExactly("t-week");
    }

    @Test
    void rejectsOutOfRangeWindows() {
        assertThatThrownBy(() -> service.recentTransactions(userId, 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.recentTransactions(userId, 731)).isInstanceOf(IllegalArgumentException.class);
        assertThat(service.recentTransactions(userId, 730).transactions()).hasSize(4);
    }

    private void store(String id, String accountId, LocalDate date) {
        storage.put(userId, DocumentKeys.transaction(id),
                TestFixtures.transaction(id, accountId, "1.00", date, false).attachTo("item-1"));
    }
}
