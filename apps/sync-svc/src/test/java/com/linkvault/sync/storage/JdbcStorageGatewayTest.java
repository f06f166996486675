package com.linkvault.sync.storage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.linkvault.sync.TestFixtures;
import com.linkvault.sync.model.SyncCursor;
import com.linkvault.sync.model.TransactionRecord;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;

class JdbcStorageGatewayTest {

    private JdbcStorageGateway gateway;
    private JdbcTemplate jdbcTemplate;
    private final UUID owner = UUID.randomUUID();
    private final UUID otherOwner = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        DriverManagerDataSource dataSource = new DriverManagerDataSource(
                "jdbc:h2:mem:" + UUID.randomUUID() + ";MODE=PostgreSQL;DB_CLOSE_DELAY=-1", "sa", "");
        new ResourceDatabasePopulator(new ClassPathResource("schema.sql")).execute(dataSource);
        jdbcTemplate = new JdbcTemplate(dataSource);
        gateway = new JdbcStorageGateway(jdbcTemplate, new DataSourceTransactionManager(dataSource),
                Clock.fixed(Instant.parse("2024-05-01T00:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    void putGetAndDeleteArePartitionedByOwner() {
        SyncCursor cursor = new SyncCursor("item-1", "cursor-a", Instant.parse("2024-05-01T00:00:00Z"));
        gateway.put(owner, DocumentKeys.cursor("item-1"), cursor);

        assertThat(gateway.get(owner, DocumentKeys.cursor("item-1"), SyncCursor.class)).contains(cursor);
        assertThat(gateway.get(otherOwner, DocumentKeys.cursor("item-1"), SyncCursor.class)).isEmpty();

        gateway.put(owner, DocumentKeys.cursor("item-1"), new SyncCursor("item-1", "cursor-b", cursor.lastSyncedAt()));
        assertThat(gateway.get(owner, DocumentKeys.cursor("item-1"), SyncCursor.class))
                .hasValueSatisfying(stored -> assertThat(stored.cursorToken()).isEqualTo("cursor-b"));

        assertThat(gateway.delete(owner, DocumentKeys.cursor("item-1"))).isTrue();
        assertThat(gateway.delete(owner, DocumentKeys.cursor("item-1"))).isFalse();
    }

    @Test
    void queryScansOneFamilyWithPredicate() {
        LocalDate date = LocalDate.of(2024, 4, 30);
        gateway.put(owner, DocumentKeys.transaction("t1"), TestFixtures.transaction("t1", "acc-1", "10.00", date, false).attachTo("item-1"));
        gateway.put(owner, DocumentKeys.transaction("t2"), TestFixtures.transaction("t2", "acc-2", "20.00", date, true).attachTo("item-2"));
        gateway.put(owner, DocumentKeys.cursor("item-1"), new SyncCursor("item-1", "c", null));

        List<TransactionRecord> item1 = gateway.query(owner, DocumentKeys.TRANSACTION, TransactionRecord.class,
                record -> "item-1".equals(record.connectionId()));

        assertThat(item1).extracting(TransactionRecord::transactionId).containsExactly("t1");
        assertThat(gateway.query(owner, DocumentKeys.TRANSACTION, TransactionRecord.class, record -> true)).hasSize(2);
        assertThat(item1.get(0).date()).isEqualTo(date);
    }

    @Test
    void batchIsAllOrNothing() {
        gateway.put(owner, DocumentKeys.transaction("keep"), TestFixtures.transaction("keep", "acc", "1.00", LocalDate.now(), false));
        jdbcTemplate.execute("alter table documents add constraint payload_limit check (length(payload) < 2000)");

        StorageBatch batch = StorageBatch.builder()
                .delete(DocumentKeys.transaction("keep"))
                .put(DocumentKeys.cursor("item-1"), new SyncCursor("item-1", "x".repeat(3000), null))
                .build();

        assertThatThrownBy(() -> gateway.apply(owner, batch)).isInstanceOf(StorageException.class);
        assertThat(gateway.get(owner, DocumentKeys.transaction("keep"), TransactionRecord.class)).isPresent();
        assertThat(gateway.get(owner, DocumentKeys.cursor("item-1"), SyncCursor.class)).isEmpty();
    }

    @Test
    void rejectsKeysWithoutFamily() {
        assertThatThrownBy(() -> gateway.put(owner, "nofamily", new SyncCursor("a", "b", null)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
