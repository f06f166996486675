package com.linkvault.sync.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.sql.Timestamp;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Document store over a single {@code documents} table (see {@code schema.sql}). Payloads are JSON.
 */
@Repository
public class JdbcStorageGateway implements StorageGateway {

    private static final Logger log = LoggerFactory.getLogger(JdbcStorageGateway.class);

    private static final String SELECT_ONE = "select payload from documents where owner_id = ? and doc_key = ?";
    private static final String SELECT_FAMILY = "select payload from documents where owner_id = ? and doc_family = ? order by doc_key";
    private static final String UPDATE = "update documents set payload = ?, doc_family = ?, updated_at = ? where owner_id = ? and doc_key = ?";
    private static final String INSERT = "insert into documents (owner_id, doc_key, doc_family, payload, updated_at) values (?, ?, ?, ?, ?)";
    private static final String DELETE = "delete from documents where owner_id = ? and doc_key = ?";

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Autowired
    public JdbcStorageGateway(JdbcTemplate jdbcTemplate, PlatformTransactionManager transactionManager) {
        this(jdbcTemplate, transactionManager, Clock.systemUTC());
    }

    JdbcStorageGateway(JdbcTemplate jdbcTemplate, PlatformTransactionManager transactionManager, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        this.clock = clock;
    }

    @Override
    public <T> Optional<T> get(UUID ownerId, String key, Class<T> type) {
        try {
            List<String> rows = jdbcTemplate.queryForList(SELECT_ONE, String.class, ownerId.toString(), key);
            if (rows.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(read(rows.get(0), type, key));
        } catch (DataAccessException ex) {
            throw new StorageException("Failed to read document " + key, ex);
        }
    }

    @Override
    public void put(UUID ownerId, String key, Object document) {
        try {
            upsert(ownerId, key, document);
        } catch (DataAccessException ex) {
            throw new StorageException("Failed to write document " + key, ex);
        }
    }

    @Override
    public boolean delete(UUID ownerId, String key) {
        try {
            return jdbcTemplate.update(DELETE, ownerId.toString(), key) > 0;
        } catch (DataAccessException ex) {
            throw new StorageException("Failed to delete document " + key, ex);
        }
    }

    @Override
    public <T> List<T> query(UUID ownerId, String family, Class<T> type, Predicate<? super T> predicate) {
        try {
            List<String> rows = jdbcTemplate.queryForList(SELECT_FAMILY, String.class, ownerId.toString(), family);
            List<T> results = new ArrayList<>();
            for (String payload : rows) {
                T document = read(payload, type, family);
                if (predicate.test(document)) {
                    results.add(document);
                }
            }
            return results;
        } catch (DataAccessException ex) {
            throw new StorageException("Failed to query family " + family, ex);
        }
    }

    @Override
    public void apply(UUID ownerId, StorageBatch batch) {
        if (batch.isEmpty()) {
            return;
        }
        try {
            transactionTemplate.executeWithoutResult(status -> {
                for (StorageBatch.Operation operation : batch.operations()) {
                    if (operation.kind() == StorageBatch.Kind.PUT) {
                        upsert(ownerId, operation.key(), operation.document());
                    } else {
                        jdbcTemplate.update(DELETE, ownerId.toString(), operation.key());
                    }
                }
            });
            log.debug("Applied batch of {} operation(s) for owner {}", batch.size(), ownerId);
        } catch (DataAccessException | TransactionException ex) {
            throw new StorageException("Failed to apply batch of " + batch.size() + " operation(s)", ex);
        }
    }

    private void upsert(UUID ownerId, String key, Object document) {
        String payload = write(document, key);
        String family = DocumentKeys.familyOf(key);
        Timestamp now = Timestamp.from(clock.instant());
        int updated = jdbcTemplate.update(UPDATE, payload, family, now, ownerId.toString(), key);
        if (updated == 0) {
            jdbcTemplate.update(INSERT, ownerId.toString(), key, family, payload, now);
        }
    }

    private String write(Object document, String key) {
        try {
            return objectMapper.writeValueAsString(document);
        } catch (JsonProcessingException ex) {
            throw new StorageException("Failed to serialise document " + key, ex);
        }
    }

    private <T> T read(String payload, Class<T> type, String key) {
        try {
            return objectMapper.readValue(payload, type);
        } catch (JsonProcessingException ex) {
            throw new StorageException("Failed to deserialise document " + key, ex);
        }
    }
}
