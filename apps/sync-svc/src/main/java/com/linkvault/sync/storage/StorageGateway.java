package com.linkvault.sync.storage;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Predicate;

/**
 * Owner-partitioned document store. Keys follow {@code family:id} (see {@link DocumentKeys}); {@link #query}
 * scans a single family for one owner. Every method fails with {@link StorageException} on backend errors.
 */
public interface StorageGateway {

    <T> Optional<T> get(UUID ownerId, String key, Class<T> type);

    void put(UUID ownerId, String key, Object document);

    /**
     * @return {@code true} when a document was removed
     */
    boolean delete(UUID ownerId, String key);

    <T> List<T> query(UUID ownerId, String family, Class<T> type, Predicate<? super T> predicate);

    /**
     * Applies every operation of the batch, in order, or none of them.
     */
    void apply(UUID ownerId, StorageBatch batch);
}
