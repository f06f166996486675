package com.linkvault.sync.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;

/**
 * Test double for {@link StorageGateway}. Documents go through JSON like the JDBC adapter, so tests see the same
 * serialisation behaviour. Batches can be made to fail on demand.
 */
public class InMemoryStorageGateway implements StorageGateway {

    private final Map<UUID, TreeMap<String, String>> partitions = new ConcurrentHashMap<>();
    private final ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    private final AtomicInteger applyCount = new AtomicInteger();
    private volatile Predicate<StorageBatch> failingBatches = batch -> false;

    public void failBatchesMatching(Predicate<StorageBatch> predicate) {
        this.failingBatches = predicate;
    }

    public void stopFailing() {
        this.failingBatches = batch -> false;
    }

    public int applyCount() {
        return applyCount.get();
    }

    public synchronized int size(UUID ownerId, String family) {
        return (int) partition(ownerId).keySet().stream().filter(key -> key.startsWith(family + ":")).count();
    }

    @Override
    public <T> Optional<T> get(UUID ownerId, String key, Class<T> type) {
        String payload;
        synchronized (this) {
            payload = partition(ownerId).get(key);
        }
        return payload == null ? Optional.empty() : Optional.of(read(payload, type));
    }

    @Override
    public synchronized void put(UUID ownerId, String key, Object document) {
        DocumentKeys.familyOf(key);
        partition(ownerId).put(key, write(document));
    }

    @Override
    public synchronized boolean delete(UUID ownerId, String key) {
        return partition(ownerId).remove(key) != null;
    }

    @Override
    public <T> List<T> query(UUID ownerId, String family, Class<T> type, Predicate<? super T> predicate) {
        List<String> payloads;
        synchronized (this) {
            payloads = partition(ownerId).entrySet().stream()
                    .filter(entry -> DocumentKeys.familyOf(entry.getKey()).equals(family))
                    .map(Map.Entry::getValue)
                    .toList();
        }
        List<T> results = new ArrayList<>();
        for (String payload : payloads) {
            T document = read(payload, type);
            if (predicate.test(document)) {
                results.add(document);
            }
        }
        return results;
    }

    @Override
    public synchronized void apply(UUID ownerId, StorageBatch batch) {
        applyCount.incrementAndGet();
        if (failingBatches.test(batch)) {
            throw new StorageException("simulated storage outage");
        }
        TreeMap<String, String> copy = new TreeMap<>(partition(ownerId));
        for (StorageBatch.Operation operation : batch.operations()) {
            if (operation.kind() == StorageBatch.Kind.PUT) {
                copy.put(operation.key(), write(operation.document()));
            } else {
                copy.remove(operation.key());
            }
        }
        partitions.put(ownerId, copy);
    }

    private TreeMap<String, String> partition(UUID ownerId) {
        return partitions.computeIfAbsent(ownerId, id -> new TreeMap<>());
    }

    private String write(Object document) {
        try {
            return objectMapper.writeValueAsString(document);
        } catch (JsonProcessingException ex) {
            throw new StorageException("Failed to serialise document", ex);
        }
    }

    private <T> T read(String payload, Class<T> type) {
        try {
            return objectMapper.readValue(payload, type);
        } catch (JsonProcessingException ex) {
            throw new StorageException("Failed to deserialise document", ex);
        }
    }
}
