package com.linkvault.sync.storage;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public final class StorageBatch {

    public enum Kind {
        PUT,
        DELETE
    }

    public record Operation(Kind kind, String key, Object document) {
        public Operation {
            Objects.requireNonNull(kind, "kind");
            Objects.requireNonNull(key, "key");
            if (kind == Kind.PUT && document == null) {
                throw new IllegalArgumentException("put operation requires a document for " + key);
            }
        }
    }

    private final List<Operation> operations;

    private StorageBatch(List<Operation> operations) {
        this.operations = List.copyOf(operations);
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<Operation> operations() {
        return operations;
    }

    public boolean isEmpty() {
        return operations.isEmpty();
    }

    public int size() {
        return operations.size();
    }

    public static final class Builder {
        private final List<Operation> operations = new ArrayList<>();

        public Builder put(String key, Object document) {
            operations.add(new Operation(Kind.PUT, key, document));
            return this;
        }

        public Builder delete(String key) {
            operations.add(new Operation(Kind.DELETE, key, null));
            return this;
        }

        public StorageBatch build() {
            return new StorageBatch(operations);
        }
    }
}
