package com.linkvault.sync.model;

import java.time.Instant;

/**
 * Bookkeeping for the most recent account or transaction sync of one connection.
 */
public record SyncInfo(SyncStatus status, Instant startedAt, Instant completedAt, String errorMessage) {

    public static SyncInfo never() {
        return new SyncInfo(null, null, null, null);
    }

    public static SyncInfo pending(Instant now) {
        return new SyncInfo(SyncStatus.PENDING, now, null, null);
    }

    public SyncInfo syncing(Instant now) {
        return new SyncInfo(SyncStatus.SYNCING, startedAt != null && status == SyncStatus.PENDING ? startedAt : now, null, null);
    }

    public SyncInfo completed(Instant now) {
        return new SyncInfo(SyncStatus.COMPLETED, startedAt != null ? startedAt : now, now, null);
    }

    public SyncInfo failed(Instant now, String message) {
        return new SyncInfo(SyncStatus.ERROR, startedAt != null ? startedAt : now, now, message);
    }

    public boolean inProgress() {
        return status == SyncStatus.PENDING || status == SyncStatus.SYNCING;
    }
}
