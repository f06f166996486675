package com.linkvault.sync.model;

public enum SyncStatus {
    PENDING,
    SYNCING,
    COMPLETED,
    ERROR
}
