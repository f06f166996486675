package com.linkvault.sync.model;

import java.time.Instant;

public record SyncCursor(String connectionId, String cursorToken, Instant lastSyncedAt) {
}
