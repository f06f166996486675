package com.linkvault.sync.service;

/**
 * Counts for one connection's transaction sync. {@code hasMore} stays {@code true} only when the page limit cut the
 * loop short.
 */
public record SyncResult(
        String connectionId,
        String institutionName,
        int added,
        int modified,
        int removed,
        boolean hasMore,
        int pages
) {
    public int totalProcessed() {
        return added + modified + removed;
    }
}
