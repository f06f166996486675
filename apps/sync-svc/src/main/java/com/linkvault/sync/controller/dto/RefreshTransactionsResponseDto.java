package com.linkvault.sync.controller.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.linkvault.sync.service.SyncResult;

public record RefreshTransactionsResponseDto(
        @JsonProperty("success") boolean success,
        @JsonProperty("added") int added,
        @JsonProperty("modified") int modified,
        @JsonProperty("removed") int removed,
        @JsonProperty("total_processed") int totalProcessed,
        @JsonProperty("has_more") boolean hasMore,
        @JsonProperty("item_id") String itemId,
        @JsonProperty("institution_name") String institutionName,
        @JsonProperty("message") String message
) {
    public static RefreshTransactionsResponseDto from(SyncResult result) {
        String message = result.hasMore()
                ? "Synced " + result.totalProcessed() + " change(s); more remain, refresh again to continue"
                : "Synced " + result.totalProcessed() + " change(s)";
        return new RefreshTransactionsResponseDto(true, result.added(), result.modified(), result.removed(),
                result.totalProcessed(), result.hasMore(), result.connectionId(), result.institutionName(), message);
    }
}
