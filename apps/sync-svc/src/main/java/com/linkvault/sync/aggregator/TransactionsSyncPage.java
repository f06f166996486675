package com.linkvault.sync.aggregator;

import com.linkvault.sync.model.TransactionRecord;
import java.util.List;

/**
 * One page of the incremental change feed. Records carry no connection id yet.
 */
public record TransactionsSyncPage(
        List<TransactionRecord> added,
        List<TransactionRecord> modified,
        List<String> removedTransactionIds,
        String nextCursor,
        boolean hasMore
) {
    public TransactionsSyncPage {
        added = added == null ? List.of() : List.copyOf(added);
        modified = modified == null ? List.of() : List.copyOf(modified);
        removedTransactionIds = removedTransactionIds == null ? List.of() : List.copyOf(removedTransactionIds);
    }
}
