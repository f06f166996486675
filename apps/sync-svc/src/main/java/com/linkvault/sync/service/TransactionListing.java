package com.linkvault.sync.service;

import com.linkvault.sync.model.TransactionRecord;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * @param institutionNames institution name per connection id, for the connections in {@code transactions}
 */
public record TransactionListing(
        List<TransactionRecord> transactions,
        Map<String, String> institutionNames,
        LocalDate startDate,
        LocalDate endDate,
        int days
) {
}
