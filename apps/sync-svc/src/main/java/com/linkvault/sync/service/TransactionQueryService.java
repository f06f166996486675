package com.linkvault.sync.service;

import com.linkvault.sync.connection.ConnectionRegistry;
import com.linkvault.sync.connection.ConnectionView;
import com.linkvault.sync.model.TransactionRecord;
import com.linkvault.sync.storage.DocumentKeys;
import com.linkvault.sync.storage.StorageGateway;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Read side over synced transactions. Only stored data is returned; nothing here calls the aggregator.
 */
@Service
public class TransactionQueryService {

    static final int MAX_DAYS = 730;

    private final StorageGateway storage;
    private final ConnectionRegistry registry;
    private final Clock clock;

    @Autowired
    public TransactionQueryService(StorageGateway storage, ConnectionRegistry registry) {
        this(storage, registry, Clock.systemUTC());
    }

    TransactionQueryService(StorageGateway storage, ConnectionRegistry registry, Clock clock) {
        this.storage = storage;
        this.registry = registry;
        this.clock = clock;
    }

    public TransactionListing recentTransactions(UUID userId, int days) {
        return list(userId, days, record -> true);
    }

    public TransactionListing accountTransactions(UUID userId, String accountId, int days) {
        if (accountId == null || accountId.isBlank()) {
            throw new IllegalArgumentException("accountId must be provided");
        }
        return list(userId, days, record -> accountId.equals(record.accountId()));
    }

    private TransactionListing list(UUID userId, int days, Predicate<TransactionRecord> filter) {
        if (days < 1 || days > MAX_DAYS) {
            throw new IllegalArgumentException("days must be between 1 and " + MAX_DAYS);
        }
        LocalDate end = LocalDate.now(clock.withZone(ZoneOffset.UTC));
        LocalDate start = end.minusDays(days);
        List<TransactionRecord> transactions = storage.query(userId, DocumentKeys.TRANSACTION, TransactionRecord.class,
                        record -> record.date() != null && !record.date().isBefore(start) && !record.date().isAfter(end))
                .stream()
                .filter(filter)
                .sorted(Comparator.comparing(TransactionRecord::date).reversed()
                        .thenComparing(TransactionRecord::transactionId))
                .toList();
        Map<String, String> institutionNames = registry.listConnections(userId).stream()
                .collect(Collectors.toMap(ConnectionView::connectionId, ConnectionView::institutionName, (a, b) -> a));
        return new TransactionListing(transactions, institutionNames, start, end, days);
    }
}
