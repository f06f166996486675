package com.linkvault.sync.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * A transaction as last reported by the aggregator. Unique per owner by {@code transactionId}.
 */
public record TransactionRecord(
        String transactionId,
        String connectionId,
        String accountId,
        BigDecimal amount,
        String isoCurrencyCode,
        LocalDate date,
        LocalDate authorizedDate,
        boolean pending,
        String name,
        List<String> category,
        String merchantName,
        Location location,
        PaymentMeta paymentMeta
) {
    public TransactionRecord {
        category = category == null ? List.of() : List.copyOf(category);
    }

    public TransactionRecord attachTo(String connection) {
        return new TransactionRecord(transactionId, connection, accountId, amount, isoCurrencyCode, date,
                authorizedDate, pending, name, category, merchantName, location, paymentMeta);
    }

    public record Location(
            String address,
            String city,
            String region,
            String postalCode,
            String country,
            Double lat,
            Double lon,
            String storeNumber
    ) {
    }

    public record PaymentMeta(
            String referenceNumber,
            String payee,
            String payer,
            String paymentMethod,
            String paymentProcessor,
            String reason
    ) {
    }
}
