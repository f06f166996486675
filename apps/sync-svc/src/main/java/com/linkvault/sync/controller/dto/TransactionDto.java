package com.linkvault.sync.controller.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.linkvault.sync.model.TransactionRecord;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

public record TransactionDto(
        @JsonProperty("transaction_id") String transactionId,
        @JsonProperty("item_id") String itemId,
        @JsonProperty("account_id") String accountId,
        @JsonProperty("amount") BigDecimal amount,
        @JsonProperty("iso_currency_code") String isoCurrencyCode,
        @JsonProperty("date") LocalDate date,
        @JsonProperty("authorized_date") LocalDate authorizedDate,
        @JsonProperty("pending") boolean pending,
        @JsonProperty("name") String name,
        @JsonProperty("category") List<String> category,
        @JsonProperty("merchant_name") String merchantName,
        @JsonProperty("location") LocationDto location,
        @JsonProperty("payment_meta") PaymentMetaDto paymentMeta,
        @JsonProperty("institution_name") String institutionName
) {
    public static TransactionDto from(TransactionRecord record, String institutionName) {
        TransactionRecord.Location location = record.location();
        TransactionRecord.PaymentMeta meta = record.paymentMeta();
        return new TransactionDto(
                record.transactionId(),
                record.connectionId(),
                record.accountId(),
                record.amount(),
                record.isoCurrencyCode(),
                record.date(),
                record.authorizedDate(),
                record.pending(),
                record.name(),
                record.category(),
                record.merchantName(),
                location == null ? null : new LocationDto(location.address(), location.city(), location.region(),
                        location.postalCode(), location.country(), location.lat(), location.lon(), location.storeNumber()),
                meta == null ? null : new PaymentMetaDto(meta.referenceNumber(), meta.payee(), meta.payer(),
                        meta.paymentMethod(), meta.paymentProcessor(), meta.reason()),
                institutionName
        );
    }

    public record LocationDto(
            @JsonProperty("address") String address,
            @JsonProperty("city") String city,
            @JsonProperty("region") String region,
            @JsonProperty("postal_code") String postalCode,
            @JsonProperty("country") String country,
            @JsonProperty("lat") Double lat,
            @JsonProperty("lon") Double lon,
            @JsonProperty("store_number") String storeNumber
    ) {
    }

    public record PaymentMetaDto(
            @JsonProperty("reference_number") String referenceNumber,
            @JsonProperty("payee") String payee,
            @JsonProperty("payer") String payer,
            @JsonProperty("payment_method") String paymentMethod,
            @JsonProperty("payment_processor") String paymentProcessor,
            @JsonProperty("reason") String reason
    ) {
    }
}
