package com.linkvault.sync.controller.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.linkvault.sync.model.AccountSnapshot;
import com.linkvault.sync.model.Balances;
import java.math.BigDecimal;

public record AccountDto(
        @JsonProperty("account_id") String accountId,
        @JsonProperty("item_id") String itemId,
        @JsonProperty("name") String name,
        @JsonProperty("official_name") String officialName,
        @JsonProperty("type") String type,
        @JsonProperty("subtype") String subtype,
        @JsonProperty("mask") String mask,
        @JsonProperty("balances") BalancesDto balances
) {
    public static AccountDto from(AccountSnapshot account) {
        Balances balances = account.balances();
        return new AccountDto(
                account.accountId(),
                account.connectionId(),
                account.name(),
                account.officialName(),
                account.type(),
                account.subtype(),
                account.mask(),
                balances == null ? null : new BalancesDto(balances.available(), balances.current(), balances.limit(), balances.currency())
        );
    }

    public record BalancesDto(
            @JsonProperty("available") BigDecimal available,
            @JsonProperty("current") BigDecimal current,
            @JsonProperty("limit") BigDecimal limit,
            @JsonProperty("iso_currency_code") String isoCurrencyCode
    ) {
    }
}
