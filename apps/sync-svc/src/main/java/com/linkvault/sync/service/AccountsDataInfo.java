package com.linkvault.sync.service;

import java.math.BigDecimal;
import java.time.Instant;

public record AccountsDataInfo(
        boolean hasData,
        Instant lastUpdated,
        Double ageHours,
        boolean expired,
        boolean stale,
        int accountCount,
        BigDecimal totalBalance
) {
    public static AccountsDataInfo none() {
        return new AccountsDataInfo(false, null, null, true, false, 0, BigDecimal.ZERO);
    }
}
