package com.linkvault.sync.model;

import java.math.BigDecimal;

public record Balances(
        BigDecimal available,
        BigDecimal current,
        BigDecimal limit,
        String currency
) {
    public BigDecimal currentOrZero() {
        return current != null ? current : BigDecimal.ZERO;
    }
}
