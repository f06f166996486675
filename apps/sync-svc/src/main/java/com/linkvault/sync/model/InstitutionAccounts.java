package com.linkvault.sync.model;

import com.linkvault.sync.connection.ConnectionStatus;
import java.math.BigDecimal;
import java.util.List;

/**
 * The accounts one connection contributed to the consolidated cache. A connection whose last fetch failed is
 * kept with its status and reason but no accounts, so callers can show which institution needs attention.
 */
public record InstitutionAccounts(
        String connectionId,
        String institutionId,
        String institutionName,
        ConnectionStatus status,
        String errorMessage,
        List<AccountSnapshot> accounts
) {
    public InstitutionAccounts {
        accounts = accounts == null ? List.of() : List.copyOf(accounts);
    }

    public static InstitutionAccounts failed(String connectionId, String institutionId, String institutionName,
                                             ConnectionStatus status, String errorMessage) {
        return new InstitutionAccounts(connectionId, institutionId, institutionName, status, errorMessage, List.of());
    }

    /**
     * Only a connection whose latest fetch succeeded counts toward totals. A transient failure keeps the connection
     * active but still carries an error message.
     */
    public boolean contributesToTotals() {
        return status == ConnectionStatus.ACTIVE && errorMessage == null;
    }

    public BigDecimal currentTotal() {
        if (!contributesToTotals()) {
            return BigDecimal.ZERO;
        }
        return accounts.stream()
                .map(account -> account.balances() != null ? account.balances().currentOrZero() : BigDecimal.ZERO)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public int contributingAccountCount() {
        return contributesToTotals() ? accounts.size() : 0;
    }
}
