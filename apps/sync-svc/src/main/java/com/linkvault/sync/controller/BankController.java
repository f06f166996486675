package com.linkvault.sync.controller;

import com.linkvault.sync.controller.dto.AccountDto;
import com.linkvault.sync.controller.dto.BanksResponseDto;
import com.linkvault.sync.controller.dto.BanksResponseDto.BankDto;
import com.linkvault.sync.controller.dto.BanksResponseDto.ItemDto;
import com.linkvault.sync.controller.dto.ConnectionFailureDto;
import com.linkvault.sync.controller.dto.RevokeResponseDto;
import com.linkvault.sync.controller.dto.SyncInfoDto;
import com.linkvault.sync.connection.ConnectionRegistry;
import com.linkvault.sync.connection.ConnectionView;
import com.linkvault.sync.model.AccountSnapshot;
import com.linkvault.sync.model.InstitutionAccounts;
import com.linkvault.sync.security.AuthenticatedUserProvider;
import com.linkvault.sync.service.AccountSyncEngine;
import com.linkvault.sync.service.RevocationCoordinator;
import com.linkvault.sync.service.RevocationReport;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Linked institutions. Listing reads the accounts snapshot as stored and never triggers a refresh.
 */
@RestController
@RequestMapping("/bank")
public class BankController {

    private final ConnectionRegistry connectionRegistry;
    private final AccountSyncEngine accountSyncEngine;
    private final RevocationCoordinator revocationCoordinator;
    private final AuthenticatedUserProvider authenticatedUserProvider;

    public BankController(
            ConnectionRegistry connectionRegistry,
            AccountSyncEngine accountSyncEngine,
            RevocationCoordinator revocationCoordinator,
            AuthenticatedUserProvider authenticatedUserProvider
    ) {
        this.connectionRegistry = connectionRegistry;
        this.accountSyncEngine = accountSyncEngine;
        this.revocationCoordinator = revocationCoordinator;
        this.authenticatedUserProvider = authenticatedUserProvider;
    }

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public BanksResponseDto listBanks() {
        UUID userId = authenticatedUserProvider.requireCurrentUserId();
        Map<String, List<AccountSnapshot>> accountsByConnection = accountSyncEngine.peekCache(userId)
                .map(cache -> cache.institutions().stream()
                        .collect(Collectors.toMap(InstitutionAccounts::connectionId, InstitutionAccounts::accounts, (a, b) -> a)))
                .orElse(Map.of());
        List<BankDto> banks = connectionRegistry.listConnections(userId).stream()
                .map(connection -> new BankDto(toItem(connection, accountsByConnection.getOrDefault(connection.connectionId(), List.of()))))
                .toList();
        return new BanksResponseDto(banks, banks.size());
    }

    @DeleteMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public RevokeResponseDto revokeBanks(@RequestParam("bank_ids") String bankIds) {
        UUID userId = authenticatedUserProvider.requireCurrentUserId();
        List<String> ids = Arrays.stream(bankIds.split(","))
                .map(String::trim)
                .filter(id -> !id.isEmpty())
                .toList();
        if (ids.isEmpty()) {
            throw new IllegalArgumentException("bank_ids must name at least one connection");
        }
        return toResponse(revocationCoordinator.revokeMany(userId, ids));
    }

    @DeleteMapping(path = "/all", produces = MediaType.APPLICATION_JSON_VALUE)
    public RevokeResponseDto revokeAll() {
        UUID userId = authenticatedUserProvider.requireCurrentUserId();
        return toResponse(revocationCoordinator.revokeAll(userId));
    }

    private static ItemDto toItem(ConnectionView connection, List<AccountSnapshot> accounts) {
        return new ItemDto(
                connection.connectionId(),
                connection.institutionId(),
                connection.institutionName(),
                connection.status(),
                connection.statusReason(),
                connection.createdAt(),
                connection.lastUsedAt(),
                SyncInfoDto.from(connection.accountSync()),
                SyncInfoDto.from(connection.transactionSync()),
                accounts.stream().map(AccountDto::from).toList()
        );
    }

    private static RevokeResponseDto toResponse(RevocationReport report) {
        String message = report.failures().isEmpty()
                ? "Revoked " + report.successCount() + " connection(s)"
                : "Revoked " + report.successCount() + " connection(s); " + report.failures().size() + " failed";
        return new RevokeResponseDto(message, report.successCount(),
                report.failures().stream().map(ConnectionFailureDto::from).toList());
    }
}
