package com.linkvault.sync.controller;

import com.linkvault.sync.controller.dto.ConnectionFailureDto;
import com.linkvault.sync.controller.dto.ForceRefreshResponseDto;
import com.linkvault.sync.controller.dto.RefreshTransactionsResponseDto;
import com.linkvault.sync.controller.dto.SyncAllResponseDto;
import com.linkvault.sync.controller.dto.SyncInfoDto;
import com.linkvault.sync.controller.dto.SyncStatusResponseDto;
import com.linkvault.sync.controller.dto.TransactionDto;
import com.linkvault.sync.controller.dto.TransactionsResponseDto;
import com.linkvault.sync.controller.dto.TransactionsResponseDto.DateRangeDto;
import com.linkvault.sync.connection.BankConnection;
import com.linkvault.sync.connection.ConnectionNotFoundException;
import com.linkvault.sync.connection.ConnectionRegistry;
import com.linkvault.sync.connection.ConnectionView;
import com.linkvault.sync.security.AuthenticatedUserProvider;
import com.linkvault.sync.service.SyncAllResult;
import com.linkvault.sync.service.SyncTaskRegistry;
import com.linkvault.sync.service.TransactionListing;
import com.linkvault.sync.service.TransactionQueryService;
import com.linkvault.sync.service.TransactionSyncEngine;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/transactions")
public class TransactionsController {

    private final TransactionQueryService transactionQueryService;
    private final TransactionSyncEngine transactionSyncEngine;
    private final ConnectionRegistry connectionRegistry;
    private final SyncTaskRegistry syncTaskRegistry;
    private final AuthenticatedUserProvider authenticatedUserProvider;

    public TransactionsController(
            TransactionQueryService transactionQueryService,
            TransactionSyncEngine transactionSyncEngine,
            ConnectionRegistry connectionRegistry,
            SyncTaskRegistry syncTaskRegistry,
            AuthenticatedUserProvider authenticatedUserProvider
    ) {
        this.transactionQueryService = transactionQueryService;
        this.transactionSyncEngine = transactionSyncEngine;
        this.connectionRegistry = connectionRegistry;
        this.syncTaskRegistry = syncTaskRegistry;
        this.authenticatedUserProvider = authenticatedUserProvider;
    }

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public TransactionsResponseDto listTransactions(@RequestParam(name = "days", defaultValue = "30") int days) {
        UUID userId = authenticatedUserProvider.requireCurrentUserId();
        return toResponse(transactionQueryService.recentTransactions(userId, days));
    }

    @GetMapping(path = "/account/{accountId}", produces = MediaType.APPLICATION_JSON_VALUE)
    public TransactionsResponseDto listAccountTransactions(
            @PathVariable String accountId,
            @RequestParam(name = "days", defaultValue = "30") int days
    ) {
        UUID userId = authenticatedUserProvider.requireCurrentUserId();
        return toResponse(transactionQueryService.accountTransactions(userId, accountId, days));
    }

    @PostMapping(path = "/refresh", produces = MediaType.APPLICATION_JSON_VALUE)
    public SyncAllResponseDto refreshAll() {
        UUID userId = authenticatedUserProvider.requireCurrentUserId();
        SyncAllResult result = transactionSyncEngine.syncAll(userId);
        return new SyncAllResponseDto(
                result.results().stream().map(RefreshTransactionsResponseDto::from).toList(),
                result.results().size(),
                result.failures().stream().map(ConnectionFailureDto::from).toList()
        );
    }

    @PostMapping(path = "/refresh/{connectionId}", produces = MediaType.APPLICATION_JSON_VALUE)
    public RefreshTransactionsResponseDto refresh(@PathVariable String connectionId) {
        UUID userId = authenticatedUserProvider.requireCurrentUserId();
        return RefreshTransactionsResponseDto.from(transactionSyncEngine.sync(userId, connectionId));
    }

    @PostMapping(path = "/force-refresh/{connectionId}", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ForceRefreshResponseDto> forceRefresh(@PathVariable String connectionId) {
        UUID userId = authenticatedUserProvider.requireCurrentUserId();
        ConnectionView connection = transactionSyncEngine.startFullResync(userId, connectionId);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(new ForceRefreshResponseDto(
                true,
                "async_operation",
                true,
                connection.connectionId(),
                connection.institutionName(),
                "Full resync started; poll /transactions/sync-status/" + connection.connectionId() + " for progress",
                SyncInfoDto.from(connection.transactionSync())
        ));
    }

    @GetMapping(path = "/sync-status/{connectionId}", produces = MediaType.APPLICATION_JSON_VALUE)
    public SyncStatusResponseDto syncStatus(@PathVariable String connectionId) {
        UUID userId = authenticatedUserProvider.requireCurrentUserId();
        BankConnection connection = connectionRegistry.findConnection(userId, connectionId)
                .orElseThrow(() -> new ConnectionNotFoundException(connectionId));
        return new SyncStatusResponseDto(
                connection.connectionId(),
                connection.institutionName(),
                connection.status(),
                syncTaskRegistry.isRunning(userId, connectionId),
                SyncInfoDto.from(connection.accountSync()),
                SyncInfoDto.from(connection.transactionSync())
        );
    }

    private static TransactionsResponseDto toResponse(TransactionListing listing) {
        return new TransactionsResponseDto(
                listing.transactions().stream()
                        .map(record -> TransactionDto.from(record, listing.institutionNames().get(record.connectionId())))
                        .toList(),
                listing.transactions().size(),
                new DateRangeDto(listing.startDate(), listing.endDate(), listing.days())
        );
    }
}
