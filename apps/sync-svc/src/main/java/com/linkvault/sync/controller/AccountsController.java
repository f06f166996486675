package com.linkvault.sync.controller;

import com.linkvault.sync.controller.dto.AccountDto;
import com.linkvault.sync.controller.dto.AccountsDataInfoDto;
import com.linkvault.sync.controller.dto.AccountsResponseDto;
import com.linkvault.sync.controller.dto.AccountsResponseDto.InstitutionDto;
import com.linkvault.sync.controller.dto.ConnectionFailureDto;
import com.linkvault.sync.model.ConsolidatedAccountsCache;
import com.linkvault.sync.model.InstitutionAccounts;
import com.linkvault.sync.security.AuthenticatedUserProvider;
import com.linkvault.sync.security.RequestContextHolder;
import com.linkvault.sync.service.AccountSyncEngine;
import com.linkvault.sync.service.AccountsDataInfo;
import com.linkvault.sync.service.AccountsResult;
import java.math.RoundingMode;
import java.util.UUID;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/accounts")
public class AccountsController {

    private final AccountSyncEngine accountSyncEngine;
    private final AuthenticatedUserProvider authenticatedUserProvider;

    public AccountsController(AccountSyncEngine accountSyncEngine, AuthenticatedUserProvider authenticatedUserProvider) {
        this.accountSyncEngine = accountSyncEngine;
        this.authenticatedUserProvider = authenticatedUserProvider;
    }

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public AccountsResponseDto getAccounts() {
        UUID userId = authenticatedUserProvider.requireCurrentUserId();
        return toResponse(accountSyncEngine.getAccounts(userId, false));
    }

    @PostMapping(path = "/refresh", produces = MediaType.APPLICATION_JSON_VALUE)
    public AccountsResponseDto refreshAccounts() {
        UUID userId = authenticatedUserProvider.requireCurrentUserId();
        return toResponse(accountSyncEngine.getAccounts(userId, true));
    }

    @GetMapping(path = "/data-info", produces = MediaType.APPLICATION_JSON_VALUE)
    public AccountsDataInfoDto dataInfo() {
        UUID userId = authenticatedUserProvider.requireCurrentUserId();
        AccountsDataInfo info = accountSyncEngine.dataInfo(userId);
        return new AccountsDataInfoDto(info.hasData(), info.lastUpdated(), info.ageHours(), info.expired(), info.stale(),
                info.accountCount(), info.totalBalance());
    }

    private static AccountsResponseDto toResponse(AccountsResult result) {
        ConsolidatedAccountsCache cache = result.cache();
        return new AccountsResponseDto(
                cache.institutions().stream().map(AccountsController::toInstitution).toList(),
                cache.accountCount(),
                cache.banksCount(),
                cache.totalBalance(),
                cache.lastUpdated(),
                result.fromStored(),
                cache.stale(),
                result.partialFailure(),
                result.failures().stream().map(ConnectionFailureDto::from).toList(),
                RequestContextHolder.currentTraceId()
        );
    }

    private static InstitutionDto toInstitution(InstitutionAccounts institution) {
        return new InstitutionDto(
                institution.connectionId(),
                institution.institutionId(),
                institution.institutionName(),
                institution.status(),
                institution.errorMessage(),
                institution.currentTotal().setScale(2, RoundingMode.HALF_UP),
                institution.accounts().size(),
                institution.accounts().stream().map(AccountDto::from).toList()
        );
    }
}
