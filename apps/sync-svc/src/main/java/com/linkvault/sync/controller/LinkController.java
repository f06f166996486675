package com.linkvault.sync.controller;

import com.linkvault.sync.aggregator.LinkToken;
import com.linkvault.sync.controller.dto.ExchangeRequestDto;
import com.linkvault.sync.controller.dto.ExchangeResponseDto;
import com.linkvault.sync.controller.dto.LinkTokenResponseDto;
import com.linkvault.sync.connection.ConnectionView;
import com.linkvault.sync.security.AuthenticatedUserProvider;
import com.linkvault.sync.security.RequestContextHolder;
import com.linkvault.sync.service.LinkService;
import jakarta.validation.Valid;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/link")
public class LinkController {

    private final LinkService linkService;
    private final AuthenticatedUserProvider authenticatedUserProvider;

    public LinkController(LinkService linkService, AuthenticatedUserProvider authenticatedUserProvider) {
        this.linkService = linkService;
        this.authenticatedUserProvider = authenticatedUserProvider;
    }

    @PostMapping("/token")
    public ResponseEntity<LinkTokenResponseDto> createLinkToken() {
        UUID userId = authenticatedUserProvider.requireCurrentUserId();
        LinkToken linkToken = linkService.createLinkToken(userId);
        return ResponseEntity.ok(new LinkTokenResponseDto(linkToken.linkToken(), linkToken.expiration()));
    }

    @PostMapping("/exchange")
    public ResponseEntity<ExchangeResponseDto> exchangePublicToken(@RequestBody @Valid ExchangeRequestDto request) {
        UUID userId = authenticatedUserProvider.requireCurrentUserId();
        ConnectionView connection = linkService.exchangePublicToken(userId, request.publicToken(), request.accountMasks());
        return ResponseEntity.status(HttpStatus.CREATED).body(new ExchangeResponseDto(
                connection.connectionId(),
                connection.institutionId(),
                connection.institutionName(),
                connection.status(),
                RequestContextHolder.currentTraceId()
        ));
    }
}
