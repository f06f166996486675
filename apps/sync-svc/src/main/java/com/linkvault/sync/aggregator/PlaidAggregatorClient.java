package com.linkvault.sync.aggregator;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.linkvault.sync.config.LinkvaultProperties;
import com.linkvault.sync.model.AccountSnapshot;
import com.linkvault.sync.model.Balances;
import com.linkvault.sync.model.TransactionRecord;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

/**
 * Plaid implementation of {@link AggregatorClient}. Calls block on the reactive client; transient and
 * rate-limited failures are retried with bounded exponential backoff before they surface.
 */
@Component
public class PlaidAggregatorClient implements AggregatorClient {
    private static final Logger log = LoggerFactory.getLogger(PlaidAggregatorClient.class);

    private static final int SYNC_PAGE_SIZE = 500;

    private static final Set<String> LOGIN_REQUIRED_CODES = Set.of(
            "ITEM_LOGIN_REQUIRED", "PENDING_EXPIRATION", "PENDING_DISCONNECT");
    private static final Set<String> TRANSIENT_CODES = Set.of(
            "PRODUCT_NOT_READY", "INTERNAL_SERVER_ERROR", "INSTITUTION_DOWN", "INSTITUTION_NOT_RESPONDING",
            "TRANSACTIONS_SYNC_MUTATION_DURING_PAGINATION");
    private static final Set<String> TRANSIENT_TYPES = Set.of("API_ERROR", "INSTITUTION_ERROR");

    private final WebClient webClient;
    private final LinkvaultProperties.Plaid plaid;
    private final Retry retry;

    public PlaidAggregatorClient(LinkvaultProperties properties) {
        this.plaid = properties.plaid();
        this.webClient = WebClient.builder()
                .baseUrl(plaid.baseUrl())
                .defaultHeader("Content-Type", MediaType.APPLICATION_JSON_VALUE)
                .build();
        this.retry = Retry.backoff(plaid.maxRetries(), plaid.initialBackoff())
                .filter(ex -> ex instanceof TransientAggregatorException || ex instanceof RateLimitedException)
                .doBeforeRetry(signal -> log.warn("Retrying Plaid call after {} (attempt {})",
                        signal.failure().getMessage(), signal.totalRetries() + 1))
                .onRetryExhaustedThrow((spec, signal) -> signal.failure());
        log.info("Plaid client configured for {} environment", plaid.environment());
    }

    @Override
    public LinkToken createLinkToken(UUID userId) {
        var body = new LinkedHashMap<String, Object>();
        body.put("client_name", plaid.clientName());
        body.put("language", "en");
        body.put("country_codes", plaid.countryCodes());
        body.put("user", Map.of("client_user_id", userId.toString()));
        body.put("products", plaid.products());
        LinkTokenCreateResponse response = post("/link/token/create", body, LinkTokenCreateResponse.class, "link token create");
        return new LinkToken(response.linkToken(), response.expiration());
    }

    @Override
    public ExchangeResult exchangePublicToken(String publicToken) {
        ItemPublicTokenExchangeResponse exchange = post("/item/public_token/exchange",
                Map.of("public_token", publicToken), ItemPublicTokenExchangeResponse.class, "public token exchange");
        String accessToken = exchange.accessToken();
        ItemGetResponse item = post("/item/get", Map.of("access_token", accessToken), ItemGetResponse.class, "item get");
        String institutionId = item.item() != null ? item.item().institutionId() : null;
        return new ExchangeResult(accessToken, exchange.itemId(), institutionId, institutionName(institutionId));
    }

    @Override
    public List<AccountSnapshot> fetchBalances(String rawSecret) {
        AccountsBalanceResponse response = post("/accounts/balance/get", Map.of("access_token", rawSecret),
                AccountsBalanceResponse.class, "balance get");
        if (response.accounts() == null) {
            return List.of();
        }
        return response.accounts().stream().map(PlaidAggregatorClient::toSnapshot).toList();
    }

    @Override
    public TransactionsSyncPage syncTransactions(String rawSecret, String cursor) {
        var body = new LinkedHashMap<String, Object>();
        body.put("access_token", rawSecret);
        if (cursor != null && !cursor.isBlank()) {
            body.put("cursor", cursor);
        }
        body.put("count", SYNC_PAGE_SIZE);
        TransactionsSyncResponse response = post("/transactions/sync", body, TransactionsSyncResponse.class, "transactions sync");
        List<String> removed = response.removed() == null ? List.of() : response.removed().stream()
                .map(RemovedTransaction::transactionId)
                .toList();
        return new TransactionsSyncPage(
                toRecords(response.added()),
                toRecords(response.modified()),
                removed,
                response.nextCursor(),
                response.hasMore()
        );
    }

    @Override
    public void removeItem(String rawSecret) {
        post("/item/remove", Map.of("access_token", rawSecret), ItemRemoveResponse.class, "item remove");
    }

    private String institutionName(String institutionId) {
        if (institutionId == null || institutionId.isBlank()) {
            return null;
        }
        try {
            var body = new LinkedHashMap<String, Object>();
            body.put("institution_id", institutionId);
            body.put("country_codes", plaid.countryCodes());
            InstitutionGetResponse response = post("/institutions/get_by_id", body, InstitutionGetResponse.class, "institution get");
            return response.institution() != null ? response.institution().name() : null;
        } catch (AggregatorException ex) {
            log.warn("Institution name lookup failed for {}: {}", institutionId, ex.errorCode());
            return null;
        }
    }

    private <T> T post(String path, Map<String, Object> fields, Class<T> responseType, String operation) {
        var body = new LinkedHashMap<String, Object>();
        body.put("client_id", plaid.clientId());
        body.put("secret", plaid.clientSecret());
        body.putAll(fields);
        T response = webClient.post().uri(path)
                .bodyValue(body)
                .retrieve()
                .onStatus(HttpStatusCode::isError, PlaidAggregatorClient::toAggregatorError)
                .bodyToMono(responseType)
                .timeout(plaid.requestTimeout())
                .onErrorMap(WebClientRequestException.class,
                        ex -> new TransientAggregatorException("NETWORK_ERROR", "Plaid " + operation + " could not reach the aggregator", ex))
                .onErrorMap(TimeoutException.class,
                        ex -> new TransientAggregatorException("TIMEOUT", "Plaid " + operation + " timed out", ex))
                .onErrorMap(ex -> !(ex instanceof AggregatorException),
                        ex -> new TransientAggregatorException("UNEXPECTED_RESPONSE", "Plaid " + operation + " failed", ex))
                .retryWhen(retry)
                .doOnError(e -> log.warn("Plaid {} failed: {}", operation, e.getMessage()))
                .block();
        if (response == null) {
            throw new TransientAggregatorException("EMPTY_RESPONSE", "Plaid " + operation + " returned no body");
        }
        return response;
    }

    private static Mono<? extends Throwable> toAggregatorError(ClientResponse response) {
        int status = response.statusCode().value();
        return response.bodyToMono(PlaidError.class)
                .onErrorResume(ex -> Mono.empty())
                .defaultIfEmpty(new PlaidError(null, null, null, null))
                .map(error -> classify(status, error));
    }

    static AggregatorException classify(int status, PlaidError error) {
        String code = error.errorCode() != null ? error.errorCode() : "HTTP_" + status;
        String message = error.errorMessage() != null ? error.errorMessage() : "Plaid responded with HTTP " + status;
        if (LOGIN_REQUIRED_CODES.contains(code)) {
            return new ItemLoginRequiredException(code, message);
        }
        if (status == 429 || "RATE_LIMIT_EXCEEDED".equals(error.errorType())) {
            return new RateLimitedException(code, message);
        }
        if (status >= 500 || TRANSIENT_CODES.contains(code) || TRANSIENT_TYPES.contains(error.errorType())) {
            return new TransientAggregatorException(code, message);
        }
        return new ItemErrorException(code, message);
    }

    private static AccountSnapshot toSnapshot(PlaidAccount account) {
        PlaidBalances balances = account.balances();
        Balances mapped = balances == null ? new Balances(null, null, null, null) : new Balances(
                balances.available(),
                balances.current(),
                balances.limit(),
                balances.isoCurrencyCode() != null ? balances.isoCurrencyCode() : balances.unofficialCurrencyCode()
        );
        return new AccountSnapshot(null, null, account.accountId(), account.name(), account.officialName(),
                account.type(), account.subtype(), account.mask(), mapped);
    }

    private static List<TransactionRecord> toRecords(List<PlaidTransaction> transactions) {
        if (transactions == null) {
            return List.of();
        }
        return transactions.stream().map(PlaidAggregatorClient::toRecord).toList();
    }

    private static TransactionRecord toRecord(PlaidTransaction tx) {
        PlaidLocation loc = tx.location();
        PlaidPaymentMeta meta = tx.paymentMeta();
        return new TransactionRecord(
                tx.transactionId(),
                null,
                tx.accountId(),
                tx.amount(),
                tx.isoCurrencyCode() != null ? tx.isoCurrencyCode() : tx.unofficialCurrencyCode(),
                parseDate(tx.date()),
                parseDate(tx.authorizedDate()),
                tx.pending(),
                tx.name(),
                tx.category(),
                tx.merchantName(),
                loc == null ? null : new TransactionRecord.Location(loc.address(), loc.city(), loc.region(),
                        loc.postalCode(), loc.country(), loc.lat(), loc.lon(), loc.storeNumber()),
                meta == null ? null : new TransactionRecord.PaymentMeta(meta.referenceNumber(), meta.payee(),
                        meta.payer(), meta.paymentMethod(), meta.paymentProcessor(), meta.reason())
        );
    }

    private static LocalDate parseDate(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return LocalDate.parse(value);
        } catch (DateTimeParseException ex) {
            log.warn("Ignoring unparseable date '{}' from Plaid", value);
            return null;
        }
    }

    // --- Wire DTOs --- //
    @JsonIgnoreProperties(ignoreUnknown = true)
    record PlaidError(
            @JsonProperty("error_type") String errorType,
            @JsonProperty("error_code") String errorCode,
            @JsonProperty("error_message") String errorMessage,
            @JsonProperty("request_id") String requestId
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record LinkTokenCreateResponse(
            @JsonProperty("link_token") String linkToken,
            @JsonProperty("expiration") String expiration
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ItemPublicTokenExchangeResponse(
            @JsonProperty("access_token") String accessToken,
            @JsonProperty("item_id") String itemId
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ItemGetResponse(@JsonProperty("item") Item item) {
        @JsonIgnoreProperties(ignoreUnknown = true)
        record Item(
                @JsonProperty("item_id") String itemId,
                @JsonProperty("institution_id") String institutionId
        ) {}
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record InstitutionGetResponse(@JsonProperty("institution") Institution institution) {
        @JsonIgnoreProperties(ignoreUnknown = true)
        record Institution(
                @JsonProperty("institution_id") String institutionId,
                @JsonProperty("name") String name
        ) {}
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ItemRemoveResponse(@JsonProperty("request_id") String requestId) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record AccountsBalanceResponse(@JsonProperty("accounts") List<PlaidAccount> accounts) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record PlaidAccount(
            @JsonProperty("account_id") String accountId,
            @JsonProperty("name") String name,
            @JsonProperty("official_name") String officialName,
            @JsonProperty("type") String type,
            @JsonProperty("subtype") String subtype,
            @JsonProperty("mask") String mask,
            @JsonProperty("balances") PlaidBalances balances
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record PlaidBalances(
            @JsonProperty("available") BigDecimal available,
            @JsonProperty("current") BigDecimal current,
            @JsonProperty("limit") BigDecimal limit,
            @JsonProperty("iso_currency_code") String isoCurrencyCode,
            @JsonProperty("unofficial_currency_code") String unofficialCurrencyCode
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record TransactionsSyncResponse(
            @JsonProperty("added") List<PlaidTransaction> added,
            @JsonProperty("modified") List<PlaidTransaction> modified,
            @JsonProperty("removed") List<RemovedTransaction> removed,
            @JsonProperty("next_cursor") String nextCursor,
            @JsonProperty("has_more") boolean hasMore
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record RemovedTransaction(@JsonProperty("transaction_id") String transactionId) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record PlaidTransaction(
            @JsonProperty("transaction_id") String transactionId,
            @JsonProperty("account_id") String accountId,
            @JsonProperty("amount") BigDecimal amount,
            @JsonProperty("iso_currency_code") String isoCurrencyCode,
            @JsonProperty("unofficial_currency_code") String unofficialCurrencyCode,
            @JsonProperty("date") String date,
            @JsonProperty("authorized_date") String authorizedDate,
            @JsonProperty("pending") boolean pending,
            @JsonProperty("name") String name,
            @JsonProperty("category") List<String> category,
            @JsonProperty("merchant_name") String merchantName,
            @JsonProperty("location") PlaidLocation location,
            @JsonProperty("payment_meta") PlaidPaymentMeta paymentMeta
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record PlaidLocation(
            @JsonProperty("address") String address,
            @JsonProperty("city") String city,
            @JsonProperty("region") String region,
            @JsonProperty("postal_code") String postalCode,
            @JsonProperty("country") String country,
            @JsonProperty("lat") Double lat,
            @JsonProperty("lon") Double lon,
            @JsonProperty("store_number") String storeNumber
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record PlaidPaymentMeta(
            @JsonProperty("reference_number") String referenceNumber,
            @JsonProperty("payee") String payee,
            @JsonProperty("payer") String payer,
            @JsonProperty("payment_method") String paymentMethod,
            @JsonProperty("payment_processor") String paymentProcessor,
            @JsonProperty("reason") String reason
    ) {}
}
