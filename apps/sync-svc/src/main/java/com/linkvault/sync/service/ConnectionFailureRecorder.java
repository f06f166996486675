package com.linkvault.sync.service;

import com.linkvault.sync.aggregator.AggregatorException;
import com.linkvault.sync.aggregator.ItemErrorException;
import com.linkvault.sync.aggregator.ItemLoginRequiredException;
import com.linkvault.sync.aggregator.RateLimitedException;
import com.linkvault.sync.connection.BankConnection;
import com.linkvault.sync.connection.ConnectionRegistry;
import com.linkvault.sync.connection.ConnectionStatus;
import com.linkvault.sync.model.ConnectionFailure;
import com.linkvault.sync.security.CredentialException;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Translates a failure that belongs to a single connection into that connection's new status and a
 * {@link ConnectionFailure} entry. Other failures (storage, cancellation) are not connection-scoped and are left
 * to the caller.
 */
@Component
public class ConnectionFailureRecorder {

    private static final Logger log = LoggerFactory.getLogger(ConnectionFailureRecorder.class);

    static final String CREDENTIAL_REASON = "stored credential could not be decrypted";

    private final ConnectionRegistry registry;
    private final Clock clock;

    @Autowired
    public ConnectionFailureRecorder(ConnectionRegistry registry) {
        this(registry, Clock.systemUTC());
    }

    ConnectionFailureRecorder(ConnectionRegistry registry, Clock clock) {
        this.registry = registry;
        this.clock = clock;
    }

    public static boolean isConnectionFailure(Throwable failure) {
        return failure instanceof AggregatorException || failure instanceof CredentialException;
    }

    /**
     * Classifies the failure without touching any state.
     */
    public ConnectionFailure describe(BankConnection connection, RuntimeException failure) {
        if (failure instanceof ItemLoginRequiredException) {
            return failure(connection, ConnectionStatus.LOGIN_REQUIRED, "institution requires the user to log in again");
        }
        if (failure instanceof CredentialException) {
            return failure(connection, ConnectionStatus.ERROR, CREDENTIAL_REASON);
        }
        if (failure instanceof ItemErrorException itemError) {
            return failure(connection, ConnectionStatus.ERROR, itemError.errorCode() + ": " + itemError.getMessage());
        }
        if (failure instanceof RateLimitedException) {
            return failure(connection, ConnectionStatus.ACTIVE, "rate limited by the aggregator, retry later");
        }
        if (failure instanceof AggregatorException aggregatorError) {
            return failure(connection, ConnectionStatus.ACTIVE, "institution temporarily unavailable (" + aggregatorError.errorCode() + ")");
        }
        throw new IllegalArgumentException("not a connection failure: " + failure.getClass().getName());
    }

    /**
     * Classifies the failure, moves the connection to the matching status and stamps the failed sync.
     */
    public ConnectionFailure record(BankConnection connection, SyncKind kind, RuntimeException failure) {
        ConnectionFailure described = describe(connection, failure);
        String connectionId = connection.connectionId();
        switch (described.status()) {
            case LOGIN_REQUIRED -> registry.markLoginRequired(connection.ownerUserId(), connectionId, described.reason());
            case ERROR -> registry.markError(connection.ownerUserId(), connectionId, described.reason());
            default -> {
                // transient: connection stays active
            }
        }
        recordSyncFailure(connection, kind, described.reason());
        log.warn("{} sync of connection {} failed ({}): {}", kind, connectionId, described.status().wireValue(), described.reason());
        return described;
    }

    public void recordSyncFailure(BankConnection connection, SyncKind kind, String reason) {
        if (kind == SyncKind.ACCOUNTS) {
            registry.recordAccountSync(connection.ownerUserId(), connection.connectionId(), info -> info.failed(clock.instant(), reason));
        } else {
            registry.recordTransactionSync(connection.ownerUserId(), connection.connectionId(), info -> info.failed(clock.instant(), reason));
        }
    }

    private static ConnectionFailure failure(BankConnection connection, ConnectionStatus status, String reason) {
        return new ConnectionFailure(connection.connectionId(), connection.institutionName(), status, reason);
    }
}
