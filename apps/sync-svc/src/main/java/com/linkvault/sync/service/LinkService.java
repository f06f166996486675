package com.linkvault.sync.service;

import com.linkvault.sync.aggregator.AggregatorClient;
import com.linkvault.sync.aggregator.AggregatorException;
import com.linkvault.sync.aggregator.ExchangeResult;
import com.linkvault.sync.aggregator.LinkToken;
import com.linkvault.sync.connection.ConnectionRegistry;
import com.linkvault.sync.connection.ConnectionView;
import com.linkvault.sync.connection.DuplicateConnectionException;
import com.linkvault.sync.connection.InstitutionInfo;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class LinkService {

    private static final Logger log = LoggerFactory.getLogger(LinkService.class);

    private final AggregatorClient aggregator;
    private final ConnectionRegistry registry;
    private final SyncTaskRegistry syncTasks;
    private final AccountSyncEngine accountSync;
    private final TransactionSyncEngine transactionSync;

    public LinkService(
            AggregatorClient aggregator,
            ConnectionRegistry registry,
            SyncTaskRegistry syncTasks,
            AccountSyncEngine accountSync,
            TransactionSyncEngine transactionSync
    ) {
        this.aggregator = aggregator;
        this.registry = registry;
        this.syncTasks = syncTasks;
        this.accountSync = accountSync;
        this.transactionSync = transactionSync;
    }

    public LinkToken createLinkToken(UUID userId) {
        return aggregator.createLinkToken(userId);
    }

    /**
     * Exchanges the public token, stores the sealed secret and kicks off the first transaction sync in the
     * background. The accounts snapshot is marked stale so the next read includes the new institution.
     *
     * @throws DuplicateConnectionException when the same institution and accounts are already linked
     */
    public ConnectionView exchangePublicToken(UUID userId, String publicToken, List<String> accountMasks) {
        if (publicToken == null || publicToken.isBlank()) {
            throw new IllegalArgumentException("public_token must be provided");
        }
        ExchangeResult exchange = aggregator.exchangePublicToken(publicToken);
        InstitutionInfo institution = new InstitutionInfo(exchange.itemId(), exchange.institutionId(),
                exchange.institutionName(), accountMasks);
        String connectionId;
        try {
            connectionId = registry.createConnection(userId, institution, exchange.rawSecret());
        } catch (DuplicateConnectionException ex) {
            if (!ex.existingConnectionId().equals(exchange.itemId())) {
                discardItem(exchange);
            }
            throw ex;
        }
        syncTasks.reopen(userId, connectionId);
        accountSync.markStale(userId);
        return transactionSync.startInitialSync(userId, connectionId);
    }

    private void discardItem(ExchangeResult exchange) {
        try {
            aggregator.removeItem(exchange.rawSecret());
            log.info("Removed duplicate item {} upstream", exchange.itemId());
        } catch (AggregatorException ex) {
            log.warn("Could not remove duplicate item {} upstream ({})", exchange.itemId(), ex.errorCode());
        }
    }
}
