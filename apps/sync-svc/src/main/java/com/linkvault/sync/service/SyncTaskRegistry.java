package com.linkvault.sync.service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Tracks which connection syncs are running so revocation can stop them. While a connection is closed every new
 * sync for it starts already cancelled; revocation closes it for its own duration and reopens it afterwards,
 * whether or not the revoke committed.
 */
@Component
public class SyncTaskRegistry {

    private static final Logger log = LoggerFactory.getLogger(SyncTaskRegistry.class);

    private final ConcurrentMap<String, Set<CancellationToken>> running = new ConcurrentHashMap<>();
    private final Set<String> closed = ConcurrentHashMap.newKeySet();

    public CancellationToken begin(UUID userId, String connectionId) {
        String key = key(userId, connectionId);
        CancellationToken token = new CancellationToken(connectionId);
        running.computeIfAbsent(key, k -> ConcurrentHashMap.newKeySet()).add(token);
        if (closed.contains(key)) {
            token.cancel();
        }
        return token;
    }

    public void finish(UUID userId, String connectionId, CancellationToken token) {
        token.finish();
        running.computeIfPresent(key(userId, connectionId), (k, tokens) -> {
            tokens.remove(token);
            return tokens.isEmpty() ? null : tokens;
        });
    }

    /**
     * Cancels every running sync of the connection and waits for them to stop.
     *
     * @return {@code false} if some sync was still running when the timeout elapsed
     */
    public boolean cancelAndAwait(UUID userId, String connectionId, Duration timeout) {
        String key = key(userId, connectionId);
        closed.add(key);
        Set<CancellationToken> tokens = running.get(key);
        if (tokens == null || tokens.isEmpty()) {
            return true;
        }
        List<CancellationToken> snapshot = List.copyOf(tokens);
        snapshot.forEach(CancellationToken::cancel);
        log.debug("Cancelled {} running sync(s) of connection {}", snapshot.size(), connectionId);
        Instant deadline = Instant.now().plus(timeout);
        try {
            for (CancellationToken token : snapshot) {
                Duration remaining = Duration.between(Instant.now(), deadline);
                if (remaining.isNegative() || !token.awaitFinish(remaining)) {
                    return false;
                }
            }
            return true;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public void reopen(UUID userId, String connectionId) {
        closed.remove(key(userId, connectionId));
    }

    public boolean isRunning(UUID userId, String connectionId) {
        Set<CancellationToken> tokens = running.get(key(userId, connectionId));
        return tokens != null && !tokens.isEmpty();
    }

    private static String key(UUID userId, String connectionId) {
        return userId + "/" + connectionId;
    }
}
