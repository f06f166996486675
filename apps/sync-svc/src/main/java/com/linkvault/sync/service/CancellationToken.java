package com.linkvault.sync.service;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Cooperative cancellation for one running connection sync. The sync polls {@link #throwIfCancelled()} between
 * aggregator calls and signals {@link #finish()} once it has stopped touching storage.
 */
public final class CancellationToken {

    private final String connectionId;
    private final CountDownLatch finished = new CountDownLatch(1);
    private volatile boolean cancelled;

    CancellationToken(String connectionId) {
        this.connectionId = connectionId;
    }

    public static CancellationToken detached(String connectionId) {
        return new CancellationToken(connectionId);
    }

    public void cancel() {
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public void throwIfCancelled() {
        if (cancelled) {
            throw new SyncCancelledException("Sync of connection " + connectionId + " was cancelled");
        }
    }

    void finish() {
        finished.countDown();
    }

    boolean awaitFinish(Duration timeout) throws InterruptedException {
        return finished.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }
}
