package com.linkvault.sync.service;

import com.linkvault.sync.config.LinkvaultProperties;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.Semaphore;
import java.util.function.Function;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Runs one task per connection on the sync executor, at most {@code min(items, max-concurrency)} at a time. Each
 * task's result or failure is captured separately; no failure cancels its siblings.
 */
@Component
public class ConnectionFanOut {

    private final Executor executor;
    private final int maxConcurrency;

    public ConnectionFanOut(@Qualifier("syncExecutor") Executor executor, LinkvaultProperties properties) {
        this.executor = executor;
        this.maxConcurrency = properties.sync().maxConcurrency();
    }

    public <T, R> List<Outcome<T, R>> run(List<T> items, Function<T, R> task) {
        if (items.isEmpty()) {
            return List.of();
        }
        Semaphore permits = new Semaphore(Math.min(items.size(), maxConcurrency));
        List<CompletableFuture<R>> futures = new ArrayList<>(items.size());
        for (T item : items) {
            try {
                permits.acquire();
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                throw new SyncCancelledException("Interrupted while scheduling connection work");
            }
            CompletableFuture<R> future;
            try {
                future = CompletableFuture.supplyAsync(() -> task.apply(item), executor);
            } catch (RuntimeException ex) {
                permits.release();
                throw ex;
            }
            future.whenComplete((value, failure) -> permits.release());
            futures.add(future);
        }
        List<Outcome<T, R>> outcomes = new ArrayList<>(items.size());
        for (int i = 0; i < items.size(); i++) {
            outcomes.add(collect(items.get(i), futures.get(i)));
        }
        return outcomes;
    }

    private static <T, R> Outcome<T, R> collect(T item, CompletableFuture<R> future) {
        try {
            return new Outcome<>(item, future.join(), null);
        } catch (CompletionException ex) {
            Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
            RuntimeException failure = cause instanceof RuntimeException runtime
                    ? runtime
                    : new IllegalStateException("Connection task failed", cause);
            return new Outcome<>(item, null, failure);
        }
    }

    public record Outcome<T, R>(T item, R value, RuntimeException failure) {
        public boolean succeeded() {
            return failure == null;
        }
    }
}
