package com.linkvault.sync.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class SingleFlightTest {

    private final SingleFlight<String, Integer> flight = new SingleFlight<>();

    @Test
    void concurrentCallersShareResult() throws Exception {
        AtomicInteger executions = new AtomicInteger();
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(3);
        try {
            Future<Integer> leader = pool.submit(() -> flight.execute("k", () -> {
                started.countDown();
                await(release);
                return executions.incrementAndGet();
            }));
            assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
            assertThat(flight.isInFlight("k")).isTrue();
            Future<Integer> follower = pool.submit(() -> flight.execute("k", executions::incrementAndGet));
            Thread.sleep(100);
            release.countDown();

            assertThat(leader.get(5, TimeUnit.SECONDS)).isEqualTo(1);
            assertThat(follower.get(5, TimeUnit.SECONDS)).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }
        assertThat(executions.get()).isEqualTo(1);
        assertThat(flight.isInFlight("k")).isFalse();
    }

    @Test
    void failureIsPropagatedAndNotCached() {
        assertThatThrownBy(() -> flight.execute("k", () -> {
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class).hasMessage("boom");

        assertThat(flight.execute("k", () -> 7)).isEqualTo(7);
    }

    @Test
    void differentKeysRunIndependently() {
        assertThat(flight.execute("a", () -> 1)).isEqualTo(1);
        assertThat(flight.execute("b", () -> 2)).isEqualTo(2);
    }

    private static void await(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(ex);
        }
    }
}
