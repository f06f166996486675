package com.linkvault.sync.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.linkvault.sync.TestFixtures;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.IntStream;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class ConnectionFanOutTest {

    private final ExecutorService executor = Executors.newFixedThreadPool(8);

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void boundsConcurrencyAndKeepsOrder() {
        ConnectionFanOut fanOut = new ConnectionFanOut(executor, TestFixtures.properties(Duration.ofHours(1), 2, 10));
        AtomicInteger running = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        List<Integer> items = IntStream.range(0, 8).boxed().toList();

        List<ConnectionFanOut.Outcome<Integer, Integer>> outcomes = fanOut.run(items, item -> {
            peak.accumulateAndGet(running.incrementAndGet(), Math::max);
            try {
                Thread.sleep(20);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
            running.decrementAndGet();
            return item * 10;
        });

        assertThat(peak.get()).isLessThanOrEqualTo(2);
        assertThat(outcomes).extracting(ConnectionFanOut.Outcome::value).containsExactly(0, 10, 20, 30, 40, 50, 60, 70);
    }

    @Test
    void oneFailureDoesNotAffectSiblings() {
        ConnectionFanOut fanOut = new ConnectionFanOut(executor, TestFixtures.properties());

        List<ConnectionFanOut.Outcome<String, String>> outcomes = fanOut.run(List.of("ok", "bad", "fine"), item -> {
            if (item.equals("bad")) {
                throw new IllegalStateException("boom");
            }
            return item.toUpperCase();
        });

        assertThat(outcomes.get(0).value()).isEqualTo("OK");
        assertThat(outcomes.get(1).succeeded()).isFalse();
        assertThat(outcomes.get(1).failure()).hasMessage("boom");
        assertThat(outcomes.get(2).value()).isEqualTo("FINE");
    }
}
