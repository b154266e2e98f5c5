package com.mobifone.updatecenter.utils;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class ReconcilerRegistryTest {

    private final ReconcilerRegistry registry = new ReconcilerRegistry();

    @Test
    void secondRegistrationForSameBatchIsRejected() {
        Instant deadline = Instant.now().plusSeconds(60);
        assertThat(registry.register("b1", "h1", deadline)).isTrue();
        assertThat(registry.register("b1", "h2", deadline)).isFalse();
        assertThat(registry.get("b1").getProgressHandle()).isEqualTo("h1");
        assertThat(registry.register("b2", "h3", deadline)).isTrue();
        assertThat(registry.snapshot()).containsOnlyKeys("b1", "b2");
    }

    @Test
    void releaseAllowsANewRegistration() {
        registry.register("b1", "h1", Instant.now());
        registry.release("b1");
        assertThat(registry.isActive("b1")).isFalse();
        assertThat(registry.register("b1", "h2", Instant.now())).isTrue();
    }

    @Test
    void concurrentRegistrationsYieldExactlyOneWinner() throws Exception {
        int threads = 16;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch go = new CountDownLatch(1);
        AtomicInteger winners = new AtomicInteger();
        try {
            for (int i = 0; i < threads; i++) {
                String handle = "h" + i;
                pool.submit(() -> {
                    go.await();
                    if (registry.register("batch", handle, Instant.now())) winners.incrementAndGet();
                    return null;
                });
            }
            go.countDown();
            pool.shutdown();
            assertThat(pool.awaitTermination(5, TimeUnit.SECONDS)).isTrue();
        } finally {
            pool.shutdownNow();
        }
        assertThat(winners.get()).isEqualTo(1);
    }
}
