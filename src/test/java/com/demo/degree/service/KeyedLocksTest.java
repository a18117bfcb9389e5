package com.demo.degree.service;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class KeyedLocksTest {

    @Test
    void shouldSerializeSameKey() throws Exception {
        KeyedLocks locks = new KeyedLocks(8);
        AtomicInteger inside = new AtomicInteger();
        AtomicInteger maxInside = new AtomicInteger();
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<Integer>> futures = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return locks.withLock("degree:1", () -> {
                        int now = inside.incrementAndGet();
                        maxInside.accumulateAndGet(now, Math::max);
                        Thread.onSpinWait();
                        return inside.decrementAndGet();
                    });
                }));
            }
            start.countDown();
            for (Future<Integer> f : futures) f.get(10, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }
        assertThat(maxInside.get()).isEqualTo(1);
    }

    @Test
    void shouldReleaseLockWhenActionThrows() {
        KeyedLocks locks = new KeyedLocks(1);

        assertThatThrownBy(() -> locks.withLock("k", () -> {
            throw new IllegalStateException("boom");
        })).hasMessage("boom");
        assertThat(locks.withLock("k", () -> "ok")).isEqualTo("ok");
    }

    @Test
    void shouldRequireAtLeastOneStripe() {
        assertThatThrownBy(() -> new KeyedLocks(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
