package com.touristtax.reservation.domain.lock;

import com.touristtax.common.exception.ServiceUnavailableException;
import org.junit.jupiter.api.DisplayName;
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

class LocalLifecycleLockManagerTest {

    @Test
    @DisplayName("actions on the same reservation never overlap")
    void sameKey_isSerialized() throws Exception {
        LocalLifecycleLockManager lockManager = new LocalLifecycleLockManager(5);
        AtomicInteger inside = new AtomicInteger();
        AtomicInteger maxInside = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(6);
        List<Future<Integer>> futures = new ArrayList<>();

        try {
            for (int i = 0; i < 6; i++) {
                futures.add(executor.submit(() -> lockManager.executeWithLock("reservation-1", () -> {
                    int now = inside.incrementAndGet();
                    maxInside.accumulateAndGet(now, Math::max);
                    sleep(20);
                    inside.decrementAndGet();
                    return now;
                })));
            }
            for (Future<Integer> future : futures) {
                future.get(5, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertThat(maxInside.get()).isEqualTo(1);
    }

    @Test
    @DisplayName("lock wait timeout surfaces as service unavailable")
    void timeout_isServiceUnavailable() throws Exception {
        LocalLifecycleLockManager lockManager = new LocalLifecycleLockManager(0);
        CountDownLatch held = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        Thread holder = new Thread(() -> lockManager.executeWithLock("reservation-1", () -> {
            held.countDown();
            await(release);
            return null;
        }));
        holder.start();

        try {
            assertThat(held.await(5, TimeUnit.SECONDS)).isTrue();
            assertThatThrownBy(() -> lockManager.executeWithLock("reservation-1", () -> "never"))
                    .isInstanceOf(ServiceUnavailableException.class);
        } finally {
            release.countDown();
            holder.join(5000);
        }
    }

    @Test
    @DisplayName("the lock is released when the action throws")
    void releasedOnException() {
        LocalLifecycleLockManager lockManager = new LocalLifecycleLockManager(0);

        assertThatThrownBy(() -> lockManager.executeWithLock("reservation-1", () -> {
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class);

        assertThat(lockManager.executeWithLock("reservation-1", () -> "ok")).isEqualTo("ok");
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void await(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
