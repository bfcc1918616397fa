package com.touristtax.reservation.domain.lock;

import com.touristtax.common.exception.ServiceUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * In-process lock striped over a fixed pool of {@link ReentrantLock}s.
 * Two reservations may share a stripe; that only costs some parallelism.
 * Only correct for a single replica; use the Redisson manager otherwise.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "tourist-tax.lock.type", havingValue = "local", matchIfMissing = true)
public class LocalLifecycleLockManager implements LifecycleLockManager {

    private static final int STRIPES = 64;

    private final ReentrantLock[] stripes = new ReentrantLock[STRIPES];
    private final long waitMillis;

    public LocalLifecycleLockManager(@Value("${tourist-tax.lock.wait-seconds:5}") long waitSeconds) {
        this.waitMillis = TimeUnit.SECONDS.toMillis(waitSeconds);
        for (int i = 0; i < STRIPES; i++) {
            stripes[i] = new ReentrantLock();
        }
    }

    @Override
    public <T> T executeWithLock(String reservationId, Supplier<T> action) {
        ReentrantLock lock = stripes[Math.floorMod(reservationId.hashCode(), STRIPES)];
        boolean acquired;
        try {
            acquired = lock.tryLock(waitMillis, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ServiceUnavailableException("Interrupted while waiting for reservation " + reservationId, e);
        }
        if (!acquired) {
            log.warn("Timed out waiting for lock on reservation {}", reservationId);
            throw new ServiceUnavailableException("Reservation " + reservationId + " is busy, please try again");
        }
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}
