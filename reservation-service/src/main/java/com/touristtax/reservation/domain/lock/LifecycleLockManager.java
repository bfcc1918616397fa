package com.touristtax.reservation.domain.lock;

import java.util.function.Supplier;

/**
 * Serializes read-validate-write sequences on one reservation.
 * Payment updates lock through the reservation that owns the payment.
 */
public interface LifecycleLockManager {

    /**
     * Runs {@code action} while holding the lock for {@code reservationId}.
     *
     * @throws com.touristtax.common.exception.ServiceUnavailableException if the lock is not acquired in time
     */
    <T> T executeWithLock(String reservationId, Supplier<T> action);
}
