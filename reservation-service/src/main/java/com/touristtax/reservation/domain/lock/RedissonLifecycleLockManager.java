package com.touristtax.reservation.domain.lock;

import com.touristtax.common.exception.ServiceUnavailableException;
import com.touristtax.common.util.Constants;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Redis-backed lock for deployments running more than one replica.
 * The lease bounds how long a crashed holder can block others.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "tourist-tax.lock.type", havingValue = "redisson")
public class RedissonLifecycleLockManager implements LifecycleLockManager {

    private final RedissonClient redissonClient;
    private final long waitSeconds;
    private final long leaseSeconds;

    public RedissonLifecycleLockManager(RedissonClient redissonClient,
                                        @Value("${tourist-tax.lock.wait-seconds:5}") long waitSeconds,
                                        @Value("${tourist-tax.lock.lease-seconds:30}") long leaseSeconds) {
        this.redissonClient = redissonClient;
        this.waitSeconds = waitSeconds;
        this.leaseSeconds = leaseSeconds;
    }

    @Override
    public <T> T executeWithLock(String reservationId, Supplier<T> action) {
        String lockKey = Constants.LOCK_PREFIX + reservationId;
        RLock lock = redissonClient.getLock(lockKey);
        try {
            if (!lock.tryLock(waitSeconds, leaseSeconds, TimeUnit.SECONDS)) {
                log.warn("Timed out waiting for distributed lock {}", lockKey);
                throw new ServiceUnavailableException("Reservation " + reservationId + " is busy, please try again");
            }
            log.debug("Acquired distributed lock: {}", lockKey);
            return action.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ServiceUnavailableException("Interrupted while waiting for reservation " + reservationId, e);
        } finally {
            if (lock.isHeldByCurrentThread()) {
                lock.unlock();
                log.debug("Released distributed lock: {}", lockKey);
            }
        }
    }
}
