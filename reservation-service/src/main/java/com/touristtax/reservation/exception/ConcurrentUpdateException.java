package com.touristtax.reservation.exception;

import com.touristtax.common.exception.ConflictException;

/**
 * Another writer changed the record between our read and our write.
 */
public class ConcurrentUpdateException extends ConflictException {

    public ConcurrentUpdateException(String resourceId, Throwable cause) {
        super(String.format("Reservation %s was modified concurrently, retry the request", resourceId),
                cause, "CONCURRENT_UPDATE");
    }
}
