package com.touristtax.reservation.exception;

import com.touristtax.common.exception.ConflictException;

/**
 * The requested operation is not allowed for the resource's current lifecycle state.
 */
public class InvalidStateException extends ConflictException {

    public InvalidStateException(String message) {
        super(message, "INVALID_STATE");
    }
}
