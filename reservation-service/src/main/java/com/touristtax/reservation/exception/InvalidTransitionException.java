package com.touristtax.reservation.exception;

import com.touristtax.common.exception.ConflictException;

public class InvalidTransitionException extends ConflictException {

    public InvalidTransitionException(String resourceType, String id, Enum<?> from, Enum<?> to) {
        super(String.format("Invalid status transition for %s %s from %s to %s", resourceType, id, from, to),
                "INVALID_TRANSITION");
    }
}
