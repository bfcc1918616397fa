package com.touristtax.reservation.exception;

public class InvalidQuantityException extends ValidationException {

    public InvalidQuantityException(String field, long value, int min, int max) {
        super(field,
                String.format("%s must be between %d and %d but was %d", field, min, max, value),
                "INVALID_QUANTITY");
    }
}
