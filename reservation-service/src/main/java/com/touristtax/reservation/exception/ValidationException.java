package com.touristtax.reservation.exception;

import com.touristtax.common.exception.BusinessException;
import com.touristtax.common.util.Constants;
import lombok.Getter;

/**
 * Input is malformed or out of range; the caller can correct it.
 * {@code field} names the offending request field when there is one.
 */
@Getter
public class ValidationException extends BusinessException {

    private final String field;

    public ValidationException(String field, String message) {
        super(message, Constants.ERROR_VALIDATION);
        this.field = field;
    }

    protected ValidationException(String field, String message, String errorCode) {
        super(message, errorCode);
        this.field = field;
    }
}
