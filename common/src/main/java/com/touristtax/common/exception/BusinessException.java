package com.touristtax.common.exception;

import lombok.Getter;

/**
 * Root of the domain exception hierarchy.
 * Unless a subclass says otherwise, the caller can fix the request and try again (HTTP 400).
 */
@Getter
public class BusinessException extends RuntimeException {
    private final String errorCode;

    public BusinessException(String message, String errorCode) {
        super(message);
        this.errorCode = errorCode;
    }

    public BusinessException(String message, Throwable cause, String errorCode) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
