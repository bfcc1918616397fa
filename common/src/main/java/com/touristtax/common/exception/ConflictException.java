package com.touristtax.common.exception;

/**
 * The request is well-formed but incompatible with the current state of the resource.
 * Mapped to HTTP 409.
 */
public class ConflictException extends BusinessException {

    public ConflictException(String message, String errorCode) {
        super(message, errorCode);
    }

    public ConflictException(String message, Throwable cause, String errorCode) {
        super(message, cause, errorCode);
    }
}
