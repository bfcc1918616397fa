package com.touristtax.common.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Failure of a third-party system we depend on.
 * The message is stable and safe to show; upstream details travel only as the cause.
 */
@Getter
public class UpstreamServiceException extends RuntimeException {

    private final HttpStatus status;
    private final String errorCode;

    public UpstreamServiceException(String message, Throwable cause, HttpStatus status, String errorCode) {
        super(message, cause);
        this.status = status;
        this.errorCode = errorCode;
    }
}
