package com.touristtax.common.exception;

import lombok.Getter;

/**
 * A reservation is held by another request for longer than the lock wait allows,
 * or the lock service itself cannot be reached. Mapped to HTTP 503 with a retry hint.
 */
@Getter
public class ServiceUnavailableException extends RuntimeException {

    public static final int DEFAULT_RETRY_AFTER_SECONDS = 1;

    private final String errorCode = "RESERVATION_BUSY";
    private final int retryAfterSeconds;

    public ServiceUnavailableException(String message) {
        this(message, null);
    }

    public ServiceUnavailableException(String message, Throwable cause) {
        super(message, cause);
        this.retryAfterSeconds = DEFAULT_RETRY_AFTER_SECONDS;
    }
}
