package com.touristtax.reservation.exception;

/**
 * The gateway refused the call outright (bad request or credentials).
 * Repeating the same call cannot succeed, so it is excluded from retries.
 */
public class GatewayRejectedException extends GatewayException {

    public GatewayRejectedException(String message, Throwable cause) {
        super(message, cause);
    }
}
