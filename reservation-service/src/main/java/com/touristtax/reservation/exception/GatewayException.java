package com.touristtax.reservation.exception;

import com.touristtax.common.exception.UpstreamServiceException;
import org.springframework.http.HttpStatus;

/**
 * The payment gateway failed or answered with something we cannot use.
 * Message is stable for callers; the gateway's own error is only kept as the cause.
 */
public class GatewayException extends UpstreamServiceException {

    public GatewayException(String message) {
        super(message, null, HttpStatus.BAD_GATEWAY, "GATEWAY_ERROR");
    }

    public GatewayException(String message, Throwable cause) {
        super(message, cause, HttpStatus.BAD_GATEWAY, "GATEWAY_ERROR");
    }
}
