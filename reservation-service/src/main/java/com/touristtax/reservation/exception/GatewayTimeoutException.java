package com.touristtax.reservation.exception;

import com.touristtax.common.exception.UpstreamServiceException;
import org.springframework.http.HttpStatus;

public class GatewayTimeoutException extends UpstreamServiceException {

    public GatewayTimeoutException(String message, Throwable cause) {
        super(message, cause, HttpStatus.GATEWAY_TIMEOUT, "GATEWAY_TIMEOUT");
    }
}
