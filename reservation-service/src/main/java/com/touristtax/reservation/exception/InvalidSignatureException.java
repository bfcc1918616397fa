package com.touristtax.reservation.exception;

import com.touristtax.common.exception.BusinessException;

public class InvalidSignatureException extends BusinessException {

    public InvalidSignatureException(String paymentId) {
        super(String.format("Webhook signature verification failed for payment %s", paymentId),
                "INVALID_SIGNATURE");
    }
}
