package com.touristtax.reservation.api.dto;

import com.touristtax.reservation.domain.model.PaymentStatus;

/**
 * Outcome of a webhook delivery. {@code applied} is false for duplicates and for
 * late deliveries that found the payment already expired.
 */
public record WebhookResult(
        String paymentId,
        PaymentStatus status,
        boolean applied,
        String message
) {
}
