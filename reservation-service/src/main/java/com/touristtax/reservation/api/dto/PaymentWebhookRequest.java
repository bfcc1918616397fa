package com.touristtax.reservation.api.dto;

import com.touristtax.reservation.domain.model.Currency;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.math.BigDecimal;

/**
 * Status notification pushed by the payment gateway.
 * {@code status} is kept as the raw gateway string because it is part of the signed content.
 */
public record PaymentWebhookRequest(
        @NotBlank(message = "Payment ID cannot be blank")
        String paymentId,

        @NotBlank(message = "Status cannot be blank")
        String status,

        @NotNull(message = "Amount cannot be null")
        BigDecimal amount,

        @NotNull(message = "Currency cannot be null")
        Currency currency,

        String transactionId,

        @NotBlank(message = "Timestamp cannot be blank")
        String timestamp,

        String signature
) {
}
