package com.touristtax.reservation.api.dto;

import com.touristtax.reservation.domain.model.Currency;
import com.touristtax.reservation.domain.model.Payment;
import com.touristtax.reservation.domain.model.PaymentStatus;

import java.math.BigDecimal;
import java.time.LocalDateTime;

public record PaymentResponse(
        String paymentId,
        String reservationId,
        PaymentStatus status,
        String redirectUrl,
        BigDecimal amount,
        Currency currency,
        LocalDateTime createdAt,
        LocalDateTime expiresAt
) {
    public static PaymentResponse from(Payment payment) {
        return new PaymentResponse(
                payment.getId(),
                payment.getReservationId(),
                payment.getStatus(),
                payment.getPaymentUrl(),
                payment.getAmount(),
                payment.getCurrency(),
                payment.getCreatedAt(),
                payment.getExpiresAt()
        );
    }
}
