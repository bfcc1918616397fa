package com.touristtax.reservation.api.dto;

import com.touristtax.reservation.domain.model.Currency;
import com.touristtax.reservation.domain.model.Payment;
import com.touristtax.reservation.domain.model.PaymentStatus;

import java.math.BigDecimal;
import java.time.LocalDateTime;

public record PaymentStatusResponse(
        String paymentId,
        String reservationId,
        PaymentStatus status,
        String message,
        BigDecimal amount,
        Currency currency,
        String transactionId,
        String receiptUrl,
        String failureReason,
        LocalDateTime expiresAt,
        LocalDateTime lastUpdated
) {
    public static PaymentStatusResponse from(Payment payment) {
        return new PaymentStatusResponse(
                payment.getId(),
                payment.getReservationId(),
                payment.getStatus(),
                payment.getStatus().description(),
                payment.getAmount(),
                payment.getCurrency(),
                payment.getTransactionId(),
                payment.getReceiptUrl(),
                payment.getFailureReason(),
                payment.getExpiresAt(),
                payment.getUpdatedAt()
        );
    }
}
