package com.touristtax.reservation.events;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Published after a payment transition commits. Consumers use it to send receipts.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaymentStatusChangedEvent {
    private String paymentId;
    private String reservationId;
    private String previousStatus;
    private String status;
    private BigDecimal amount;
    private String currency;
    private String transactionId;
    private String failureReason;
    private Instant timestamp;
}
