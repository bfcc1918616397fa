package com.touristtax.reservation.domain.model;

import com.touristtax.reservation.exception.InvalidTransitionException;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * One attempt to collect a reservation's tax through the gateway.
 * Amount and currency are copied from the reservation when the attempt starts.
 */
@Entity
@Table(name = "payments", indexes = {
        @Index(name = "idx_payments_reservation_id", columnList = "reservation_id"),
        @Index(name = "idx_payments_provider_payment_id", columnList = "provider_payment_id")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Payment {

    @Id
    @Column(length = 40)
    private String id;

    @Column(name = "reservation_id", nullable = false, length = 36)
    private String reservationId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private PaymentStatus status;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal amount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 3)
    private Currency currency;

    @Column(name = "order_reference", nullable = false, length = 64)
    private String orderReference;

    @Column(name = "provider_payment_id")
    private String providerPaymentId;

    @Column(name = "payment_url", length = 1024)
    private String paymentUrl;

    @Column(name = "transaction_id")
    private String transactionId;

    @Column(name = "receipt_url", length = 1024)
    private String receiptUrl;

    @Column(name = "failure_reason")
    private String failureReason;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @Column(name = "expires_at", nullable = false)
    private LocalDateTime expiresAt;

    @Version
    private Long version;

    public void advanceTo(PaymentStatus target, LocalDateTime at) {
        if (!status.canTransitionTo(target)) {
            throw new InvalidTransitionException("Payment", id, status, target);
        }
        this.status = target;
        this.updatedAt = at;
    }

    /** A checkout session that was never completed within its validity window. */
    public boolean isExpiredAt(LocalDateTime now) {
        return status == PaymentStatus.PENDING && expiresAt != null && now.isAfter(expiresAt);
    }
}
