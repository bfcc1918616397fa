package com.touristtax.reservation.domain.model;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Payment lifecycle. COMPLETED and CANCELLED are terminal; a FAILED payment may be re-armed to PENDING.
 */
public enum PaymentStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public Set<PaymentStatus> allowedTransitions() {
        return switch (this) {
            case PENDING -> EnumSet.of(PROCESSING, FAILED, CANCELLED);
            case PROCESSING -> EnumSet.of(COMPLETED, FAILED);
            case FAILED -> EnumSet.of(PENDING);
            case COMPLETED, CANCELLED -> EnumSet.noneOf(PaymentStatus.class);
        };
    }

    public boolean canTransitionTo(PaymentStatus target) {
        return allowedTransitions().contains(target);
    }

    /**
     * Steps needed to reach {@code target}. The gateway may skip the PROCESSING notification,
     * so PENDING to COMPLETED resolves to [PROCESSING, COMPLETED]. Empty when unreachable.
     */
    public List<PaymentStatus> transitionPathTo(PaymentStatus target) {
        if (canTransitionTo(target)) {
            return List.of(target);
        }
        if (canTransitionTo(PROCESSING) && PROCESSING.canTransitionTo(target)) {
            return List.of(PROCESSING, target);
        }
        return List.of();
    }

    public boolean isActive() {
        return this == PENDING || this == PROCESSING;
    }

    public String description() {
        return switch (this) {
            case PENDING -> "Payment is waiting for the guest to complete checkout";
            case PROCESSING -> "Payment is being processed by the gateway";
            case COMPLETED -> "Payment completed successfully";
            case FAILED -> "Payment failed";
            case CANCELLED -> "Payment was cancelled";
        };
    }
}
