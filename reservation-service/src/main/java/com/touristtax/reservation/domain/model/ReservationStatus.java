package com.touristtax.reservation.domain.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Reservation lifecycle. CANCELLED is terminal; FAILED can be retried back to PENDING.
 */
public enum ReservationStatus {
    PENDING,
    PAID,
    FAILED,
    CANCELLED;

    public Set<ReservationStatus> allowedTransitions() {
        return switch (this) {
            case PENDING -> EnumSet.of(PAID, FAILED, CANCELLED);
            case FAILED -> EnumSet.of(PENDING, CANCELLED);
            case PAID -> EnumSet.of(CANCELLED);
            case CANCELLED -> EnumSet.noneOf(ReservationStatus.class);
        };
    }

    public boolean canTransitionTo(ReservationStatus target) {
        return allowedTransitions().contains(target);
    }

    public boolean isTerminal() {
        return allowedTransitions().isEmpty();
    }
}
