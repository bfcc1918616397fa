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
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * A guest's accommodation stay with the tourist tax owed for it.
 * Tax figures are computed server-side at creation and never change afterwards.
 */
@Entity
@Table(name = "reservations", indexes = {
        @Index(name = "idx_reservations_status", columnList = "status"),
        @Index(name = "idx_reservations_created_at", columnList = "created_at")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Reservation {

    @Id
    @Column(length = 36)
    private String id;

    @Column(name = "guest_name", nullable = false)
    private String guestName;

    @Column(name = "guest_email", nullable = false)
    private String guestEmail;

    @Column(name = "accommodation_name", nullable = false)
    private String accommodationName;

    @Column(name = "accommodation_address", nullable = false, length = 500)
    private String accommodationAddress;

    @Column(name = "city_name", nullable = false)
    private String cityName;

    @Column(name = "check_in_date", nullable = false)
    private LocalDate checkInDate;

    @Column(name = "check_out_date", nullable = false)
    private LocalDate checkOutDate;

    @Column(name = "number_of_guests", nullable = false)
    private Integer numberOfGuests;

    @Column(name = "number_of_nights", nullable = false)
    private Integer numberOfNights;

    @Column(name = "tax_amount_per_night", nullable = false, precision = 10, scale = 2)
    private BigDecimal taxAmountPerNight;

    @Column(name = "total_tax_amount", nullable = false, precision = 12, scale = 2)
    private BigDecimal totalTaxAmount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 3)
    private Currency currency;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ReservationStatus status;

    @Column(name = "payment_id", length = 40)
    private String paymentId;

    @Column(name = "payment_url", length = 1024)
    private String paymentUrl;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @Version
    private Long version;

    public void transitionTo(ReservationStatus target, LocalDateTime at) {
        if (!status.canTransitionTo(target)) {
            throw new InvalidTransitionException("Reservation", id, status, target);
        }
        this.status = target;
        this.updatedAt = at;
    }

    public void linkPayment(String paymentId, String paymentUrl, LocalDateTime at) {
        this.paymentId = paymentId;
        this.paymentUrl = paymentUrl;
        this.updatedAt = at;
    }
}
