package com.touristtax.reservation.api.dto;

import com.touristtax.reservation.domain.model.Currency;
import com.touristtax.reservation.domain.model.Reservation;
import com.touristtax.reservation.domain.model.ReservationStatus;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

public record ReservationResponse(
        String id,
        String guestName,
        String guestEmail,
        String accommodationName,
        String accommodationAddress,
        String cityName,
        LocalDate checkInDate,
        LocalDate checkOutDate,
        Integer numberOfGuests,
        Integer numberOfNights,
        BigDecimal taxAmountPerNight,
        BigDecimal totalTaxAmount,
        Currency currency,
        ReservationStatus status,
        String paymentId,
        String paymentUrl,
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {
    public static ReservationResponse from(Reservation reservation) {
        return new ReservationResponse(
                reservation.getId(),
                reservation.getGuestName(),
                reservation.getGuestEmail(),
                reservation.getAccommodationName(),
                reservation.getAccommodationAddress(),
                reservation.getCityName(),
                reservation.getCheckInDate(),
                reservation.getCheckOutDate(),
                reservation.getNumberOfGuests(),
                reservation.getNumberOfNights(),
                reservation.getTaxAmountPerNight(),
                reservation.getTotalTaxAmount(),
                reservation.getCurrency(),
                reservation.getStatus(),
                reservation.getPaymentId(),
                reservation.getPaymentUrl(),
                reservation.getCreatedAt(),
                reservation.getUpdatedAt()
        );
    }
}
