package com.touristtax.reservation.api.dto;

import com.touristtax.reservation.domain.model.Currency;
import com.touristtax.reservation.domain.model.Payment;
import com.touristtax.reservation.domain.model.Reservation;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

public record ReceiptResponse(
        String paymentId,
        String reservationId,
        String transactionId,
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
        BigDecimal amount,
        Currency currency,
        LocalDateTime paidAt
) {
    /** The reservation may have been deleted since payment; its fields are then left empty. */
    public static ReceiptResponse from(Payment payment, Reservation reservation) {
        boolean known = reservation != null;
        return new ReceiptResponse(
                payment.getId(),
                payment.getReservationId(),
                payment.getTransactionId(),
                known ? reservation.getGuestName() : null,
                known ? reservation.getGuestEmail() : null,
                known ? reservation.getAccommodationName() : null,
                known ? reservation.getAccommodationAddress() : null,
                known ? reservation.getCityName() : null,
                known ? reservation.getCheckInDate() : null,
                known ? reservation.getCheckOutDate() : null,
                known ? reservation.getNumberOfGuests() : null,
                known ? reservation.getNumberOfNights() : null,
                known ? reservation.getTaxAmountPerNight() : null,
                payment.getAmount(),
                payment.getCurrency(),
                payment.getUpdatedAt()
        );
    }
}
