package com.touristtax.reservation.domain.tax;

import com.touristtax.reservation.domain.model.Currency;

import java.math.BigDecimal;
import java.time.LocalDate;

public record TaxQuote(
        String cityName,
        String region,
        LocalDate checkInDate,
        LocalDate checkOutDate,
        int numberOfGuests,
        int numberOfNights,
        BigDecimal ratePerNightPerPerson,
        BigDecimal totalTaxAmount,
        Currency currency
) {
}
