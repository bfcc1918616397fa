package com.touristtax.reservation.api.dto;

import com.touristtax.reservation.domain.model.Currency;
import com.touristtax.reservation.domain.tax.TaxQuote;

import java.math.BigDecimal;
import java.time.LocalDate;

public record TaxQuoteResponse(
        String cityName,
        String region,
        LocalDate checkInDate,
        LocalDate checkOutDate,
        int numberOfGuests,
        int numberOfNights,
        BigDecimal taxAmountPerNight,
        BigDecimal totalTaxAmount,
        Currency currency
) {
    public static TaxQuoteResponse from(TaxQuote quote) {
        return new TaxQuoteResponse(
                quote.cityName(),
                quote.region(),
                quote.checkInDate(),
                quote.checkOutDate(),
                quote.numberOfGuests(),
                quote.numberOfNights(),
                quote.ratePerNightPerPerson(),
                quote.totalTaxAmount(),
                quote.currency()
        );
    }
}
