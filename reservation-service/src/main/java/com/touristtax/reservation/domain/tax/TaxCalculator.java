package com.touristtax.reservation.domain.tax;

import com.touristtax.reservation.exception.InvalidDateRangeException;
import com.touristtax.reservation.exception.InvalidQuantityException;
import com.touristtax.reservation.exception.UnsupportedCityException;
import com.touristtax.reservation.exception.ValidationException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * Pure tourist tax arithmetic: rate per person per night, times guests, times nights.
 * All amounts are rounded half-up to two decimal places.
 */
@Component
public class TaxCalculator {

    private static final int MIN_GUESTS = 1;
    private static final int MIN_NIGHTS = 1;

    private final TaxRateTable rateTable;
    private final int maxGuests;
    private final int maxNights;

    public TaxCalculator(TaxRateTable rateTable,
                         @Value("${tourist-tax.tax.max-guests:20}") int maxGuests,
                         @Value("${tourist-tax.tax.max-nights:365}") int maxNights) {
        this.rateTable = rateTable;
        this.maxGuests = maxGuests;
        this.maxNights = maxNights;
    }

    public CityTaxRate rateFor(String cityName) {
        return rateTable.find(cityName)
                .orElseThrow(() -> new UnsupportedCityException(cityName, rateTable.supportedCityNames()));
    }

    public int nightsBetween(LocalDate checkIn, LocalDate checkOut) {
        if (checkIn == null || checkOut == null) {
            throw new ValidationException(checkIn == null ? "checkInDate" : "checkOutDate",
                    "Check-in and check-out dates are required");
        }
        long nights = ChronoUnit.DAYS.between(checkIn, checkOut);
        if (nights < MIN_NIGHTS) {
            throw new InvalidDateRangeException(checkIn, checkOut);
        }
        if (nights > maxNights) {
            throw new InvalidQuantityException("numberOfNights", nights, MIN_NIGHTS, maxNights);
        }
        return (int) nights;
    }

    public BigDecimal total(BigDecimal ratePerNightPerPerson, int guests, int nights) {
        if (ratePerNightPerPerson == null || ratePerNightPerPerson.signum() <= 0) {
            throw new ValidationException("taxAmountPerNight", "Tax rate must be greater than zero");
        }
        validateGuests(guests);
        if (nights < MIN_NIGHTS || nights > maxNights) {
            throw new InvalidQuantityException("numberOfNights", nights, MIN_NIGHTS, maxNights);
        }
        return ratePerNightPerPerson
                .multiply(BigDecimal.valueOf(guests))
                .multiply(BigDecimal.valueOf(nights))
                .setScale(2, RoundingMode.HALF_UP);
    }

    public TaxQuote quote(String cityName, int guests, LocalDate checkIn, LocalDate checkOut) {
        validateGuests(guests);
        CityTaxRate rate = rateFor(cityName);
        int nights = nightsBetween(checkIn, checkOut);
        BigDecimal total = total(rate.ratePerNightPerPerson(), guests, nights);
        return new TaxQuote(rate.cityName(), rate.region(), checkIn, checkOut, guests, nights,
                rate.ratePerNightPerPerson().setScale(2, RoundingMode.HALF_UP), total, rate.currency());
    }

    public List<CityTaxRate> supportedRates() {
        return rateTable.all();
    }

    private void validateGuests(int guests) {
        if (guests < MIN_GUESTS || guests > maxGuests) {
            throw new InvalidQuantityException("numberOfGuests", guests, MIN_GUESTS, maxGuests);
        }
    }
}
