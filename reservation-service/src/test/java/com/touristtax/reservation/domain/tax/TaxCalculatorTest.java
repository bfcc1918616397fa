package com.touristtax.reservation.domain.tax;

import com.touristtax.reservation.domain.model.Currency;
import com.touristtax.reservation.exception.InvalidDateRangeException;
import com.touristtax.reservation.exception.InvalidQuantityException;
import com.touristtax.reservation.exception.UnsupportedCityException;
import com.touristtax.reservation.exception.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TaxCalculatorTest {

    private final TaxCalculator calculator = new TaxCalculator(new TaxRateTable(), 20, 365);

    @Test
    @DisplayName("Kraków, 2 guests, 15 to 18 August: 3 nights at 2.50 is 15.00 PLN")
    void quote_krakowScenario() {
        TaxQuote quote = calculator.quote("Kraków", 2, LocalDate.of(2025, 8, 15), LocalDate.of(2025, 8, 18));

        assertThat(quote.numberOfNights()).isEqualTo(3);
        assertThat(quote.ratePerNightPerPerson()).isEqualByComparingTo("2.50");
        assertThat(quote.totalTaxAmount()).isEqualTo(new BigDecimal("15.00"));
        assertThat(quote.currency()).isEqualTo(Currency.PLN);
        assertThat(quote.cityName()).isEqualTo("Kraków");
    }

    @Test
    @DisplayName("nightsBetween counts calendar days, including across month and year boundaries")
    void nightsBetween_calendarDays() {
        assertThat(calculator.nightsBetween(LocalDate.of(2025, 8, 15), LocalDate.of(2025, 8, 16))).isEqualTo(1);
        assertThat(calculator.nightsBetween(LocalDate.of(2025, 12, 30), LocalDate.of(2026, 1, 2))).isEqualTo(3);
        assertThat(calculator.nightsBetween(LocalDate.of(2024, 2, 28), LocalDate.of(2024, 3, 1))).isEqualTo(2);
    }

    @Test
    @DisplayName("check-out on or before check-in is an invalid range")
    void nightsBetween_rejectsEmptyRange() {
        LocalDate day = LocalDate.of(2025, 8, 15);

        assertThatThrownBy(() -> calculator.nightsBetween(day, day))
                .isInstanceOf(InvalidDateRangeException.class);
        assertThatThrownBy(() -> calculator.nightsBetween(day, day.minusDays(1)))
                .isInstanceOf(InvalidDateRangeException.class);
    }

    @Test
    @DisplayName("stays longer than the configured maximum are rejected")
    void nightsBetween_rejectsTooLongStay() {
        LocalDate checkIn = LocalDate.of(2025, 1, 1);

        assertThat(calculator.nightsBetween(checkIn, checkIn.plusDays(365))).isEqualTo(365);
        assertThatThrownBy(() -> calculator.nightsBetween(checkIn, checkIn.plusDays(366)))
                .isInstanceOf(InvalidQuantityException.class);
    }

    @Test
    @DisplayName("guest count outside 1..20 is rejected")
    void total_rejectsGuestCountOutOfRange() {
        BigDecimal rate = new BigDecimal("2.50");

        assertThatThrownBy(() -> calculator.total(rate, 0, 3)).isInstanceOf(InvalidQuantityException.class);
        assertThatThrownBy(() -> calculator.total(rate, 21, 3)).isInstanceOf(InvalidQuantityException.class);
        assertThat(calculator.total(rate, 20, 3)).isEqualByComparingTo("150.00");
    }

    @Test
    @DisplayName("a zero or missing rate is rejected")
    void total_rejectsNonPositiveRate() {
        assertThatThrownBy(() -> calculator.total(BigDecimal.ZERO, 2, 3)).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> calculator.total(null, 2, 3)).isInstanceOf(ValidationException.class);
    }

    @Test
    @DisplayName("total is rounded half-up to two decimals")
    void total_roundsHalfUp() {
        assertThat(calculator.total(new BigDecimal("0.125"), 1, 1)).isEqualTo(new BigDecimal("0.13"));
        assertThat(calculator.total(new BigDecimal("1.80"), 3, 7)).isEqualTo(new BigDecimal("37.80"));
    }

    @Test
    @DisplayName("total never decreases when guests or nights increase")
    void total_isMonotonic() {
        BigDecimal rate = new BigDecimal("2.80");
        for (int guests = 1; guests < 20; guests++) {
            for (int nights = 1; nights < 30; nights++) {
                BigDecimal base = calculator.total(rate, guests, nights);
                assertThat(calculator.total(rate, guests + 1, nights)).isGreaterThanOrEqualTo(base);
                assertThat(calculator.total(rate, guests, nights + 1)).isGreaterThanOrEqualTo(base);
            }
        }
    }

    @Test
    @DisplayName("unsupported city reports the cities that do have a rate")
    void rateFor_unsupportedCity() {
        assertThatThrownBy(() -> calculator.rateFor("Berlin"))
                .isInstanceOfSatisfying(UnsupportedCityException.class, ex -> {
                    assertThat(ex.getErrorCode()).isEqualTo("UNSUPPORTED_CITY");
                    assertThat(ex.getSupportedCities()).contains("Kraków", "Warszawa").hasSize(19);
                });
    }

    @Test
    @DisplayName("quote is deterministic for the same input")
    void quote_isDeterministic() {
        LocalDate in = LocalDate.of(2025, 7, 1);
        LocalDate out = LocalDate.of(2025, 7, 8);

        assertThat(calculator.quote("zakopane", 4, in, out))
                .isEqualTo(calculator.quote("ZAKOPANE", 4, in, out));
    }
}
