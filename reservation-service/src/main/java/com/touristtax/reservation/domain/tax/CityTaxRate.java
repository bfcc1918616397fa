package com.touristtax.reservation.domain.tax;

import com.touristtax.reservation.domain.model.Currency;

import java.math.BigDecimal;
import java.util.List;

/**
 * Per-person, per-night tourist tax for one city.
 */
public record CityTaxRate(
        String cityName,
        String region,
        BigDecimal ratePerNightPerPerson,
        Currency currency,
        List<String> aliases
) {
    public CityTaxRate {
        aliases = aliases == null ? List.of() : List.copyOf(aliases);
    }

    static CityTaxRate pln(String cityName, String region, String rate, String... aliases) {
        return new CityTaxRate(cityName, region, new BigDecimal(rate), Currency.PLN, List.of(aliases));
    }
}
