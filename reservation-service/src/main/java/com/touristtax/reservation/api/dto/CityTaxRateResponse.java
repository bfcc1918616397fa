package com.touristtax.reservation.api.dto;

import com.touristtax.reservation.domain.model.Currency;
import com.touristtax.reservation.domain.tax.CityTaxRate;

import java.math.BigDecimal;

public record CityTaxRateResponse(
        String cityName,
        String region,
        BigDecimal ratePerNightPerPerson,
        Currency currency
) {
    public static CityTaxRateResponse from(CityTaxRate rate) {
        return new CityTaxRateResponse(rate.cityName(), rate.region(), rate.ratePerNightPerPerson(), rate.currency());
    }
}
