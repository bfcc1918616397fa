package com.touristtax.reservation.exception;

import com.touristtax.common.exception.BusinessException;
import lombok.Getter;

import java.util.List;

/**
 * No tourist tax rate is configured for the requested city.
 * Carries the supported city names so the caller can offer them.
 */
@Getter
public class UnsupportedCityException extends BusinessException {

    private final List<String> supportedCities;

    public UnsupportedCityException(String cityName, List<String> supportedCities) {
        super(String.format("Tourist tax rate not available for city: %s", cityName), "UNSUPPORTED_CITY");
        this.supportedCities = List.copyOf(supportedCities);
    }
}
