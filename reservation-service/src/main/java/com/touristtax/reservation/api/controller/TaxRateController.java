package com.touristtax.reservation.api.controller;

import com.touristtax.common.dto.BaseResponse;
import com.touristtax.common.util.Constants;
import com.touristtax.reservation.api.dto.CityTaxRateResponse;
import com.touristtax.reservation.api.dto.TaxQuoteResponse;
import com.touristtax.reservation.domain.tax.TaxCalculator;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;

@RestController
@RequestMapping(Constants.API_V1 + "/tax-rates")
@RequiredArgsConstructor
public class TaxRateController {

    private final TaxCalculator taxCalculator;

    @GetMapping("/cities")
    public ResponseEntity<BaseResponse<List<CityTaxRateResponse>>> listCities() {
        List<CityTaxRateResponse> cities = taxCalculator.supportedRates().stream()
                .map(CityTaxRateResponse::from)
                .toList();
        return ResponseEntity.ok(BaseResponse.success(cities));
    }

    @GetMapping("/quote")
    public ResponseEntity<BaseResponse<TaxQuoteResponse>> quote(
            @RequestParam String cityName,
            @RequestParam int numberOfGuests,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate checkInDate,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate checkOutDate) {
        TaxQuoteResponse quote = TaxQuoteResponse.from(
                taxCalculator.quote(cityName, numberOfGuests, checkInDate, checkOutDate));
        return ResponseEntity.ok(BaseResponse.success(quote));
    }
}
