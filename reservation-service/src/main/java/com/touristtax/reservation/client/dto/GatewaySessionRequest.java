package com.touristtax.reservation.client.dto;

import com.touristtax.reservation.domain.model.Currency;

import java.math.BigDecimal;

public record GatewaySessionRequest(
        BigDecimal amount,
        Currency currency,
        String orderReference,
        GatewayCustomer customer,
        String description,
        String successUrl,
        String failureUrl
) {
}
