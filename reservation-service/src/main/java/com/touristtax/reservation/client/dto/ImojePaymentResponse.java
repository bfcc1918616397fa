package com.touristtax.reservation.client.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Body returned by the imoje {@code POST /payment} and {@code GET /api/payment/{id}} endpoints.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ImojePaymentResponse(
        PaymentPart payment,
        TransactionPart transaction
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PaymentPart(String id, String url, String status, Long amount, String currency, String orderId) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TransactionPart(String id, String status, String type) {
    }
}
