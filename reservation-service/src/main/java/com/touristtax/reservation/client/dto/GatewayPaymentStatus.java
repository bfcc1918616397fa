package com.touristtax.reservation.client.dto;

public record GatewayPaymentStatus(
        String externalStatus,
        String transactionId
) {
}
