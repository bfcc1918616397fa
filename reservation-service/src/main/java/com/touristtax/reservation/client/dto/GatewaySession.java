package com.touristtax.reservation.client.dto;

public record GatewaySession(
        String sessionId,
        String redirectUrl
) {
}
