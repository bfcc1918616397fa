package com.touristtax.reservation.client;

import com.touristtax.reservation.api.dto.PaymentWebhookRequest;
import com.touristtax.reservation.client.dto.GatewayPaymentStatus;
import com.touristtax.reservation.client.dto.GatewaySession;
import com.touristtax.reservation.client.dto.GatewaySessionRequest;
import com.touristtax.reservation.config.GatewayProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Local development gateway. Sessions point at a local checkout page and stay pending
 * until a signed webhook moves them on.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "tourist-tax.gateway.mode", havingValue = "mock")
public class MockPaymentGatewayClient implements PaymentGatewayClient {

    private final GatewayProperties properties;
    private final GatewaySignatureCalculator signatureCalculator;

    @Override
    public GatewaySession createSession(GatewaySessionRequest request) {
        String sessionId = "mock_" + UUID.randomUUID();
        log.info("Mock gateway session {} created for order {}: {} {}",
                sessionId, request.orderReference(), request.amount(), request.currency());
        return new GatewaySession(sessionId, properties.getMockCheckoutUrl() + "/" + sessionId);
    }

    @Override
    public GatewayPaymentStatus getStatus(String sessionId) {
        return new GatewayPaymentStatus("pending", null);
    }

    @Override
    public boolean verifySignature(PaymentWebhookRequest webhook) {
        return signatureCalculator.verifyWebhook(webhook);
    }
}
