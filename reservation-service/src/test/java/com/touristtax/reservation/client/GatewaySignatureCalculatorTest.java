package com.touristtax.reservation.client;

import com.touristtax.reservation.api.dto.PaymentWebhookRequest;
import com.touristtax.reservation.config.GatewayProperties;
import com.touristtax.reservation.domain.model.Currency;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class GatewaySignatureCalculatorTest {

    private GatewayProperties properties;
    private GatewaySignatureCalculator calculator;

    @BeforeEach
    void setUp() {
        properties = new GatewayProperties();
        properties.setServiceKey("service-key");
        properties.setWebhookSecret("webhook-secret");
        calculator = new GatewaySignatureCalculator(properties);
    }

    @Test
    @DisplayName("canonicalize sorts keys, skips the signature field and null values")
    void canonicalize_sortsAndFilters() {
        Map<String, Object> params = new HashMap<>();
        params.put("orderId", "pay_1");
        params.put("amount", 1500);
        params.put("signature", "ignored");
        params.put("customerLastName", null);
        params.put("currency", "PLN");

        assertThat(calculator.canonicalize(params)).isEqualTo("amount=1500&currency=PLN&orderId=pay_1");
    }

    @Test
    @DisplayName("request signature is hex HMAC-SHA256 with the algorithm suffix and ignores insertion order")
    void signRequest_isOrderIndependent() {
        Map<String, Object> first = new LinkedHashMap<>();
        first.put("merchantId", "m1");
        first.put("amount", 1500);
        Map<String, Object> second = new LinkedHashMap<>();
        second.put("amount", 1500);
        second.put("merchantId", "m1");

        String signature = calculator.signRequest(first);

        assertThat(signature).matches("[0-9a-f]{64};sha256");
        assertThat(calculator.signRequest(second)).isEqualTo(signature);
    }

    @Test
    @DisplayName("a webhook signed with the shared secret verifies")
    void verifyWebhook_validSignature() {
        PaymentWebhookRequest unsigned = webhook("completed", "15.00", null);
        PaymentWebhookRequest signed = webhook("completed", "15.00", calculator.signWebhook(unsigned));

        assertThat(calculator.verifyWebhook(signed)).isTrue();
    }

    @Test
    @DisplayName("the algorithm suffix on an inbound signature is accepted")
    void verifyWebhook_acceptsSuffix() {
        PaymentWebhookRequest unsigned = webhook("completed", "15.00", null);
        String signature = calculator.signWebhook(unsigned) + ";sha256";

        assertThat(calculator.verifyWebhook(webhook("completed", "15.00", signature))).isTrue();
    }

    @Test
    @DisplayName("changing any signed field invalidates the signature")
    void verifyWebhook_tamperedPayload() {
        String signature = calculator.signWebhook(webhook("completed", "15.00", null));

        assertThat(calculator.verifyWebhook(webhook("completed", "150.00", signature))).isFalse();
        assertThat(calculator.verifyWebhook(webhook("failed", "15.00", signature))).isFalse();
    }

    @Test
    @DisplayName("missing signature or blank secret rejects the webhook")
    void verifyWebhook_missingSignatureOrSecret() {
        PaymentWebhookRequest unsigned = webhook("completed", "15.00", null);
        String signature = calculator.signWebhook(unsigned);

        assertThat(calculator.verifyWebhook(unsigned)).isFalse();

        properties.setWebhookSecret("  ");
        assertThat(calculator.verifyWebhook(webhook("completed", "15.00", signature))).isFalse();
    }

    private static PaymentWebhookRequest webhook(String status, String amount, String signature) {
        return new PaymentWebhookRequest("pay_1", status, new BigDecimal(amount), Currency.PLN,
                "txn_1", "2025-08-01T10:05:00Z", signature);
    }
}
