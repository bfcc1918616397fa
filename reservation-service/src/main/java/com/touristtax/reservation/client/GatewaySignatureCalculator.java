package com.touristtax.reservation.client;

import com.touristtax.reservation.api.dto.PaymentWebhookRequest;
import com.touristtax.reservation.config.GatewayProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * HMAC-SHA256 signing for gateway requests and webhook verification.
 * <p>
 * Canonical form: every parameter except {@code signature}, keys sorted
 * alphabetically, joined as {@code k1=v1&k2=v2}. Null values are left out.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GatewaySignatureCalculator {

    public static final String SIGNATURE_FIELD = "signature";
    public static final String ALGORITHM_SUFFIX = ";sha256";
    private static final String HMAC_ALGORITHM = "HmacSHA256";

    private final GatewayProperties properties;

    public String canonicalize(Map<String, ?> params) {
        return new TreeMap<>(params).entrySet().stream()
                .filter(entry -> !SIGNATURE_FIELD.equals(entry.getKey()))
                .filter(entry -> entry.getValue() != null)
                .map(entry -> entry.getKey() + "=" + entry.getValue())
                .collect(Collectors.joining("&"));
    }

    /** Signature attached to outbound requests, keyed with the service key. */
    public String signRequest(Map<String, ?> params) {
        return hmacHex(properties.getServiceKey(), canonicalize(params)) + ALGORITHM_SUFFIX;
    }

    public String signWebhook(PaymentWebhookRequest webhook) {
        return hmacHex(properties.getWebhookSecret(), canonicalize(webhookFields(webhook)));
    }

    public boolean verifyWebhook(PaymentWebhookRequest webhook) {
        String secret = properties.getWebhookSecret();
        if (secret == null || secret.isBlank()) {
            log.warn("Webhook secret is not configured, rejecting webhook for payment {}", webhook.paymentId());
            return false;
        }
        String received = stripAlgorithmSuffix(webhook.signature());
        if (received == null || received.isBlank()) {
            return false;
        }
        String expected = hmacHex(secret, canonicalize(webhookFields(webhook)));
        return MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8),
                received.toLowerCase(Locale.ROOT).getBytes(StandardCharsets.UTF_8));
    }

    Map<String, Object> webhookFields(PaymentWebhookRequest webhook) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("paymentId", webhook.paymentId());
        fields.put("status", webhook.status());
        fields.put("amount", webhook.amount() == null ? null : webhook.amount().toPlainString());
        fields.put("currency", webhook.currency());
        fields.put("transactionId", webhook.transactionId());
        fields.put("timestamp", webhook.timestamp());
        return fields;
    }

    private static String stripAlgorithmSuffix(String signature) {
        if (signature != null && signature.endsWith(ALGORITHM_SUFFIX)) {
            return signature.substring(0, signature.length() - ALGORITHM_SUFFIX.length());
        }
        return signature;
    }

    private static String hmacHex(String key, String data) {
        if (key == null || key.isEmpty()) {
            throw new IllegalStateException("Signing key is not configured");
        }
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(new SecretKeySpec(key.getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM));
            return HexFormat.of().formatHex(mac.doFinal(data.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA256 is not available", e);
        }
    }
}
