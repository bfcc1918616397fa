package com.touristtax.reservation.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Payment gateway settings bound from {@code tourist-tax.gateway.*}.
 */
@Data
@Component
@ConfigurationProperties(prefix = "tourist-tax.gateway")
public class GatewayProperties {

    /** imoje or mock. */
    private String mode = "imoje";
    private String apiUrl = "https://sandbox.imoje.pl";
    private String merchantId = "";
    private String serviceId = "";
    private String serviceKey = "";
    private String webhookSecret = "";
    private String mockCheckoutUrl = "http://localhost:8080/mock-checkout";
    private int connectTimeoutMs = 2000;
    private int readTimeoutMs = 10000;

    public boolean isConfigured() {
        return hasText(merchantId) && hasText(serviceId) && hasText(serviceKey);
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
