package com.touristtax.reservation.client;

import com.touristtax.common.exception.UpstreamServiceException;
import com.touristtax.reservation.api.dto.PaymentWebhookRequest;
import com.touristtax.reservation.client.dto.GatewayPaymentStatus;
import com.touristtax.reservation.client.dto.GatewaySession;
import com.touristtax.reservation.client.dto.GatewaySessionRequest;
import com.touristtax.reservation.client.dto.ImojePaymentResponse;
import com.touristtax.reservation.config.GatewayProperties;
import com.touristtax.reservation.exception.GatewayException;
import com.touristtax.reservation.exception.GatewayRejectedException;
import com.touristtax.reservation.exception.GatewayTimeoutException;
import feign.FeignException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.net.SocketTimeoutException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * imoje hosted-checkout integration over Feign.
 * <p>
 * Session creation is not idempotent on the gateway side, so it is never retried.
 * Status reads are retried and both calls share the {@code gateway} circuit breaker.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "tourist-tax.gateway.mode", havingValue = "imoje", matchIfMissing = true)
public class ImojePaymentGatewayClient implements PaymentGatewayClient {

    private final ImojeClient imojeClient;
    private final GatewayProperties properties;
    private final GatewaySignatureCalculator signatureCalculator;

    @Override
    @CircuitBreaker(name = "gateway", fallbackMethod = "createSessionFallback")
    public GatewaySession createSession(GatewaySessionRequest request) {
        if (!properties.isConfigured()) {
            throw new GatewayException("Payment gateway is not configured");
        }
        log.info("Creating imoje payment for order {}: {} {}",
                request.orderReference(), request.amount(), request.currency());

        Map<String, Object> form = new LinkedHashMap<>();
        form.put("merchantId", properties.getMerchantId());
        form.put("serviceId", properties.getServiceId());
        form.put("amount", toMinorUnits(request.amount()));
        form.put("currency", request.currency().name());
        form.put("orderId", request.orderReference());
        form.put("customerFirstName", request.customer().firstName());
        form.put("customerLastName", request.customer().lastName());
        form.put("customerEmail", request.customer().email());
        form.put("orderDescription", request.description());
        form.put("urlSuccess", request.successUrl());
        form.put("urlFailure", request.failureUrl());
        form.put(GatewaySignatureCalculator.SIGNATURE_FIELD, signatureCalculator.signRequest(form));

        ImojePaymentResponse response;
        try {
            response = imojeClient.createPayment(form);
        } catch (FeignException e) {
            throw translate("create payment session", e);
        }

        if (response == null || response.payment() == null
                || response.payment().id() == null || response.payment().url() == null) {
            log.error("Unrecognized imoje response for order {}: {}", request.orderReference(), response);
            throw new GatewayException("Unrecognized payment gateway response");
        }
        log.info("imoje payment {} created for order {}", response.payment().id(), request.orderReference());
        return new GatewaySession(response.payment().id(), response.payment().url());
    }

    @Override
    @Retry(name = "gatewayStatus")
    @CircuitBreaker(name = "gateway", fallbackMethod = "getStatusFallback")
    public GatewayPaymentStatus getStatus(String sessionId) {
        if (!properties.isConfigured()) {
            throw new GatewayException("Payment gateway is not configured");
        }
        ImojePaymentResponse response;
        try {
            response = imojeClient.getPayment(sessionId);
        } catch (FeignException e) {
            throw translate("fetch payment status", e);
        }
        if (response == null || response.payment() == null) {
            throw new GatewayException("Unrecognized payment gateway response");
        }
        String transactionId = response.transaction() != null ? response.transaction().id() : null;
        log.debug("imoje payment {} status: {}", sessionId, response.payment().status());
        return new GatewayPaymentStatus(response.payment().status(), transactionId);
    }

    @Override
    public boolean verifySignature(PaymentWebhookRequest webhook) {
        return signatureCalculator.verifyWebhook(webhook);
    }

    static long toMinorUnits(BigDecimal amount) {
        return amount.setScale(2, RoundingMode.HALF_UP).movePointRight(2).longValueExact();
    }

    private GatewaySession createSessionFallback(GatewaySessionRequest request, Throwable t) {
        throw fallbackException(t);
    }

    private GatewayPaymentStatus getStatusFallback(String sessionId, Throwable t) {
        throw fallbackException(t);
    }

    private UpstreamServiceException fallbackException(Throwable t) {
        if (t instanceof UpstreamServiceException upstream) {
            return upstream;
        }
        log.warn("Payment gateway call rejected: {}", t.toString());
        return new GatewayException("Payment gateway temporarily unavailable", t);
    }

    private UpstreamServiceException translate(String operation, FeignException e) {
        if (isTimeout(e)) {
            log.error("imoje call to {} timed out", operation, e);
            return new GatewayTimeoutException("Payment gateway did not respond in time", e);
        }
        log.error("imoje call to {} failed with status {}", operation, e.status(), e);
        if (e.status() == 401 || e.status() == 403) {
            return new GatewayRejectedException("Payment gateway rejected merchant credentials", e);
        }
        if (e.status() == 400) {
            return new GatewayRejectedException("Payment gateway rejected the payment request", e);
        }
        return new GatewayException("Payment gateway request failed", e);
    }

    private static boolean isTimeout(Throwable e) {
        for (Throwable cause = e; cause != null; cause = cause.getCause()) {
            if (cause instanceof SocketTimeoutException) {
                return true;
            }
        }
        return false;
    }
}
