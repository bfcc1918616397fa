package com.touristtax.reservation.client;

import com.touristtax.reservation.api.dto.PaymentWebhookRequest;
import com.touristtax.reservation.client.dto.GatewayPaymentStatus;
import com.touristtax.reservation.client.dto.GatewaySession;
import com.touristtax.reservation.client.dto.GatewaySessionRequest;
import com.touristtax.reservation.domain.model.PaymentStatus;
import com.touristtax.reservation.exception.ValidationException;

import java.util.Locale;

/**
 * Hosted-checkout payment gateway.
 * <p>
 * Implementations translate transport failures into {@code GatewayException} or
 * {@code GatewayTimeoutException}; callers never see the gateway's own error text.
 */
public interface PaymentGatewayClient {

    GatewaySession createSession(GatewaySessionRequest request);

    GatewayPaymentStatus getStatus(String sessionId);

    boolean verifySignature(PaymentWebhookRequest webhook);

    /**
     * Maps a gateway status string onto our lifecycle for status reconciliation.
     * Unknown values are treated as still pending.
     */
    default PaymentStatus mapStatus(String externalStatus) {
        PaymentStatus status = knownStatus(externalStatus);
        return status != null ? status : PaymentStatus.PENDING;
    }

    /**
     * Strict variant for webhook notifications, which drive state changes.
     *
     * @throws ValidationException when the gateway reports a status we do not know
     */
    default PaymentStatus parseWebhookStatus(String externalStatus) {
        PaymentStatus status = knownStatus(externalStatus);
        if (status == null) {
            throw new ValidationException("status", String.format("Unknown payment status '%s'", externalStatus));
        }
        return status;
    }

    private static PaymentStatus knownStatus(String externalStatus) {
        if (externalStatus == null) {
            return null;
        }
        return switch (externalStatus.trim().toLowerCase(Locale.ROOT)) {
            case "new", "pending" -> PaymentStatus.PENDING;
            case "processing", "authorized" -> PaymentStatus.PROCESSING;
            case "settled", "completed" -> PaymentStatus.COMPLETED;
            case "cancelled" -> PaymentStatus.CANCELLED;
            case "rejected", "error", "failed" -> PaymentStatus.FAILED;
            default -> null;
        };
    }
}
