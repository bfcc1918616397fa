package com.touristtax.reservation.client;

import com.touristtax.reservation.client.dto.GatewayCustomer;
import com.touristtax.reservation.client.dto.GatewayPaymentStatus;
import com.touristtax.reservation.client.dto.GatewaySession;
import com.touristtax.reservation.client.dto.GatewaySessionRequest;
import com.touristtax.reservation.client.dto.ImojePaymentResponse;
import com.touristtax.reservation.config.GatewayProperties;
import com.touristtax.reservation.domain.model.Currency;
import com.touristtax.reservation.domain.model.PaymentStatus;
import com.touristtax.reservation.exception.GatewayException;
import com.touristtax.reservation.exception.GatewayRejectedException;
import com.touristtax.reservation.exception.GatewayTimeoutException;
import com.touristtax.reservation.exception.ValidationException;
import feign.FeignException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.net.SocketTimeoutException;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link ImojePaymentGatewayClient}: request shape, error translation
 * and status mapping. Resilience4j annotations are not active without the Spring proxy.
 */
@ExtendWith(MockitoExtension.class)
class ImojePaymentGatewayClientTest {

    @Mock
    private ImojeClient imojeClient;

    private GatewayProperties properties;
    private ImojePaymentGatewayClient client;

    @BeforeEach
    void setUp() {
        properties = new GatewayProperties();
        properties.setMerchantId("merchant-1");
        properties.setServiceId("service-1");
        properties.setServiceKey("service-key");
        properties.setWebhookSecret("webhook-secret");
        client = new ImojePaymentGatewayClient(imojeClient, properties, new GatewaySignatureCalculator(properties));
    }

    @Test
    @DisplayName("createSession sends the amount in grosze with a signed form")
    @SuppressWarnings("unchecked")
    void createSession_buildsSignedForm() {
        when(imojeClient.createPayment(anyMap())).thenReturn(new ImojePaymentResponse(
                new ImojePaymentResponse.PaymentPart("imoje-1", "https://sandbox.imoje.pl/pay/imoje-1", "new", 1500L, "PLN", "pay_1"),
                new ImojePaymentResponse.TransactionPart("tx-1", "new", "sale")));

        GatewaySession session = client.createSession(sessionRequest());

        ArgumentCaptor<Map<String, ?>> captor = ArgumentCaptor.forClass(Map.class);
        verify(imojeClient).createPayment(captor.capture());
        Map<String, ?> form = captor.getValue();
        assertThat(form.get("amount")).isEqualTo(1500L);
        assertThat(form.get("currency")).isEqualTo("PLN");
        assertThat(form.get("orderId")).isEqualTo("pay_1");
        assertThat(form.get("merchantId")).isEqualTo("merchant-1");
        assertThat(form.get("customerFirstName")).isEqualTo("Jan");
        assertThat((String) form.get("signature")).endsWith(";sha256");

        assertThat(session.sessionId()).isEqualTo("imoje-1");
        assertThat(session.redirectUrl()).isEqualTo("https://sandbox.imoje.pl/pay/imoje-1");
    }

    @Test
    @DisplayName("createSession refuses to run without merchant credentials")
    void createSession_notConfigured() {
        properties.setServiceKey("");

        assertThatThrownBy(() -> client.createSession(sessionRequest()))
                .isInstanceOf(GatewayException.class)
                .hasMessage("Payment gateway is not configured");
        verifyNoInteractions(imojeClient);
    }

    @Test
    @DisplayName("an HTTP error from the gateway becomes a gateway error with a stable message")
    void createSession_httpError() {
        FeignException error = new GatewayHttpException(503, null);
        when(imojeClient.createPayment(anyMap())).thenThrow(error);

        assertThatThrownBy(() -> client.createSession(sessionRequest()))
                .isInstanceOf(GatewayException.class)
                .hasMessage("Payment gateway request failed")
                .hasCause(error);
    }

    @Test
    @DisplayName("rejected credentials are reported without the gateway's own text")
    void createSession_unauthorized() {
        FeignException error = new GatewayHttpException(401, null);
        when(imojeClient.createPayment(anyMap())).thenThrow(error);

        assertThatThrownBy(() -> client.createSession(sessionRequest()))
                .isInstanceOf(GatewayRejectedException.class)
                .hasMessage("Payment gateway rejected merchant credentials");
    }

    @Test
    @DisplayName("a bad request on a status lookup is a permanent rejection")
    void getStatus_badRequest() {
        when(imojeClient.getPayment("imoje-1")).thenThrow(new GatewayHttpException(400, null));

        assertThatThrownBy(() -> client.getStatus("imoje-1"))
                .isInstanceOf(GatewayRejectedException.class)
                .hasMessage("Payment gateway rejected the payment request");
    }

    @Test
    @DisplayName("server errors stay retryable gateway failures")
    void getStatus_serverError() {
        when(imojeClient.getPayment("imoje-1")).thenThrow(new GatewayHttpException(503, null));

        assertThatThrownBy(() -> client.getStatus("imoje-1"))
                .isExactlyInstanceOf(GatewayException.class)
                .hasMessage("Payment gateway request failed");
    }

    @Test
    @DisplayName("a socket timeout becomes a gateway timeout")
    void createSession_timeout() {
        FeignException error = new GatewayHttpException(-1, new SocketTimeoutException("Read timed out"));
        when(imojeClient.createPayment(anyMap())).thenThrow(error);

        assertThatThrownBy(() -> client.createSession(sessionRequest()))
                .isInstanceOf(GatewayTimeoutException.class);
    }

    @Test
    @DisplayName("a response without a redirect URL is rejected")
    void createSession_unrecognizedResponse() {
        when(imojeClient.createPayment(anyMap())).thenReturn(new ImojePaymentResponse(
                new ImojePaymentResponse.PaymentPart("imoje-1", null, "new", 1500L, "PLN", "pay_1"), null));

        assertThatThrownBy(() -> client.createSession(sessionRequest()))
                .isInstanceOf(GatewayException.class)
                .hasMessage("Unrecognized payment gateway response");
    }

    @Test
    @DisplayName("getStatus returns the raw gateway status and transaction id")
    void getStatus_returnsGatewayStatus() {
        when(imojeClient.getPayment("imoje-1")).thenReturn(new ImojePaymentResponse(
                new ImojePaymentResponse.PaymentPart("imoje-1", null, "settled", 1500L, "PLN", "pay_1"),
                new ImojePaymentResponse.TransactionPart("tx-1", "settled", "sale")));

        GatewayPaymentStatus status = client.getStatus("imoje-1");

        assertThat(status.externalStatus()).isEqualTo("settled");
        assertThat(status.transactionId()).isEqualTo("tx-1");
    }

    @ParameterizedTest
    @CsvSource({
            "new, PENDING",
            "pending, PENDING",
            "processing, PROCESSING",
            "authorized, PROCESSING",
            "settled, COMPLETED",
            "COMPLETED, COMPLETED",
            "cancelled, CANCELLED",
            "rejected, FAILED",
            "error, FAILED",
            "failed, FAILED",
            "something-new, PENDING"
    })
    @DisplayName("gateway statuses map onto the payment lifecycle")
    void mapStatus(String external, PaymentStatus expected) {
        assertThat(client.mapStatus(external)).isEqualTo(expected);
    }

    @ParameterizedTest
    @CsvSource({
            "new, PENDING",
            "Settled, COMPLETED",
            "' failed ', FAILED"
    })
    @DisplayName("webhook statuses accept every known gateway value")
    void parseWebhookStatus_known(String external, PaymentStatus expected) {
        assertThat(client.parseWebhookStatus(external)).isEqualTo(expected);
    }

    @Test
    @DisplayName("webhook statuses reject values the lifecycle does not know")
    void parseWebhookStatus_unknown() {
        assertThatThrownBy(() -> client.parseWebhookStatus("refunded"))
                .isInstanceOfSatisfying(ValidationException.class,
                        ex -> assertThat(ex.getField()).isEqualTo("status"))
                .hasMessage("Unknown payment status 'refunded'");
        assertThatThrownBy(() -> client.parseWebhookStatus(null))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    @DisplayName("amounts are converted to minor units with half-up rounding")
    void toMinorUnits() {
        assertThat(ImojePaymentGatewayClient.toMinorUnits(new BigDecimal("15.00"))).isEqualTo(1500L);
        assertThat(ImojePaymentGatewayClient.toMinorUnits(new BigDecimal("0.125"))).isEqualTo(13L);
    }

    private static class GatewayHttpException extends FeignException {
        GatewayHttpException(int status, Throwable cause) {
            super(status, "imoje call failed", cause);
        }
    }

    private static GatewaySessionRequest sessionRequest() {
        return new GatewaySessionRequest(new BigDecimal("15.00"), Currency.PLN, "pay_1",
                GatewayCustomer.fromFullName("Jan Kowalski", "jan@example.com"),
                "Tourist tax - Kraków", "https://app.example.com/success", "https://app.example.com/failure");
    }
}
