package com.touristtax.reservation.client;

import com.touristtax.reservation.client.dto.ImojePaymentResponse;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;

import java.util.Map;

/**
 * Feign client for the imoje payment gateway.
 * Timeouts are configured under {@code spring.cloud.openfeign.client.config.imoje-gateway}.
 */
@FeignClient(name = "imoje-gateway", url = "${tourist-tax.gateway.api-url}")
public interface ImojeClient {

    @PostMapping(value = "/payment", consumes = MediaType.APPLICATION_FORM_URLENCODED_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    ImojePaymentResponse createPayment(@RequestBody Map<String, ?> form);

    @GetMapping(value = "/api/payment/{paymentId}", produces = MediaType.APPLICATION_JSON_VALUE)
    ImojePaymentResponse getPayment(@PathVariable("paymentId") String paymentId);
}
