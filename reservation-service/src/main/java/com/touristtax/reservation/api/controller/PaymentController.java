package com.touristtax.reservation.api.controller;

import com.touristtax.common.dto.BaseResponse;
import com.touristtax.common.util.Constants;
import com.touristtax.reservation.api.dto.InitiatePaymentRequest;
import com.touristtax.reservation.api.dto.PaymentResponse;
import com.touristtax.reservation.api.dto.PaymentStatusResponse;
import com.touristtax.reservation.api.dto.PaymentWebhookRequest;
import com.touristtax.reservation.api.dto.ReceiptResponse;
import com.touristtax.reservation.api.dto.WebhookResult;
import com.touristtax.reservation.domain.service.ReservationLifecycleService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST controller for tourist tax payments and gateway callbacks.
 */
@RestController
@RequestMapping(Constants.API_V1 + "/payments")
@RequiredArgsConstructor
public class PaymentController {

    private final ReservationLifecycleService lifecycleService;

    @PostMapping
    public ResponseEntity<BaseResponse<PaymentResponse>> initiatePayment(
            @Valid @RequestBody InitiatePaymentRequest request) {
        PaymentResponse response = lifecycleService.initiatePayment(request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(BaseResponse.success("Payment initiated", response));
    }

    @GetMapping
    public ResponseEntity<BaseResponse<List<PaymentStatusResponse>>> listPayments() {
        return ResponseEntity.ok(BaseResponse.success(lifecycleService.listPayments()));
    }

    @GetMapping({"/{id}", "/{id}/status"})
    public ResponseEntity<BaseResponse<PaymentStatusResponse>> getPaymentStatus(@PathVariable String id) {
        return ResponseEntity.ok(BaseResponse.success(lifecycleService.getPaymentStatus(id)));
    }

    @GetMapping("/{id}/receipt")
    public ResponseEntity<BaseResponse<ReceiptResponse>> getReceipt(@PathVariable String id) {
        return ResponseEntity.ok(BaseResponse.success(lifecycleService.getReceipt(id)));
    }

    @PostMapping("/webhooks")
    public ResponseEntity<BaseResponse<WebhookResult>> handleWebhook(
            @Valid @RequestBody PaymentWebhookRequest request) {
        WebhookResult result = lifecycleService.processWebhook(request);
        return ResponseEntity.ok(BaseResponse.success(result.message(), result));
    }
}
