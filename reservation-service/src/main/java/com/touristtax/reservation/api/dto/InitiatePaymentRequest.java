package com.touristtax.reservation.api.dto;

import jakarta.validation.constraints.NotBlank;

public record InitiatePaymentRequest(
        @NotBlank(message = "Reservation ID cannot be blank")
        String reservationId,

        @NotBlank(message = "Success URL cannot be blank")
        String successUrl,

        @NotBlank(message = "Failure URL cannot be blank")
        String failureUrl
) {
}
