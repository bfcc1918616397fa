package com.touristtax.reservation.api.dto;

import com.touristtax.reservation.domain.model.Currency;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.time.LocalDate;

public record CreateReservationRequest(
        @NotBlank(message = "Guest name cannot be blank")
        @Size(max = 200, message = "Guest name must be at most 200 characters")
        String guestName,

        @NotBlank(message = "Guest email cannot be blank")
        @Email(message = "Guest email must be a valid email address")
        String guestEmail,

        @NotBlank(message = "Accommodation name cannot be blank")
        @Size(max = 255, message = "Accommodation name must be at most 255 characters")
        String accommodationName,

        @NotBlank(message = "Accommodation address cannot be blank")
        @Size(max = 500, message = "Accommodation address must be at most 500 characters")
        String accommodationAddress,

        @NotNull(message = "Check-in date cannot be null")
        LocalDate checkInDate,

        @NotNull(message = "Check-out date cannot be null")
        LocalDate checkOutDate,

        @NotNull(message = "Number of guests cannot be null")
        @Min(value = 1, message = "Number of guests must be at least 1")
        @Max(value = 20, message = "Number of guests must be at most 20")
        Integer numberOfGuests,

        @NotBlank(message = "City name cannot be blank")
        String cityName,

        @NotNull(message = "Currency cannot be null")
        Currency currency
) {
}
