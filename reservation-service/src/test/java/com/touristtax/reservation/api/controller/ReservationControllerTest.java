package com.touristtax.reservation.api.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.touristtax.common.exception.ResourceNotFoundException;
import com.touristtax.reservation.api.dto.CreateReservationRequest;
import com.touristtax.reservation.api.dto.ReservationResponse;
import com.touristtax.reservation.domain.model.Currency;
import com.touristtax.reservation.domain.model.ReservationStatus;
import com.touristtax.reservation.domain.service.ReservationLifecycleService;
import com.touristtax.reservation.exception.InvalidDateRangeException;
import com.touristtax.reservation.exception.InvalidTransitionException;
import com.touristtax.reservation.exception.UnsupportedCityException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.willThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ReservationController.class)
class ReservationControllerTest {

    private static final LocalDate CHECK_IN = LocalDate.of(2025, 8, 15);
    private static final LocalDate CHECK_OUT = LocalDate.of(2025, 8, 18);

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private ReservationLifecycleService lifecycleService;

    @Test
    @DisplayName("POST /reservations returns 201 with the computed tax")
    void createReservation_created() throws Exception {
        given(lifecycleService.createReservation(any(CreateReservationRequest.class)))
                .willReturn(response("r-1", ReservationStatus.PENDING));

        mockMvc.perform(post("/api/v1/reservations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request(2, "Kraków"))))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.id").value("r-1"))
                .andExpect(jsonPath("$.data.totalTaxAmount").value(15.00))
                .andExpect(jsonPath("$.data.status").value("PENDING"));
    }

    @Test
    @DisplayName("bean validation failures come back as a field map")
    void createReservation_validationErrors() throws Exception {
        mockMvc.perform(post("/api/v1/reservations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request(0, "Kraków"))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.errorCode").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.data.numberOfGuests").value("Number of guests must be at least 1"));

        verify(lifecycleService, never()).createReservation(any());
    }

    @Test
    @DisplayName("an invalid date range reports the offending field")
    void createReservation_invalidDateRange() throws Exception {
        given(lifecycleService.createReservation(any(CreateReservationRequest.class)))
                .willThrow(new InvalidDateRangeException(CHECK_OUT, CHECK_IN));

        mockMvc.perform(post("/api/v1/reservations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request(2, "Kraków"))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("INVALID_DATE_RANGE"))
                .andExpect(jsonPath("$.data.checkOutDate").exists());
    }

    @Test
    @DisplayName("an unsupported city lists the cities that do have a rate")
    void createReservation_unsupportedCity() throws Exception {
        given(lifecycleService.createReservation(any(CreateReservationRequest.class)))
                .willThrow(new UnsupportedCityException("Atlantis", List.of("Kraków", "Zakopane")));

        mockMvc.perform(post("/api/v1/reservations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request(2, "Atlantis"))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("UNSUPPORTED_CITY"))
                .andExpect(jsonPath("$.data.supportedCities[0]").value("Kraków"))
                .andExpect(jsonPath("$.data.supportedCities[1]").value("Zakopane"));
    }

    @Test
    @DisplayName("GET /reservations/{id} returns 404 for an unknown reservation")
    void getReservation_notFound() throws Exception {
        given(lifecycleService.getReservation("missing"))
                .willThrow(new ResourceNotFoundException("Reservation", "missing"));

        mockMvc.perform(get("/api/v1/reservations/missing"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.errorCode").value("RESOURCE_NOT_FOUND"));
    }

    @Test
    @DisplayName("GET /reservations filters by status")
    void listReservations_byStatus() throws Exception {
        given(lifecycleService.listReservations(ReservationStatus.PAID))
                .willReturn(List.of(response("r-2", ReservationStatus.PAID)));

        mockMvc.perform(get("/api/v1/reservations").param("status", "PAID"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[0].id").value("r-2"))
                .andExpect(jsonPath("$.data[0].status").value("PAID"));
    }

    @Test
    @DisplayName("retrying a paid reservation is a conflict")
    void retryReservation_conflict() throws Exception {
        given(lifecycleService.retryReservation("r-1")).willThrow(new InvalidTransitionException(
                "Reservation", "r-1", ReservationStatus.PAID, ReservationStatus.PENDING));

        mockMvc.perform(post("/api/v1/reservations/r-1/retry"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.errorCode").value("INVALID_TRANSITION"));
    }

    @Test
    @DisplayName("POST /reservations/{id}/cancel returns the cancelled reservation")
    void cancelReservation_ok() throws Exception {
        given(lifecycleService.cancelReservation("r-1")).willReturn(response("r-1", ReservationStatus.CANCELLED));

        mockMvc.perform(post("/api/v1/reservations/r-1/cancel"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.status").value("CANCELLED"));
    }

    @Test
    @DisplayName("DELETE /reservations/{id} returns 204, or 404 when missing")
    void deleteReservation() throws Exception {
        mockMvc.perform(delete("/api/v1/reservations/r-1"))
                .andExpect(status().isNoContent());
        verify(lifecycleService).deleteReservation("r-1");

        willThrow(new ResourceNotFoundException("Reservation", "missing"))
                .given(lifecycleService).deleteReservation("missing");
        mockMvc.perform(delete("/api/v1/reservations/missing"))
                .andExpect(status().isNotFound());
    }

    private static CreateReservationRequest request(int guests, String city) {
        return new CreateReservationRequest("Jan Kowalski", "jan@example.com", "Hotel Wawel",
                "ul. Grodzka 1, Kraków", CHECK_IN, CHECK_OUT, guests, city, Currency.PLN);
    }

    private static ReservationResponse response(String id, ReservationStatus status) {
        LocalDateTime now = LocalDateTime.of(2025, 8, 1, 10, 0);
        return new ReservationResponse(id, "Jan Kowalski", "jan@example.com", "Hotel Wawel",
                "ul. Grodzka 1, Kraków", "Kraków", CHECK_IN, CHECK_OUT, 2, 3,
                new BigDecimal("5.00"), new BigDecimal("15.00"), Currency.PLN, status, null, null, now, now);
    }
}
