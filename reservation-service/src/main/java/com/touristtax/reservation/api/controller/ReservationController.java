package com.touristtax.reservation.api.controller;

import com.touristtax.common.dto.BaseResponse;
import com.touristtax.common.util.Constants;
import com.touristtax.reservation.api.dto.CreateReservationRequest;
import com.touristtax.reservation.api.dto.ReservationResponse;
import com.touristtax.reservation.domain.model.ReservationStatus;
import com.touristtax.reservation.domain.service.ReservationLifecycleService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST controller for tourist tax reservations.
 */
@RestController
@RequestMapping(Constants.API_V1 + "/reservations")
@RequiredArgsConstructor
public class ReservationController {

    private final ReservationLifecycleService lifecycleService;

    @PostMapping
    public ResponseEntity<BaseResponse<ReservationResponse>> createReservation(
            @Valid @RequestBody CreateReservationRequest request) {
        ReservationResponse response = lifecycleService.createReservation(request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(BaseResponse.success("Reservation created successfully", response));
    }

    @GetMapping("/{id}")
    public ResponseEntity<BaseResponse<ReservationResponse>> getReservation(@PathVariable String id) {
        return ResponseEntity.ok(BaseResponse.success(lifecycleService.getReservation(id)));
    }

    @GetMapping
    public ResponseEntity<BaseResponse<List<ReservationResponse>>> listReservations(
            @RequestParam(required = false) ReservationStatus status) {
        return ResponseEntity.ok(BaseResponse.success(lifecycleService.listReservations(status)));
    }

    @PostMapping("/{id}/cancel")
    public ResponseEntity<BaseResponse<ReservationResponse>> cancelReservation(@PathVariable String id) {
        ReservationResponse response = lifecycleService.cancelReservation(id);
        return ResponseEntity.ok(BaseResponse.success("Reservation cancelled", response));
    }

    @PostMapping("/{id}/retry")
    public ResponseEntity<BaseResponse<ReservationResponse>> retryReservation(@PathVariable String id) {
        ReservationResponse response = lifecycleService.retryReservation(id);
        return ResponseEntity.ok(BaseResponse.success("Reservation ready for a new payment", response));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteReservation(@PathVariable String id) {
        lifecycleService.deleteReservation(id);
        return ResponseEntity.noContent().build();
    }
}
