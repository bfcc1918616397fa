package com.touristtax.reservation.events;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReservationStatusChangedEvent {
    private String reservationId;
    private String previousStatus;
    private String status;
    private String paymentId;
    private String reason;
    private Instant timestamp;
}
