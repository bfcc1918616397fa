package com.touristtax.reservation.events;

import com.touristtax.reservation.domain.model.Payment;
import com.touristtax.reservation.domain.model.PaymentStatus;
import com.touristtax.reservation.domain.model.Reservation;
import com.touristtax.reservation.domain.model.ReservationStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.concurrent.CompletableFuture;

/**
 * Kafka publisher for reservation lifecycle events.
 * <p>
 * Fire-and-forget: a broker outage is logged and never fails the operation that
 * produced the event. All events are keyed by reservation ID so one reservation's
 * history stays ordered within a partition.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LifecycleEventPublisher {

    public static final String TOPIC_RESERVATION_CREATED = "tourist-tax.reservation-created";
    public static final String TOPIC_RESERVATION_STATUS_CHANGED = "tourist-tax.reservation-status-changed";
    public static final String TOPIC_PAYMENT_STATUS_CHANGED = "tourist-tax.payment-status-changed";

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final Clock clock;

    @Value("${tourist-tax.events.enabled:true}")
    private boolean enabled = true;

    public void publishReservationCreated(Reservation reservation) {
        ReservationCreatedEvent event = ReservationCreatedEvent.builder()
                .reservationId(reservation.getId())
                .guestEmail(reservation.getGuestEmail())
                .cityName(reservation.getCityName())
                .checkInDate(reservation.getCheckInDate())
                .checkOutDate(reservation.getCheckOutDate())
                .numberOfGuests(reservation.getNumberOfGuests())
                .numberOfNights(reservation.getNumberOfNights())
                .totalTaxAmount(reservation.getTotalTaxAmount())
                .currency(reservation.getCurrency().name())
                .timestamp(clock.instant())
                .build();

        publishEvent(TOPIC_RESERVATION_CREATED, reservation.getId(), event);
    }

    public void publishReservationStatusChanged(Reservation reservation, ReservationStatus previous, String reason) {
        ReservationStatusChangedEvent event = ReservationStatusChangedEvent.builder()
                .reservationId(reservation.getId())
                .previousStatus(previous.name())
                .status(reservation.getStatus().name())
                .paymentId(reservation.getPaymentId())
                .reason(reason)
                .timestamp(clock.instant())
                .build();

        publishEvent(TOPIC_RESERVATION_STATUS_CHANGED, reservation.getId(), event);
    }

    public void publishPaymentStatusChanged(Payment payment, PaymentStatus previous) {
        PaymentStatusChangedEvent event = PaymentStatusChangedEvent.builder()
                .paymentId(payment.getId())
                .reservationId(payment.getReservationId())
                .previousStatus(previous.name())
                .status(payment.getStatus().name())
                .amount(payment.getAmount())
                .currency(payment.getCurrency().name())
                .transactionId(payment.getTransactionId())
                .failureReason(payment.getFailureReason())
                .timestamp(clock.instant())
                .build();

        publishEvent(TOPIC_PAYMENT_STATUS_CHANGED, payment.getReservationId(), event);
    }

    private void publishEvent(String topic, String key, Object event) {
        if (!enabled) {
            log.debug("Event publishing disabled, dropping event for topic {}", topic);
            return;
        }
        log.info("Publishing event to topic {}: {}", topic, event);

        CompletableFuture<SendResult<String, Object>> future;
        try {
            future = kafkaTemplate.send(topic, key, event);
        } catch (RuntimeException e) {
            log.error("Failed to hand event to Kafka for topic {}", topic, e);
            return;
        }

        future.whenComplete((result, ex) -> {
            if (ex == null) {
                log.info("Event published successfully to topic {}: offset={}",
                        topic, result.getRecordMetadata().offset());
            } else {
                log.error("Failed to publish event to topic {}", topic, ex);
            }
        });
    }
}
