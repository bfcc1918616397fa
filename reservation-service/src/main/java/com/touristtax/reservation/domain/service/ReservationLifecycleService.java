package com.touristtax.reservation.domain.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.touristtax.common.exception.ResourceNotFoundException;
import com.touristtax.common.exception.UpstreamServiceException;
import com.touristtax.common.util.Constants;
import com.touristtax.reservation.api.dto.CreateReservationRequest;
import com.touristtax.reservation.api.dto.InitiatePaymentRequest;
import com.touristtax.reservation.api.dto.PaymentResponse;
import com.touristtax.reservation.api.dto.PaymentStatusResponse;
import com.touristtax.reservation.api.dto.PaymentWebhookRequest;
import com.touristtax.reservation.api.dto.ReceiptResponse;
import com.touristtax.reservation.api.dto.ReservationResponse;
import com.touristtax.reservation.api.dto.WebhookResult;
import com.touristtax.reservation.client.PaymentGatewayClient;
import com.touristtax.reservation.client.dto.GatewayCustomer;
import com.touristtax.reservation.client.dto.GatewayPaymentStatus;
import com.touristtax.reservation.client.dto.GatewaySession;
import com.touristtax.reservation.client.dto.GatewaySessionRequest;
import com.touristtax.reservation.domain.lock.LifecycleLockManager;
import com.touristtax.reservation.domain.model.Currency;
import com.touristtax.reservation.domain.model.Payment;
import com.touristtax.reservation.domain.model.PaymentStatus;
import com.touristtax.reservation.domain.model.PaymentWebhookPayload;
import com.touristtax.reservation.domain.model.Reservation;
import com.touristtax.reservation.domain.model.ReservationStatus;
import com.touristtax.reservation.domain.repository.PaymentRepository;
import com.touristtax.reservation.domain.repository.PaymentWebhookPayloadRepository;
import com.touristtax.reservation.domain.repository.ReservationRepository;
import com.touristtax.reservation.domain.tax.TaxCalculator;
import com.touristtax.reservation.domain.tax.TaxQuote;
import com.touristtax.reservation.events.LifecycleEventPublisher;
import com.touristtax.reservation.exception.AmountMismatchException;
import com.touristtax.reservation.exception.ConcurrentUpdateException;
import com.touristtax.reservation.exception.GatewayException;
import com.touristtax.reservation.exception.InvalidSignatureException;
import com.touristtax.reservation.exception.InvalidStateException;
import com.touristtax.reservation.exception.InvalidTransitionException;
import com.touristtax.reservation.exception.ValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Owns the reservation and payment state machines.
 * <p>
 * Every state change follows the same shape: take the reservation lock, re-read inside a
 * transaction, validate against the transition tables, write, commit, then publish events.
 * Gateway calls that open a checkout session happen before the lock is taken and are never
 * part of a database transaction.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReservationLifecycleService {

    static final String EXPIRED_REASON = "expired";
    static final String SUPERSEDED_REASON = "superseded";
    static final String RESERVATION_CANCELLED_REASON = "reservation cancelled";
    static final String PROVIDER_FAILURE_REASON = "Payment failed at provider level";

    private final ReservationRepository reservationRepository;
    private final PaymentRepository paymentRepository;
    private final PaymentWebhookPayloadRepository webhookPayloadRepository;
    private final TaxCalculator taxCalculator;
    private final PaymentGatewayClient gatewayClient;
    private final LifecycleLockManager lockManager;
    private final LifecycleEventPublisher eventPublisher;
    private final TransactionOperations transactionOperations;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Value("${tourist-tax.payment.expiry-minutes:30}")
    private long paymentExpiryMinutes = 30;

    @Value("${tourist-tax.payment.reconcile-on-read:true}")
    private boolean reconcileOnRead = true;

    @Value("${tourist-tax.payment.receipt-base-url:http://localhost:8080}")
    private String receiptBaseUrl = "http://localhost:8080";

    public ReservationResponse createReservation(CreateReservationRequest request) {
        log.info("Creating reservation at '{}' in {} for {} guest(s), {} to {}",
                request.accommodationName(), request.cityName(), request.numberOfGuests(),
                request.checkInDate(), request.checkOutDate());

        LocalDateTime now = now();
        LocalDate today = now.toLocalDate();
        if (request.checkInDate() != null && request.checkInDate().isBefore(today)) {
            throw new ValidationException("checkInDate",
                    String.format("Check-in date %s is in the past", request.checkInDate()));
        }
        int guests = request.numberOfGuests() == null ? 0 : request.numberOfGuests();
        TaxQuote quote = taxCalculator.quote(request.cityName(), guests, request.checkInDate(), request.checkOutDate());

        Currency currency = request.currency() != null ? request.currency() : quote.currency();
        if (currency != quote.currency()) {
            throw new ValidationException("currency", String.format(
                    "Tourist tax for %s is charged in %s, not %s", quote.cityName(), quote.currency(), currency));
        }

        Reservation reservation = Reservation.builder()
                .id(UUID.randomUUID().toString())
                .guestName(request.guestName().trim())
                .guestEmail(request.guestEmail().trim())
                .accommodationName(request.accommodationName().trim())
                .accommodationAddress(request.accommodationAddress().trim())
                .cityName(quote.cityName())
                .checkInDate(request.checkInDate())
                .checkOutDate(request.checkOutDate())
                .numberOfGuests(guests)
                .numberOfNights(quote.numberOfNights())
                .taxAmountPerNight(quote.ratePerNightPerPerson())
                .totalTaxAmount(quote.totalTaxAmount())
                .currency(currency)
                .status(ReservationStatus.PENDING)
                .createdAt(now)
                .updatedAt(now)
                .build();

        Reservation saved = reservationRepository.save(reservation);
        log.info("Reservation {} created: {} nights, total tax {} {}",
                saved.getId(), saved.getNumberOfNights(), saved.getTotalTaxAmount(), saved.getCurrency());

        eventPublisher.publishReservationCreated(saved);
        return ReservationResponse.from(saved);
    }

    public ReservationResponse getReservation(String reservationId) {
        return ReservationResponse.from(findReservation(reservationId));
    }

    public List<ReservationResponse> listReservations(ReservationStatus status) {
        List<Reservation> reservations = status == null
                ? reservationRepository.findAllByOrderByCreatedAtDesc()
                : reservationRepository.findByStatusOrderByCreatedAtDesc(status);
        return reservations.stream().map(ReservationResponse::from).toList();
    }

    public void deleteReservation(String reservationId) {
        inReservationLock(reservationId, () -> {
            Reservation reservation = findReservation(reservationId);
            reservationRepository.delete(reservation);
            return reservation;
        });
        log.info("Reservation {} deleted, payment history retained", reservationId);
    }

    public ReservationResponse cancelReservation(String reservationId) {
        log.info("Cancelling reservation {}", reservationId);
        Cancellation cancellation = inReservationLock(reservationId, () -> {
            Reservation reservation = findReservation(reservationId);
            if (reservation.getStatus() == ReservationStatus.CANCELLED) {
                return new Cancellation(reservation, null, null, null);
            }

            Payment linked = findLinkedPayment(reservation);
            if (linked != null && linked.getStatus() == PaymentStatus.PROCESSING) {
                throw new InvalidStateException(String.format(
                        "Reservation %s has payment %s in progress; wait for it to settle before cancelling",
                        reservationId, linked.getId()));
            }

            LocalDateTime now = now();
            ReservationStatus previous = reservation.getStatus();
            reservation.transitionTo(ReservationStatus.CANCELLED, now);
            reservationRepository.save(reservation);

            if (previous == ReservationStatus.PAID) {
                log.warn("Paid reservation {} cancelled; refund of {} {} must be handled manually",
                        reservationId, reservation.getTotalTaxAmount(), reservation.getCurrency());
            }

            PaymentStatus previousPaymentStatus = null;
            if (linked != null && linked.getStatus() == PaymentStatus.PENDING) {
                previousPaymentStatus = linked.getStatus();
                linked.advanceTo(PaymentStatus.CANCELLED, now);
                linked.setFailureReason(RESERVATION_CANCELLED_REASON);
                paymentRepository.save(linked);
            }
            return new Cancellation(reservation, previous, previousPaymentStatus == null ? null : linked,
                    previousPaymentStatus);
        });

        if (cancellation.previousStatus() != null) {
            eventPublisher.publishReservationStatusChanged(cancellation.reservation(),
                    cancellation.previousStatus(), "cancelled by request");
        }
        if (cancellation.cancelledPayment() != null) {
            eventPublisher.publishPaymentStatusChanged(cancellation.cancelledPayment(),
                    cancellation.previousPaymentStatus());
        }
        return ReservationResponse.from(cancellation.reservation());
    }

    /**
     * Re-arms a FAILED reservation so a new payment can be initiated.
     */
    public ReservationResponse retryReservation(String reservationId) {
        log.info("Retrying reservation {}", reservationId);
        Reservation reservation = inReservationLock(reservationId, () -> {
            Reservation current = findReservation(reservationId);
            current.transitionTo(ReservationStatus.PENDING, now());
            return reservationRepository.save(current);
        });
        eventPublisher.publishReservationStatusChanged(reservation, ReservationStatus.FAILED, "retry requested");
        return ReservationResponse.from(reservation);
    }

    public PaymentResponse initiatePayment(InitiatePaymentRequest request) {
        String reservationId = request.reservationId();
        log.info("Initiating payment for reservation {}", reservationId);

        Reservation reservation = findReservation(reservationId);
        ensurePayable(reservation);

        String paymentId = newPaymentId();
        GatewaySessionRequest sessionRequest = new GatewaySessionRequest(
                reservation.getTotalTaxAmount(),
                reservation.getCurrency(),
                paymentId,
                GatewayCustomer.fromFullName(reservation.getGuestName(), reservation.getGuestEmail()),
                String.format("Tourist tax - %s, %s to %s",
                        reservation.getCityName(), reservation.getCheckInDate(), reservation.getCheckOutDate()),
                request.successUrl(),
                request.failureUrl());

        GatewaySession session;
        try {
            session = gatewayClient.createSession(sessionRequest);
        } catch (UpstreamServiceException e) {
            log.error("Gateway session creation failed for reservation {}: {}", reservationId, e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            log.error("Gateway session creation failed for reservation {}", reservationId, e);
            throw new GatewayException("Payment initialization failed", e);
        }

        Initiation initiation = inReservationLock(reservationId, () -> {
            // the reservation may have moved on while the gateway call was in flight
            Reservation current = findReservation(reservationId);
            ensurePayable(current);

            LocalDateTime now = now();
            Payment superseded = supersedePendingPayment(current, now);

            Payment payment = Payment.builder()
                    .id(paymentId)
                    .reservationId(reservationId)
                    .status(PaymentStatus.PENDING)
                    .amount(current.getTotalTaxAmount())
                    .currency(current.getCurrency())
                    .orderReference(paymentId)
                    .providerPaymentId(session.sessionId())
                    .paymentUrl(session.redirectUrl())
                    .createdAt(now)
                    .updatedAt(now)
                    .expiresAt(now.plusMinutes(paymentExpiryMinutes))
                    .build();
            paymentRepository.save(payment);

            current.linkPayment(paymentId, session.redirectUrl(), now);
            reservationRepository.save(current);
            return new Initiation(payment, superseded);
        });

        if (initiation.superseded() != null) {
            eventPublisher.publishPaymentStatusChanged(initiation.superseded(), PaymentStatus.PENDING);
        }
        log.info("Payment {} initiated for reservation {}, gateway session {}",
                paymentId, reservationId, session.sessionId());
        return PaymentResponse.from(initiation.payment());
    }

    /**
     * Returns the stored status, first expiring or reconciling an active payment.
     * Reconciliation problems are logged and never fail the read.
     */
    public PaymentStatusResponse getPaymentStatus(String paymentId) {
        Payment payment = findPayment(paymentId);
        if (!payment.getStatus().isActive()) {
            return PaymentStatusResponse.from(payment);
        }

        try {
            if (payment.isExpiredAt(now())) {
                return PaymentStatusResponse.from(applyAndPublish(payment, PaymentStatus.FAILED, null, null).payment());
            }
            if (!reconcileOnRead || payment.getProviderPaymentId() == null) {
                return PaymentStatusResponse.from(payment);
            }

            GatewayPaymentStatus gatewayStatus = gatewayClient.getStatus(payment.getProviderPaymentId());
            PaymentStatus reported = gatewayClient.mapStatus(gatewayStatus.externalStatus());
            if (reported == payment.getStatus()) {
                return PaymentStatusResponse.from(payment);
            }
            log.info("Reconciling payment {}: stored {}, gateway reports {}",
                    paymentId, payment.getStatus(), gatewayStatus.externalStatus());
            return PaymentStatusResponse.from(
                    applyAndPublish(payment, reported, gatewayStatus.transactionId(), null).payment());
        } catch (RuntimeException e) {
            log.warn("Could not reconcile payment {} with gateway, returning stored status: {}",
                    paymentId, e.getMessage());
            return PaymentStatusResponse.from(payment);
        }
    }

    public WebhookResult processWebhook(PaymentWebhookRequest webhook) {
        log.info("Received payment webhook for payment {} with status {}", webhook.paymentId(), webhook.status());

        if (!gatewayClient.verifySignature(webhook)) {
            log.warn("Rejected webhook for payment {}: invalid signature", webhook.paymentId());
            throw new InvalidSignatureException(webhook.paymentId());
        }

        PaymentStatus requested = gatewayClient.parseWebhookStatus(webhook.status());
        Payment payment = findPayment(webhook.paymentId());

        if (webhook.amount() == null || payment.getAmount().compareTo(webhook.amount()) != 0
                || payment.getCurrency() != webhook.currency()) {
            log.warn("Rejected webhook for payment {}: amount {} {} does not match stored {} {}",
                    payment.getId(), webhook.amount(), webhook.currency(), payment.getAmount(), payment.getCurrency());
            throw new AmountMismatchException(payment.getId(), payment.getAmount(), payment.getCurrency(),
                    webhook.amount(), webhook.currency());
        }

        TransitionOutcome outcome = applyAndPublish(payment, requested, webhook.transactionId(), serialize(webhook));
        Payment current = outcome.payment();

        if (outcome.expired()) {
            return new WebhookResult(current.getId(), current.getStatus(), false,
                    String.format("Payment session expired; %s was not applied", requested));
        }
        if (!outcome.applied()) {
            return new WebhookResult(current.getId(), current.getStatus(), false,
                    "Payment already in status " + current.getStatus());
        }
        return new WebhookResult(current.getId(), current.getStatus(), true,
                String.format("Payment moved from %s to %s", outcome.previousStatus(), current.getStatus()));
    }

    public List<PaymentStatusResponse> listPayments() {
        return paymentRepository.findAllByOrderByCreatedAtDesc().stream()
                .map(PaymentStatusResponse::from)
                .toList();
    }

    public ReceiptResponse getReceipt(String paymentId) {
        Payment payment = findPayment(paymentId);
        if (payment.getStatus() != PaymentStatus.COMPLETED) {
            throw new InvalidStateException(String.format(
                    "Receipt is only available for completed payments; payment %s is %s", paymentId, payment.getStatus()));
        }
        Reservation reservation = reservationRepository.findById(payment.getReservationId()).orElse(null);
        return ReceiptResponse.from(payment, reservation);
    }

    private TransitionOutcome applyAndPublish(Payment payment, PaymentStatus target, String transactionId,
                                              String rawPayload) {
        TransitionOutcome outcome = inReservationLock(payment.getReservationId(),
                () -> applyTransition(payment.getId(), target, transactionId, rawPayload));

        if (outcome.previousStatus() != null) {
            eventPublisher.publishPaymentStatusChanged(outcome.payment(), outcome.previousStatus());
        }
        if (outcome.reservation() != null) {
            eventPublisher.publishReservationStatusChanged(outcome.reservation(),
                    outcome.previousReservationStatus(), "payment " + outcome.payment().getStatus());
        }
        return outcome;
    }

    /**
     * Must run under the reservation lock. Re-reads the payment so decisions use committed state.
     */
    private TransitionOutcome applyTransition(String paymentId, PaymentStatus target, String transactionId,
                                              String rawPayload) {
        Payment payment = findPayment(paymentId);
        PaymentStatus previous = payment.getStatus();
        LocalDateTime now = now();
        if (payment.isExpiredAt(now)) {
            log.warn("Payment {} expired at {}; refusing {} and marking it failed",
                    paymentId, payment.getExpiresAt(), target);
            payment.advanceTo(PaymentStatus.FAILED, now);
            payment.setFailureReason(EXPIRED_REASON);
            return finishTransition(payment, previous, rawPayload, target, now, true);
        }

        if (previous == target) {
            log.info("Payment {} already {}, nothing to apply", paymentId, target);
            return TransitionOutcome.noOp(payment);
        }

        List<PaymentStatus> path = previous.transitionPathTo(target);
        if (path.isEmpty()) {
            log.warn("Rejected transition for payment {} from {} to {}", paymentId, previous, target);
            throw new InvalidTransitionException("Payment", paymentId, previous, target);
        }
        path.forEach(step -> payment.advanceTo(step, now));

        if (transactionId != null) {
            payment.setTransactionId(transactionId);
        }
        if (target == PaymentStatus.COMPLETED) {
            payment.setReceiptUrl(receiptUrl(paymentId));
        } else if (target == PaymentStatus.FAILED) {
            payment.setFailureReason(PROVIDER_FAILURE_REASON);
        }
        log.info("Payment {} moved from {} to {}", paymentId, previous, target);
        return finishTransition(payment, previous, rawPayload, target, now, false);
    }

    private TransitionOutcome finishTransition(Payment payment, PaymentStatus previous, String rawPayload,
                                               PaymentStatus reportedStatus, LocalDateTime now, boolean expired) {
        paymentRepository.save(payment);
        if (rawPayload != null) {
            webhookPayloadRepository.save(PaymentWebhookPayload.builder()
                    .paymentId(payment.getId())
                    .reportedStatus(reportedStatus.name())
                    .payload(rawPayload)
                    .receivedAt(now)
                    .build());
        }

        Reservation reservation = null;
        ReservationStatus previousReservationStatus = null;
        ReservationStatus reservationTarget = switch (payment.getStatus()) {
            case COMPLETED -> ReservationStatus.PAID;
            case FAILED -> ReservationStatus.FAILED;
            case PENDING -> previous == PaymentStatus.FAILED ? ReservationStatus.PENDING : null;
            default -> null;
        };
        if (reservationTarget != null) {
            Reservation linked = reservationRepository.findById(payment.getReservationId()).orElse(null);
            if (linked == null) {
                log.info("Reservation {} for payment {} no longer exists", payment.getReservationId(), payment.getId());
            } else if (linked.getStatus() != reservationTarget) {
                if (linked.getStatus().canTransitionTo(reservationTarget)) {
                    previousReservationStatus = linked.getStatus();
                    linked.transitionTo(reservationTarget, now);
                    reservation = reservationRepository.save(linked);
                } else {
                    log.warn("Reservation {} is {} but payment {} is {}; needs manual reconciliation",
                            linked.getId(), linked.getStatus(), payment.getId(), payment.getStatus());
                }
            }
        }
        return new TransitionOutcome(payment, previous, reservation, previousReservationStatus, expired);
    }

    private <T> T inReservationLock(String reservationId, Supplier<T> action) {
        try {
            return lockManager.executeWithLock(reservationId, () -> transactionOperations.execute(status -> action.get()));
        } catch (OptimisticLockingFailureException e) {
            log.warn("Concurrent update detected for reservation {}", reservationId);
            throw new ConcurrentUpdateException(reservationId, e);
        }
    }

    private void ensurePayable(Reservation reservation) {
        if (reservation.getStatus() != ReservationStatus.PENDING) {
            throw new InvalidStateException(String.format(
                    "Reservation %s is %s; payment can only be initiated for PENDING reservations",
                    reservation.getId(), reservation.getStatus()));
        }
        Payment linked = findLinkedPayment(reservation);
        if (linked != null && linked.getStatus() == PaymentStatus.PROCESSING) {
            throw new InvalidStateException(String.format(
                    "Reservation %s already has payment %s being processed", reservation.getId(), linked.getId()));
        }
    }

    private Payment supersedePendingPayment(Reservation reservation, LocalDateTime now) {
        Payment previous = findLinkedPayment(reservation);
        if (previous == null || previous.getStatus() != PaymentStatus.PENDING) {
            return null;
        }
        log.info("Payment {} superseded by a new attempt for reservation {}", previous.getId(), reservation.getId());
        previous.advanceTo(PaymentStatus.CANCELLED, now);
        previous.setFailureReason(SUPERSEDED_REASON);
        return paymentRepository.save(previous);
    }

    private Payment findLinkedPayment(Reservation reservation) {
        if (reservation.getPaymentId() == null) {
            return null;
        }
        return paymentRepository.findById(reservation.getPaymentId()).orElse(null);
    }

    private Reservation findReservation(String reservationId) {
        return reservationRepository.findById(reservationId)
                .orElseThrow(() -> new ResourceNotFoundException("Reservation", reservationId));
    }

    private Payment findPayment(String paymentId) {
        return paymentRepository.findById(paymentId)
                .orElseThrow(() -> new ResourceNotFoundException("Payment", paymentId));
    }

    private String serialize(PaymentWebhookRequest webhook) {
        try {
            return objectMapper.writeValueAsString(webhook);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize webhook payload for payment " + webhook.paymentId(), e);
        }
    }

    private String receiptUrl(String paymentId) {
        return receiptBaseUrl + Constants.API_V1 + "/payments/" + paymentId + "/receipt";
    }

    private static String newPaymentId() {
        return "pay_" + UUID.randomUUID().toString().replace("-", "");
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }

    private record Initiation(Payment payment, Payment superseded) {
    }

    private record Cancellation(Reservation reservation, ReservationStatus previousStatus,
                                Payment cancelledPayment, PaymentStatus previousPaymentStatus) {
    }

    /**
     * {@code previousStatus} is null when nothing was written.
     */
    private record TransitionOutcome(Payment payment, PaymentStatus previousStatus, Reservation reservation,
                                     ReservationStatus previousReservationStatus, boolean expired) {

        static TransitionOutcome noOp(Payment payment) {
            return new TransitionOutcome(payment, null, null, null, false);
        }

        boolean applied() {
            return previousStatus != null && !expired;
        }
    }
}
