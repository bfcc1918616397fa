package com.touristtax.reservation.domain.repository;

import com.touristtax.reservation.domain.model.PaymentWebhookPayload;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface PaymentWebhookPayloadRepository extends JpaRepository<PaymentWebhookPayload, Long> {

    List<PaymentWebhookPayload> findByPaymentIdOrderByReceivedAtAsc(String paymentId);
}
