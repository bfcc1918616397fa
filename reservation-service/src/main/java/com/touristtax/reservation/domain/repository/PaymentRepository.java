package com.touristtax.reservation.domain.repository;

import com.touristtax.reservation.domain.model.Payment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface PaymentRepository extends JpaRepository<Payment, String> {

    List<Payment> findAllByOrderByCreatedAtDesc();

    List<Payment> findByReservationIdOrderByCreatedAtDesc(String reservationId);

    Optional<Payment> findByProviderPaymentId(String providerPaymentId);
}
