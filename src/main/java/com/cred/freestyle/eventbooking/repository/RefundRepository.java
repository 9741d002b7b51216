package com.cred.freestyle.eventbooking.repository;

import com.cred.freestyle.eventbooking.domain.model.Refund;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository interface for Refund entity.
 *
 * @author Event Booking Team
 */
@Repository
public interface RefundRepository extends JpaRepository<Refund, String> {

    Optional<Refund> findByPaymentIntentId(String paymentIntentId);
}
