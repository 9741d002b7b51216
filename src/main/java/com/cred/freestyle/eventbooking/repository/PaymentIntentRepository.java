package com.cred.freestyle.eventbooking.repository;

import com.cred.freestyle.eventbooking.domain.model.PaymentIntent;
import com.cred.freestyle.eventbooking.domain.model.PaymentIntent.PaymentIntentStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;

/**
 * Repository interface for PaymentIntent entity.
 *
 * @author Event Booking Team
 */
@Repository
public interface PaymentIntentRepository extends JpaRepository<PaymentIntent, String> {

    /**
     * Latest intent of a booking in the given status.
     */
    Optional<PaymentIntent> findFirstByBookingIdAndStatusOrderByCreatedAtDesc(String bookingId,
                                                                             PaymentIntentStatus status);

    /**
     * Delete intents in the given status that expired before the cutoff.
     *
     * @param status Intent status
     * @param cutoff Expiry cutoff
     * @return Number of intents deleted
     */
    @Modifying
    @Query("DELETE FROM PaymentIntent p WHERE p.status = :status AND p.expiresAt < :cutoff")
    int deleteByStatusAndExpiresAtBefore(@Param("status") PaymentIntentStatus status,
                                         @Param("cutoff") Instant cutoff);
}
