package com.cred.freestyle.eventbooking.repository;

import com.cred.freestyle.eventbooking.domain.model.Booking;
import com.cred.freestyle.eventbooking.domain.model.Booking.BookingStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for Booking entity (the reservation ledger).
 *
 * @author Event Booking Team
 */
@Repository
public interface BookingRepository extends JpaRepository<Booking, String>, JpaSpecificationExecutor<Booking> {

    /**
     * Find booking with pessimistic write lock.
     * Confirm and cancel run their checks against this locked row.
     *
     * @param bookingId Booking ID
     * @return Optional containing the locked booking if found
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT b FROM Booking b WHERE b.bookingId = :bookingId")
    Optional<Booking> findByIdForUpdate(@Param("bookingId") String bookingId);

    /**
     * Find booking together with its event, for read paths that render event details.
     *
     * @param bookingId Booking ID
     * @return Optional containing the booking if found
     */
    @EntityGraph(attributePaths = "event")
    Optional<Booking> findWithEventByBookingId(String bookingId);

    /**
     * Filtered, paged booking listing with events fetched in the same query.
     */
    @Override
    @EntityGraph(attributePaths = "event")
    Page<Booking> findAll(Specification<Booking> spec, Pageable pageable);

    /**
     * Sum ticket counts of a user's bookings for an event in the given status.
     *
     * @param userId User ID
     * @param eventId Event ID
     * @param status Booking status
     * @return Ticket count (0 when there are no bookings)
     */
    @Query("SELECT COALESCE(SUM(b.ticketCount), 0) FROM Booking b " +
           "WHERE b.userId = :userId AND b.eventId = :eventId AND b.status = :status")
    long sumTicketsByStatus(@Param("userId") String userId,
                            @Param("eventId") String eventId,
                            @Param("status") BookingStatus status);

    /**
     * Sum ticket counts of a user's unexpired holds for an event.
     * Lapsed holds that the sweep has not reclaimed yet do not count towards the user's quota.
     *
     * @param userId User ID
     * @param eventId Event ID
     * @param status Hold status (RESERVED)
     * @param now Current timestamp
     * @return Ticket count (0 when there are no holds)
     */
    @Query("SELECT COALESCE(SUM(b.ticketCount), 0) FROM Booking b " +
           "WHERE b.userId = :userId AND b.eventId = :eventId " +
           "AND b.status = :status AND b.reservationExpiry > :now")
    long sumUnexpiredTickets(@Param("userId") String userId,
                             @Param("eventId") String eventId,
                             @Param("status") BookingStatus status,
                             @Param("now") Instant now);

    /**
     * Find lapsed holds that may be reclaimed, locking the rows.
     * A hold is reclaimable when it is RESERVED, its expiry is in the past, and either no payment is
     * in progress or the payment was initiated before the grace cutoff.
     *
     * @param status Hold status (RESERVED)
     * @param now Current timestamp
     * @param paymentCutoff Payments initiated before this instant are considered abandoned
     * @param pageable Batch limit
     * @return Locked reclaimable bookings
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT b FROM Booking b " +
           "WHERE b.status = :status " +
           "AND b.reservationExpiry < :now " +
           "AND (b.paymentProcessing = false " +
           "     OR (b.paymentProcessing = true AND b.paymentInitiatedAt < :paymentCutoff)) " +
           "ORDER BY b.reservationExpiry ASC")
    List<Booking> findReclaimableReservations(@Param("status") BookingStatus status,
                                              @Param("now") Instant now,
                                              @Param("paymentCutoff") Instant paymentCutoff,
                                              Pageable pageable);

    /**
     * Bulk transition bookings from one status to another, stamping the cancellation time.
     * Guarded on the source status so a row is never released twice.
     *
     * @param bookingIds Booking IDs to transition
     * @param from Required current status (RESERVED)
     * @param to Target status (CANCELLED)
     * @param now Cancellation timestamp
     * @return Number of bookings updated
     */
    @Modifying
    @Query("UPDATE Booking b SET " +
           "b.status = :to, " +
           "b.paymentProcessing = false, " +
           "b.cancelledAt = :now, " +
           "b.updatedAt = :now " +
           "WHERE b.bookingId IN :bookingIds AND b.status = :from")
    int cancelReservations(@Param("bookingIds") Collection<String> bookingIds,
                           @Param("from") BookingStatus from,
                           @Param("to") BookingStatus to,
                           @Param("now") Instant now);

    /**
     * Clear the payment-in-progress flag, only while the booking is still in the given status.
     *
     * @param bookingId Booking ID
     * @param status Required current status (RESERVED)
     * @return Number of bookings updated
     */
    @Modifying
    @Query("UPDATE Booking b SET b.paymentProcessing = false " +
           "WHERE b.bookingId = :bookingId AND b.status = :status")
    int clearPaymentProcessing(@Param("bookingId") String bookingId,
                               @Param("status") BookingStatus status);
}
