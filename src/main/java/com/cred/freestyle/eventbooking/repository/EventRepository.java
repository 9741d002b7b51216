package com.cred.freestyle.eventbooking.repository;

import com.cred.freestyle.eventbooking.domain.model.Event;
import com.cred.freestyle.eventbooking.domain.model.Event.EventStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;

/**
 * Repository interface for Event entity.
 * Holds the conditional capacity updates that back the capacity store.
 *
 * @author Event Booking Team
 */
@Repository
public interface EventRepository extends JpaRepository<Event, String> {

    /**
     * Find event with pessimistic write lock (SELECT ... FOR UPDATE).
     * The row stays locked until the enclosing transaction ends.
     *
     * @param eventId Event ID
     * @return Optional containing the locked event if found
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT e FROM Event e WHERE e.eventId = :eventId")
    Optional<Event> findByIdForUpdate(@Param("eventId") String eventId);

    /**
     * Atomically debit available capacity, only if enough remains.
     * Check and mutation happen in one statement, so there is no window between them.
     *
     * @param eventId Event ID
     * @param tickets Tickets to debit
     * @param now Update timestamp
     * @return Number of rows updated (1 if debited, 0 if capacity was insufficient)
     */
    @Modifying
    @Query("UPDATE Event e SET " +
           "e.availableCapacity = e.availableCapacity - :tickets, " +
           "e.updatedAt = :now " +
           "WHERE e.eventId = :eventId AND e.availableCapacity >= :tickets")
    int debitCapacity(@Param("eventId") String eventId,
                      @Param("tickets") Integer tickets,
                      @Param("now") Instant now);

    /**
     * Atomically credit available capacity back.
     * Not conditioned on event status, so capacity of cancelled or completed events is still reclaimed.
     * The total capacity bound is part of the predicate.
     *
     * @param eventId Event ID
     * @param tickets Tickets to release
     * @param now Update timestamp
     * @return Number of rows updated
     */
    @Modifying
    @Query("UPDATE Event e SET " +
           "e.availableCapacity = e.availableCapacity + :tickets, " +
           "e.updatedAt = :now " +
           "WHERE e.eventId = :eventId AND e.availableCapacity + :tickets <= e.totalCapacity")
    int creditCapacity(@Param("eventId") String eventId,
                       @Param("tickets") Integer tickets,
                       @Param("now") Instant now);

    /**
     * Get current available capacity for an event.
     *
     * @param eventId Event ID
     * @return Available capacity, or null if the event does not exist
     */
    @Query("SELECT e.availableCapacity FROM Event e WHERE e.eventId = :eventId")
    Integer getAvailableCapacity(@Param("eventId") String eventId);

    /**
     * Move events whose end time has passed from one status to another.
     * Used by the event lifecycle sweep (ACTIVE -> COMPLETED).
     *
     * @param from Current status
     * @param to Target status
     * @param now Current timestamp
     * @return Number of events updated
     */
    @Modifying
    @Query("UPDATE Event e SET e.status = :to, e.updatedAt = :now " +
           "WHERE e.status = :from AND e.endTime < :now")
    int transitionFinishedEvents(@Param("from") EventStatus from,
                                 @Param("to") EventStatus to,
                                 @Param("now") Instant now);
}
