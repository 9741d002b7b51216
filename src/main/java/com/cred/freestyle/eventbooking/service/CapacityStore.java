package com.cred.freestyle.eventbooking.service;

import com.cred.freestyle.eventbooking.repository.EventRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;

/**
 * Durable event capacity, the single source of truth for oversell prevention.
 *
 * Both operations are single conditional UPDATE statements, so the check and the mutation
 * cannot be separated by a concurrent writer. They must run inside the caller's transaction:
 * the row lock they take is held until that transaction ends.
 *
 * @author Event Booking Team
 */
@Component
@Transactional(propagation = Propagation.MANDATORY)
public class CapacityStore {

    private static final Logger logger = LoggerFactory.getLogger(CapacityStore.class);

    private final EventRepository eventRepository;
    private final Clock clock;

    public CapacityStore(EventRepository eventRepository, Clock clock) {
        this.eventRepository = eventRepository;
        this.clock = clock;
    }

    /**
     * Debit available capacity by {@code tickets}, only if at least that many remain.
     *
     * @param eventId Event ID
     * @param tickets Tickets to debit
     * @return true if debited, false if capacity was insufficient (nothing changed)
     */
    public boolean tryDebit(String eventId, int tickets) {
        int updated = eventRepository.debitCapacity(eventId, tickets, clock.instant());
        if (updated == 0) {
            logger.debug("Capacity debit of {} rejected for event {}", tickets, eventId);
            return false;
        }
        return true;
    }

    /**
     * Credit available capacity by {@code tickets}. Applies to any event status.
     *
     * @param eventId Event ID
     * @param tickets Tickets to release
     * @throws IllegalStateException if the event is missing or the credit would exceed total capacity
     */
    public void credit(String eventId, int tickets) {
        int updated = eventRepository.creditCapacity(eventId, tickets, clock.instant());
        if (updated == 0) {
            logger.error("Capacity credit of {} rejected for event {}: event missing or credit exceeds total capacity",
                    tickets, eventId);
            throw new IllegalStateException(
                    String.format("Cannot release %d tickets to event %s", tickets, eventId));
        }
    }

    /**
     * Current available capacity, as seen by the enclosing transaction.
     */
    public int availableCapacity(String eventId) {
        Integer available = eventRepository.getAvailableCapacity(eventId);
        return available != null ? available : 0;
    }
}
