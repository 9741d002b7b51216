package com.cred.freestyle.eventbooking.service;

import com.cred.freestyle.eventbooking.domain.model.Event;
import com.cred.freestyle.eventbooking.domain.model.Event.EventStatus;
import com.cred.freestyle.eventbooking.exception.InvalidBookingStateException;
import com.cred.freestyle.eventbooking.exception.ResourceNotFoundException;
import com.cred.freestyle.eventbooking.infrastructure.tx.TransactionalExecutor;
import com.cred.freestyle.eventbooking.repository.EventRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;

/**
 * Event administration limited to what affects capacity and booking windows.
 *
 * Lifecycle:
 * - Created ACTIVE with available capacity = total capacity, booking enabled
 * - ACTIVE -> CANCELLED by an admin, CANCELLED -> ACTIVE by explicit reactivation
 * - ACTIVE -> COMPLETED automatically once the end time has passed
 *
 * @author Event Booking Team
 */
@Service
public class EventService {

    private static final Logger logger = LoggerFactory.getLogger(EventService.class);

    private final EventRepository eventRepository;
    private final TransactionalExecutor transactionalExecutor;
    private final Clock clock;

    public EventService(EventRepository eventRepository, TransactionalExecutor transactionalExecutor, Clock clock) {
        this.eventRepository = eventRepository;
        this.transactionalExecutor = transactionalExecutor;
        this.clock = clock;
    }

    /**
     * Create a bookable event.
     *
     * @throws IllegalArgumentException if the schedule, capacity or price is invalid
     */
    public Event createEvent(String adminId, String name, String venueName, String venueAddress,
                             Instant startTime, Instant endTime, int totalCapacity, BigDecimal price) {
        Instant now = clock.instant();

        if (name == null || name.isBlank() || startTime == null || endTime == null || price == null) {
            throw new IllegalArgumentException("Missing required fields");
        }
        if (!endTime.isAfter(startTime)) {
            throw new IllegalArgumentException("End time must be after start time");
        }
        if (!startTime.isAfter(now)) {
            throw new IllegalArgumentException("Cannot create events with start time in the past");
        }
        if (totalCapacity < 1) {
            throw new IllegalArgumentException("Total capacity must be at least 1");
        }
        if (price.signum() < 0) {
            throw new IllegalArgumentException("Price cannot be negative");
        }

        Event event = Event.builder()
                .name(name)
                .venueName(venueName)
                .venueAddress(venueAddress)
                .startTime(startTime)
                .endTime(endTime)
                .totalCapacity(totalCapacity)
                .availableCapacity(totalCapacity)
                .price(price)
                .status(EventStatus.ACTIVE)
                .bookingEnabled(true)
                .createdBy(adminId)
                .build();

        Event saved = transactionalExecutor.execute(status -> eventRepository.save(event));
        logger.info("Event created: {} ({}), capacity: {}, by admin {}", saved.getEventId(), name, totalCapacity, adminId);
        return saved;
    }

    /**
     * Cancel an active event. Existing bookings keep their capacity until cancelled or reclaimed.
     */
    public Event cancelEvent(String eventId) {
        Event cancelled = transactionalExecutor.execute(status -> {
            Event event = lockEvent(eventId);

            if (event.getStatus() == EventStatus.COMPLETED) {
                throw new InvalidBookingStateException(eventId, event.getStatus().name(), "Cannot cancel a completed event");
            }
            if (event.getStatus() == EventStatus.CANCELLED) {
                throw new InvalidBookingStateException(eventId, event.getStatus().name(), "Event is already cancelled");
            }

            event.setStatus(EventStatus.CANCELLED);
            return eventRepository.save(event);
        });

        logger.info("Event cancelled: {}", eventId);
        return cancelled;
    }

    /**
     * Bring a cancelled event back, only while it has not started.
     */
    public Event reactivateEvent(String eventId) {
        Event reactivated = transactionalExecutor.execute(status -> {
            Event event = lockEvent(eventId);

            if (event.getStatus() != EventStatus.CANCELLED) {
                throw new InvalidBookingStateException(eventId, event.getStatus().name(),
                        String.format("Cannot reactivate a %s event", event.getStatus().name().toLowerCase()));
            }
            if (event.hasStarted(clock.instant())) {
                throw new InvalidBookingStateException(eventId, event.getStatus().name(),
                        "Event has already started and cannot be modified");
            }

            event.setStatus(EventStatus.ACTIVE);
            return eventRepository.save(event);
        });

        logger.info("Event reactivated: {}", eventId);
        return reactivated;
    }

    /**
     * Open or close an event for new reservations.
     */
    public Event setBookingEnabled(String eventId, boolean enabled) {
        Event updated = transactionalExecutor.execute(status -> {
            Event event = lockEvent(eventId);

            if (event.hasStarted(clock.instant())) {
                throw new InvalidBookingStateException(eventId, event.getStatus().name(),
                        "Event has already started and cannot be modified");
            }
            if (enabled && event.getStatus() != EventStatus.ACTIVE) {
                throw new InvalidBookingStateException(eventId, event.getStatus().name(),
                        String.format("Cannot enable bookings for %s events", event.getStatus().name().toLowerCase()));
            }

            event.setBookingEnabled(enabled);
            return eventRepository.save(event);
        });

        logger.info("Booking {} for event {}", enabled ? "enabled" : "disabled", eventId);
        return updated;
    }

    /**
     * Mark ACTIVE events whose end time has passed as COMPLETED.
     *
     * @return Number of events completed
     */
    public int completeFinishedEvents() {
        int completed = transactionalExecutor.execute(status ->
                eventRepository.transitionFinishedEvents(EventStatus.ACTIVE, EventStatus.COMPLETED, clock.instant()));
        if (completed > 0) {
            logger.info("Marked {} finished events as completed", completed);
        }
        return completed;
    }

    @Transactional(readOnly = true)
    public Event getEvent(String eventId) {
        return eventRepository.findById(eventId)
                .orElseThrow(() -> new ResourceNotFoundException("Event", eventId));
    }

    private Event lockEvent(String eventId) {
        return eventRepository.findByIdForUpdate(eventId)
                .orElseThrow(() -> new ResourceNotFoundException("Event", eventId));
    }
}
