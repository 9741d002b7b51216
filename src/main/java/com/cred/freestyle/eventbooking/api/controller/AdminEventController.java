package com.cred.freestyle.eventbooking.api.controller;

import com.cred.freestyle.eventbooking.api.dto.BookingToggleRequest;
import com.cred.freestyle.eventbooking.api.dto.CleanupResponse;
import com.cred.freestyle.eventbooking.api.dto.CreateEventRequest;
import com.cred.freestyle.eventbooking.api.dto.EventResponse;
import com.cred.freestyle.eventbooking.domain.model.Event;
import com.cred.freestyle.eventbooking.security.SecurityUtils;
import com.cred.freestyle.eventbooking.service.BookingService;
import com.cred.freestyle.eventbooking.service.EventService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Admin operations on events, plus an on-demand run of the expiry sweep.
 *
 * Authorization: ADMIN role (also enforced at the URL level in SecurityConfig)
 *
 * @author Event Booking Team
 */
@RestController
@RequestMapping("/api/v1/admin")
@PreAuthorize("hasRole('ADMIN')")
public class AdminEventController {

    private static final Logger logger = LoggerFactory.getLogger(AdminEventController.class);

    private final EventService eventService;
    private final BookingService bookingService;

    public AdminEventController(EventService eventService, BookingService bookingService) {
        this.eventService = eventService;
        this.bookingService = bookingService;
    }

    @PostMapping("/events")
    public ResponseEntity<EventResponse> createEvent(@Valid @RequestBody CreateEventRequest request) {
        String adminId = SecurityUtils.requireCurrentUserId();

        Event event = eventService.createEvent(
                adminId,
                request.getName(),
                request.getVenueName(),
                request.getVenueAddress(),
                request.getStartTime(),
                request.getEndTime(),
                request.getTotalCapacity(),
                request.getPrice()
        );

        return ResponseEntity.status(HttpStatus.CREATED).body(EventResponse.fromEntity(event));
    }

    @PostMapping("/events/{eventId}/cancel")
    public ResponseEntity<EventResponse> cancelEvent(@PathVariable String eventId) {
        return ResponseEntity.ok(EventResponse.fromEntity(eventService.cancelEvent(eventId)));
    }

    @PostMapping("/events/{eventId}/reactivate")
    public ResponseEntity<EventResponse> reactivateEvent(@PathVariable String eventId) {
        return ResponseEntity.ok(EventResponse.fromEntity(eventService.reactivateEvent(eventId)));
    }

    @PostMapping("/events/{eventId}/booking-enabled")
    public ResponseEntity<EventResponse> setBookingEnabled(
            @PathVariable String eventId,
            @Valid @RequestBody BookingToggleRequest request
    ) {
        Event event = eventService.setBookingEnabled(eventId, request.getEnabled());
        return ResponseEntity.ok(EventResponse.fromEntity(event));
    }

    /**
     * Run the expired-reservation sweep now instead of waiting for the scheduler.
     */
    @PostMapping("/reservations/cleanup")
    public ResponseEntity<CleanupResponse> cleanupExpiredReservations() {
        int reclaimed = bookingService.cleanupExpiredReservations();
        logger.info("Manual reservation cleanup by admin {} reclaimed {} holds",
                SecurityUtils.getCurrentUserId(), reclaimed);
        return ResponseEntity.ok(new CleanupResponse(reclaimed));
    }
}
