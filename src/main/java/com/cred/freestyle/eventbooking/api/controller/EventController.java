package com.cred.freestyle.eventbooking.api.controller;

import com.cred.freestyle.eventbooking.api.dto.EventResponse;
import com.cred.freestyle.eventbooking.service.EventService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Public read access to events and their remaining capacity.
 *
 * @author Event Booking Team
 */
@RestController
@RequestMapping("/api/v1/events")
public class EventController {

    private final EventService eventService;

    public EventController(EventService eventService) {
        this.eventService = eventService;
    }

    @GetMapping("/{eventId}")
    public ResponseEntity<EventResponse> getEvent(@PathVariable String eventId) {
        return ResponseEntity.ok(EventResponse.fromEntity(eventService.getEvent(eventId)));
    }
}
