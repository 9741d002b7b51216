package com.cred.freestyle.eventbooking.exception;

/**
 * Exception thrown when the conditional capacity debit finds too few tickets.
 * This reflects real scarcity, so an immediate retry is pointless.
 *
 * @author Event Booking Team
 */
public class CapacityExceededException extends BookingException {

    private final String eventId;
    private final Integer requestedTickets;
    private final Integer availableTickets;

    public CapacityExceededException(String eventId, Integer requestedTickets, Integer availableTickets) {
        super(ErrorKind.CAPACITY_EXCEEDED, String.format("Only %d tickets available for event %s, requested %d",
                availableTickets, eventId, requestedTickets));
        this.eventId = eventId;
        this.requestedTickets = requestedTickets;
        this.availableTickets = availableTickets;
    }

    public String getEventId() {
        return eventId;
    }

    public Integer getRequestedTickets() {
        return requestedTickets;
    }

    public Integer getAvailableTickets() {
        return availableTickets;
    }
}
