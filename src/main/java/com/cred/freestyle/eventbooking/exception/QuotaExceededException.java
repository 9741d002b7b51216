package com.cred.freestyle.eventbooking.exception;

/**
 * Exception thrown when a reservation would push a user past the per-event ticket cap.
 * Confirmed tickets and unexpired holds both count towards the cap.
 *
 * @author Event Booking Team
 */
public class QuotaExceededException extends BookingException {

    private final String userId;
    private final String eventId;
    private final int confirmedTickets;
    private final int reservedTickets;
    private final int maxTickets;

    public QuotaExceededException(String userId, String eventId, int confirmedTickets, int reservedTickets, int maxTickets) {
        super(ErrorKind.QUOTA_EXCEEDED, String.format(
                "You can book a maximum of %d tickets per event. You have %d confirmed tickets and %d pending reservations.",
                maxTickets, confirmedTickets, reservedTickets));
        this.userId = userId;
        this.eventId = eventId;
        this.confirmedTickets = confirmedTickets;
        this.reservedTickets = reservedTickets;
        this.maxTickets = maxTickets;
    }

    public String getUserId() {
        return userId;
    }

    public String getEventId() {
        return eventId;
    }

    public int getConfirmedTickets() {
        return confirmedTickets;
    }

    public int getReservedTickets() {
        return reservedTickets;
    }

    public int getMaxTickets() {
        return maxTickets;
    }
}
