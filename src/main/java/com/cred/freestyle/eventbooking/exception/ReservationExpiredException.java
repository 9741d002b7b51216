package com.cred.freestyle.eventbooking.exception;

import java.time.Instant;

/**
 * Exception thrown when a reservation hold or a payment intent has expired.
 * Kept distinct from {@link InvalidBookingStateException} so clients can prompt
 * the user to make a new booking.
 *
 * @author Event Booking Team
 */
public class ReservationExpiredException extends BookingException {

    private final String resourceId;
    private final Instant expiredAt;

    public ReservationExpiredException(String resourceId, Instant expiredAt, String message) {
        super(ErrorKind.EXPIRED, message);
        this.resourceId = resourceId;
        this.expiredAt = expiredAt;
    }

    public String getResourceId() {
        return resourceId;
    }

    public Instant getExpiredAt() {
        return expiredAt;
    }
}
