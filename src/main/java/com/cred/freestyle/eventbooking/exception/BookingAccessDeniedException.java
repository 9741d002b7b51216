package com.cred.freestyle.eventbooking.exception;

/**
 * Exception thrown when the caller does not own the booking it is operating on.
 *
 * @author Event Booking Team
 */
public class BookingAccessDeniedException extends BookingException {

    private final String bookingId;

    public BookingAccessDeniedException(String bookingId, String message) {
        super(ErrorKind.FORBIDDEN, message);
        this.bookingId = bookingId;
    }

    public String getBookingId() {
        return bookingId;
    }
}
