package com.cred.freestyle.eventbooking.exception;

/**
 * Base class for all failures raised by the booking core.
 * Every subclass carries exactly one {@link ErrorKind}.
 *
 * @author Event Booking Team
 */
public abstract class BookingException extends RuntimeException {

    private final ErrorKind kind;

    protected BookingException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected BookingException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
