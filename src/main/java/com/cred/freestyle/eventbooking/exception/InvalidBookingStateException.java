package com.cred.freestyle.eventbooking.exception;

/**
 * Exception thrown when an operation is attempted against a booking or event
 * in an incompatible status. The message names the current status.
 *
 * @author Event Booking Team
 */
public class InvalidBookingStateException extends BookingException {

    private final String resourceId;
    private final String currentStatus;

    public InvalidBookingStateException(String resourceId, String currentStatus, String message) {
        super(ErrorKind.INVALID_STATE, message);
        this.resourceId = resourceId;
        this.currentStatus = currentStatus;
    }

    public String getResourceId() {
        return resourceId;
    }

    public String getCurrentStatus() {
        return currentStatus;
    }
}
