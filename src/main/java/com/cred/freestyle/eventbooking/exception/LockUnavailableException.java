package com.cred.freestyle.eventbooking.exception;

/**
 * Exception thrown when a distributed lock could not be acquired within its retry budget.
 * Safe for the caller to retry the whole operation later.
 *
 * @author Event Booking Team
 */
public class LockUnavailableException extends BookingException {

    private final String resourceKey;

    public LockUnavailableException(String resourceKey) {
        super(ErrorKind.LOCK_UNAVAILABLE, String.format("Could not acquire lock on resource: %s", resourceKey));
        this.resourceKey = resourceKey;
    }

    public String getResourceKey() {
        return resourceKey;
    }
}
