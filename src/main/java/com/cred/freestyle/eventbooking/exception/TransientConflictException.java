package com.cred.freestyle.eventbooking.exception;

/**
 * Exception thrown when a unit of work kept failing on deadlock or serialization
 * conflicts after all automatic retries.
 *
 * @author Event Booking Team
 */
public class TransientConflictException extends BookingException {

    private final int attempts;

    public TransientConflictException(int attempts, Throwable cause) {
        super(ErrorKind.TRANSIENT_CONFLICT,
                String.format("Transaction conflict persisted after %d attempts, please retry", attempts), cause);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
