package com.cred.freestyle.eventbooking.exception;

/**
 * Stable, machine-checkable failure kinds surfaced by the booking core.
 * Callers map these to transport-level responses.
 *
 * @author Event Booking Team
 */
public enum ErrorKind {
    NOT_FOUND(false),
    FORBIDDEN(false),
    INVALID_STATE(false),
    EXPIRED(false),
    CAPACITY_EXCEEDED(false),
    QUOTA_EXCEEDED(false),
    TRANSIENT_CONFLICT(true),
    LOCK_UNAVAILABLE(true),
    REFUND_FAILED(false),
    PAYMENT_FAILED(false);

    private final boolean retryable;

    ErrorKind(boolean retryable) {
        this.retryable = retryable;
    }

    /**
     * Whether the caller may safely retry the whole operation later.
     */
    public boolean isRetryable() {
        return retryable;
    }
}
