package com.cred.freestyle.eventbooking.exception;

/**
 * Exception thrown by the payment gateway when a refund cannot be issued.
 * Cancellation records it on the booking and carries on.
 *
 * @author Event Booking Team
 */
public class RefundFailedException extends BookingException {

    private final String paymentIntentId;

    public RefundFailedException(String paymentIntentId, String message) {
        super(ErrorKind.REFUND_FAILED, message);
        this.paymentIntentId = paymentIntentId;
    }

    public String getPaymentIntentId() {
        return paymentIntentId;
    }
}
