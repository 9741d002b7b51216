package com.cred.freestyle.eventbooking.exception;

/**
 * Exception thrown when a payment could not be verified as succeeded.
 *
 * @author Event Booking Team
 */
public class PaymentFailedException extends BookingException {

    private final String paymentIntentId;

    public PaymentFailedException(String paymentIntentId, String message) {
        super(ErrorKind.PAYMENT_FAILED, message);
        this.paymentIntentId = paymentIntentId;
    }

    public String getPaymentIntentId() {
        return paymentIntentId;
    }
}
