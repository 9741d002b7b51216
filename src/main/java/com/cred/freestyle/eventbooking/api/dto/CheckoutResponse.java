package com.cred.freestyle.eventbooking.api.dto;

import com.cred.freestyle.eventbooking.domain.model.PaymentCheckout;

import java.time.Instant;

/**
 * Response DTO for checkout start: the payment intent plus the deadline of the hold it pays for.
 *
 * @author Event Booking Team
 */
public class CheckoutResponse {

    private PaymentIntentResponse paymentIntent;
    private String reservationId;
    private Instant reservationExpiresAt;

    public CheckoutResponse() {
    }

    public static CheckoutResponse from(PaymentCheckout checkout) {
        CheckoutResponse response = new CheckoutResponse();
        response.setPaymentIntent(PaymentIntentResponse.fromEntity(checkout.getPaymentIntent()));
        response.setReservationId(checkout.getReservationId());
        response.setReservationExpiresAt(checkout.getReservationExpiresAt());
        return response;
    }

    public PaymentIntentResponse getPaymentIntent() {
        return paymentIntent;
    }

    public void setPaymentIntent(PaymentIntentResponse paymentIntent) {
        this.paymentIntent = paymentIntent;
    }

    public String getReservationId() {
        return reservationId;
    }

    public void setReservationId(String reservationId) {
        this.reservationId = reservationId;
    }

    public Instant getReservationExpiresAt() {
        return reservationExpiresAt;
    }

    public void setReservationExpiresAt(Instant reservationExpiresAt) {
        this.reservationExpiresAt = reservationExpiresAt;
    }
}
