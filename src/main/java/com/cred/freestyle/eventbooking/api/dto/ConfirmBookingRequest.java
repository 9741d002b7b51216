package com.cred.freestyle.eventbooking.api.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * Request DTO for confirming a reservation with a payment intent.
 *
 * @author Event Booking Team
 */
public class ConfirmBookingRequest {

    @NotBlank(message = "Reservation ID is required")
    private String reservationId;

    @NotBlank(message = "Payment intent ID is required")
    private String paymentIntentId;

    public ConfirmBookingRequest() {
    }

    public ConfirmBookingRequest(String reservationId, String paymentIntentId) {
        this.reservationId = reservationId;
        this.paymentIntentId = paymentIntentId;
    }

    public String getReservationId() {
        return reservationId;
    }

    public void setReservationId(String reservationId) {
        this.reservationId = reservationId;
    }

    public String getPaymentIntentId() {
        return paymentIntentId;
    }

    public void setPaymentIntentId(String paymentIntentId) {
        this.paymentIntentId = paymentIntentId;
    }
}
