package com.cred.freestyle.eventbooking.api.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of POST /api/v1/payments/create-intent: opens a payment intent for a held reservation.
 * Omitting {@code paymentMethod} means card; the accepted values are those listed by
 * GET /api/v1/bookings/{bookingId}/payment-options.
 *
 * @author Event Booking Team
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CheckoutRequest {

    @NotBlank(message = "Reservation ID is required")
    private String reservationId;

    private String paymentMethod = "card";
}
