package com.cred.freestyle.eventbooking.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A payment intent handed to the client, with the hold deadline it must be paid by.
 *
 * @author Event Booking Team
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaymentCheckout {

    private PaymentIntent paymentIntent;

    private String reservationId;

    private Instant reservationExpiresAt;
}
