package com.cred.freestyle.eventbooking.service;

import com.cred.freestyle.eventbooking.domain.model.Booking;
import com.cred.freestyle.eventbooking.domain.model.PaymentIntent;
import com.cred.freestyle.eventbooking.domain.model.Refund;

import java.math.BigDecimal;

/**
 * Payment collaborator consumed by the booking core.
 * The core never assumes a payment succeeded unless it fetched that outcome from here itself.
 *
 * @author Event Booking Team
 */
public interface PaymentGateway {

    /**
     * Create a payment intent for a held reservation.
     * At most one live intent exists per booking: an unexpired CREATED intent is returned as is.
     *
     * @param booking Reservation to pay for
     * @param paymentMethod card, upi or netbanking
     * @return Payment intent
     */
    PaymentIntent createPaymentIntent(Booking booking, String paymentMethod);

    /**
     * Process a payment for an intent.
     *
     * @param paymentIntentId Payment intent ID
     * @param shouldSucceed Deterministic outcome of the attempt
     * @return Updated payment intent (SUCCEEDED or FAILED)
     */
    PaymentIntent processPayment(String paymentIntentId, boolean shouldSucceed);

    /**
     * Check whether the payment of an intent succeeded.
     *
     * @param paymentIntentId Payment intent ID
     * @return true if the intent is SUCCEEDED
     */
    boolean verifyPayment(String paymentIntentId);

    /**
     * Refund a successful payment. Idempotent per intent: a second call returns the first refund.
     *
     * @param paymentIntentId Payment intent ID
     * @param amount Amount to refund
     * @param reason Refund reason
     * @return Refund record
     * @throws com.cred.freestyle.eventbooking.exception.RefundFailedException if the payment cannot be refunded
     */
    Refund processRefund(String paymentIntentId, BigDecimal amount, String reason);

    /**
     * Delete EXPIRED intents past their retention window.
     *
     * @return Number of intents deleted
     */
    int cleanupExpiredPaymentIntents();
}
