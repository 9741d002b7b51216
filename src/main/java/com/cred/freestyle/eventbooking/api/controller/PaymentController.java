package com.cred.freestyle.eventbooking.api.controller;

import com.cred.freestyle.eventbooking.api.dto.BookingResponse;
import com.cred.freestyle.eventbooking.api.dto.CheckoutRequest;
import com.cred.freestyle.eventbooking.api.dto.CheckoutResponse;
import com.cred.freestyle.eventbooking.api.dto.ConfirmBookingRequest;
import com.cred.freestyle.eventbooking.api.dto.PaymentIntentResponse;
import com.cred.freestyle.eventbooking.api.dto.ProcessPaymentRequest;
import com.cred.freestyle.eventbooking.domain.model.Booking;
import com.cred.freestyle.eventbooking.domain.model.PaymentCheckout;
import com.cred.freestyle.eventbooking.domain.model.PaymentIntent;
import com.cred.freestyle.eventbooking.security.SecurityUtils;
import com.cred.freestyle.eventbooking.service.PaymentService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;

/**
 * REST controller for paying a held reservation.
 *
 * Flow:
 * 1. POST /create-intent for a RESERVED booking (protects the hold from the expiry sweep)
 * 2. POST /process to settle the intent
 * 3. POST /confirm to verify the payment and confirm the booking
 *
 * @author Event Booking Team
 */
@RestController
@RequestMapping("/api/v1/payments")
public class PaymentController {

    private static final Logger logger = LoggerFactory.getLogger(PaymentController.class);

    private final PaymentService paymentService;
    private final Clock clock;

    public PaymentController(PaymentService paymentService, Clock clock) {
        this.paymentService = paymentService;
        this.clock = clock;
    }

    @PostMapping("/create-intent")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<CheckoutResponse> createPaymentIntent(@Valid @RequestBody CheckoutRequest request) {
        String userId = SecurityUtils.requireCurrentUserId();

        PaymentCheckout checkout = paymentService.createPaymentIntent(
                request.getReservationId(), userId, request.getPaymentMethod());

        return ResponseEntity.status(HttpStatus.CREATED).body(CheckoutResponse.from(checkout));
    }

    /**
     * Settle a payment intent. A declined payment is a normal outcome and is returned
     * with status failed and its decline code.
     */
    @PostMapping("/process")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<PaymentIntentResponse> processPayment(@Valid @RequestBody ProcessPaymentRequest request) {
        String userId = SecurityUtils.requireCurrentUserId();
        boolean shouldSucceed = !Boolean.FALSE.equals(request.getShouldSucceed());

        PaymentIntent processed = paymentService.processPayment(request.getPaymentIntentId(), userId, shouldSucceed);
        logger.info("Payment {} processed for user {}: {}", processed.getPaymentIntentId(), userId, processed.getStatus());

        return ResponseEntity.ok(PaymentIntentResponse.fromEntity(processed));
    }

    @PostMapping("/confirm")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<BookingResponse> confirmPayment(@Valid @RequestBody ConfirmBookingRequest request) {
        String userId = SecurityUtils.requireCurrentUserId();

        Booking confirmed = paymentService.confirmPaymentAndBooking(
                request.getPaymentIntentId(), request.getReservationId(), userId);

        return ResponseEntity.ok(BookingResponse.fromEntity(confirmed, clock.instant()));
    }
}
