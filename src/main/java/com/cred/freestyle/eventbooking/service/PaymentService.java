package com.cred.freestyle.eventbooking.service;

import com.cred.freestyle.eventbooking.domain.model.Booking;
import com.cred.freestyle.eventbooking.domain.model.Booking.BookingStatus;
import com.cred.freestyle.eventbooking.domain.model.PaymentCheckout;
import com.cred.freestyle.eventbooking.domain.model.PaymentIntent;
import com.cred.freestyle.eventbooking.domain.model.PaymentOptions;
import com.cred.freestyle.eventbooking.exception.BookingAccessDeniedException;
import com.cred.freestyle.eventbooking.exception.InvalidBookingStateException;
import com.cred.freestyle.eventbooking.exception.PaymentFailedException;
import com.cred.freestyle.eventbooking.exception.ReservationExpiredException;
import com.cred.freestyle.eventbooking.exception.ResourceNotFoundException;
import com.cred.freestyle.eventbooking.infrastructure.metrics.CloudWatchMetricsService;
import com.cred.freestyle.eventbooking.infrastructure.tx.TransactionalExecutor;
import com.cred.freestyle.eventbooking.repository.BookingRepository;
import com.cred.freestyle.eventbooking.repository.PaymentIntentRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

/**
 * Checkout orchestration between a held reservation and the payment gateway.
 *
 * Flow:
 * 1. createPaymentIntent: marks the hold as payment-in-progress, which protects it from the
 *    expiry sweep for the payment grace window
 * 2. processPayment: the gateway settles the intent
 * 3. confirmPaymentAndBooking: verifies the payment with the gateway, then confirms the hold.
 *    On any failure the payment-in-progress flag is cleared again
 *
 * @author Event Booking Team
 */
@Service
public class PaymentService {

    private static final Logger logger = LoggerFactory.getLogger(PaymentService.class);

    private final BookingRepository bookingRepository;
    private final PaymentIntentRepository paymentIntentRepository;
    private final PaymentGateway paymentGateway;
    private final BookingService bookingService;
    private final TransactionalExecutor transactionalExecutor;
    private final CloudWatchMetricsService metricsService;
    private final Clock clock;

    public PaymentService(
            BookingRepository bookingRepository,
            PaymentIntentRepository paymentIntentRepository,
            PaymentGateway paymentGateway,
            BookingService bookingService,
            TransactionalExecutor transactionalExecutor,
            CloudWatchMetricsService metricsService,
            Clock clock
    ) {
        this.bookingRepository = bookingRepository;
        this.paymentIntentRepository = paymentIntentRepository;
        this.paymentGateway = paymentGateway;
        this.bookingService = bookingService;
        this.transactionalExecutor = transactionalExecutor;
        this.metricsService = metricsService;
        this.clock = clock;
    }

    /**
     * Start paying for a held reservation.
     *
     * @param reservationId Booking ID
     * @param userId Caller, must own the booking
     * @param paymentMethod card, upi or netbanking
     * @return Payment intent and the hold deadline
     */
    public PaymentCheckout createPaymentIntent(String reservationId, String userId, String paymentMethod) {
        boolean supported = PaymentOptions.SUPPORTED_METHODS.stream()
                .anyMatch(method -> method.getId().equals(paymentMethod));
        if (!supported) {
            throw new IllegalArgumentException(String.format("Unsupported payment method: %s", paymentMethod));
        }

        PaymentCheckout checkout = transactionalExecutor.execute(status -> {
            Instant now = clock.instant();

            Booking reservation = bookingRepository.findByIdForUpdate(reservationId)
                    .orElseThrow(() -> new ResourceNotFoundException("Reservation", reservationId));

            if (!reservation.getUserId().equals(userId)) {
                throw new BookingAccessDeniedException(reservationId, "You can only pay for your own reservations");
            }
            if (reservation.getStatus() != BookingStatus.RESERVED) {
                throw new InvalidBookingStateException(reservationId, reservation.getStatus().name(),
                        "Cannot process payment for a non-reserved booking");
            }
            if (reservation.isHoldExpired(now)) {
                throw new ReservationExpiredException(reservationId, reservation.getReservationExpiry(),
                        "Reservation has expired. Please make a new booking.");
            }

            reservation.markPaymentProcessing(now);
            bookingRepository.save(reservation);

            PaymentIntent intent = paymentGateway.createPaymentIntent(reservation, paymentMethod);

            return PaymentCheckout.builder()
                    .paymentIntent(intent)
                    .reservationId(reservationId)
                    .reservationExpiresAt(reservation.getReservationExpiry())
                    .build();
        });

        logger.info("Payment started for reservation {} by user {}: intent {}",
                reservationId, userId, checkout.getPaymentIntent().getPaymentIntentId());
        return checkout;
    }

    /**
     * Settle a payment intent of one of the caller's reservations.
     *
     * @param paymentIntentId Payment intent ID
     * @param userId Caller, must own the booking the intent pays for
     * @param shouldSucceed Deterministic outcome of the attempt
     * @return Updated payment intent
     */
    public PaymentIntent processPayment(String paymentIntentId, String userId, boolean shouldSucceed) {
        PaymentIntent intent = paymentIntentRepository.findById(paymentIntentId)
                .orElseThrow(() -> new ResourceNotFoundException("Payment intent", paymentIntentId));
        requireOwner(intent.getBookingId(), userId);

        PaymentIntent processed = paymentGateway.processPayment(paymentIntentId, shouldSucceed);
        metricsService.recordPayment(processed.getStatus().name());
        return processed;
    }

    /**
     * Verify the payment with the gateway and confirm the reservation.
     *
     * @param paymentIntentId Payment intent ID
     * @param reservationId Booking ID the intent pays for
     * @param userId Caller, must own the booking
     * @return CONFIRMED booking
     * @throws PaymentFailedException if the gateway does not report the payment as succeeded
     */
    public Booking confirmPaymentAndBooking(String paymentIntentId, String reservationId, String userId) {
        requireOwner(reservationId, userId);

        try {
            PaymentIntent intent = paymentIntentRepository.findById(paymentIntentId)
                    .orElseThrow(() -> new ResourceNotFoundException("Payment intent", paymentIntentId));
            if (!reservationId.equals(intent.getBookingId())) {
                throw new InvalidBookingStateException(paymentIntentId, intent.getStatus().name(),
                        "Payment intent does not belong to this reservation");
            }

            if (!paymentGateway.verifyPayment(paymentIntentId)) {
                logger.warn("Payment verification failed for intent {} (reservation {})", paymentIntentId, reservationId);
                throw new PaymentFailedException(paymentIntentId, "Payment verification failed");
            }

            return bookingService.confirmReservation(reservationId, userId, paymentIntentId);

        } catch (RuntimeException e) {
            releasePaymentProcessing(reservationId);
            throw e;
        }
    }

    private void requireOwner(String bookingId, String userId) {
        Booking booking = bookingRepository.findById(bookingId)
                .orElseThrow(() -> new ResourceNotFoundException("Reservation", bookingId));
        if (!booking.getUserId().equals(userId)) {
            throw new BookingAccessDeniedException(bookingId, "You can only pay for your own reservations");
        }
    }

    /**
     * Clear the payment-in-progress flag while the booking is still RESERVED, so the expiry
     * sweep may reclaim the hold once it lapses.
     */
    private void releasePaymentProcessing(String reservationId) {
        try {
            int updated = transactionalExecutor.execute(
                    status -> bookingRepository.clearPaymentProcessing(reservationId, BookingStatus.RESERVED));
            if (updated > 0) {
                logger.info("Cleared payment processing flag for reservation {}", reservationId);
            }
        } catch (RuntimeException e) {
            // The original failure is what the caller sees; the grace window still bounds the hold.
            logger.error("Failed to clear payment processing flag for reservation {}", reservationId, e);
        }
    }
}
