package com.cred.freestyle.eventbooking.service;

import com.cred.freestyle.eventbooking.domain.model.Booking;
import com.cred.freestyle.eventbooking.domain.model.PaymentIntent;
import com.cred.freestyle.eventbooking.domain.model.PaymentIntent.PaymentIntentStatus;
import com.cred.freestyle.eventbooking.domain.model.Refund;
import com.cred.freestyle.eventbooking.exception.InvalidBookingStateException;
import com.cred.freestyle.eventbooking.exception.RefundFailedException;
import com.cred.freestyle.eventbooking.exception.ReservationExpiredException;
import com.cred.freestyle.eventbooking.exception.ResourceNotFoundException;
import com.cred.freestyle.eventbooking.repository.PaymentIntentRepository;
import com.cred.freestyle.eventbooking.repository.RefundRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Deterministic payment gateway stand-in backed by the payment_intents and refunds tables.
 * Outcomes are driven only by the caller's shouldSucceed flag, never by randomness.
 *
 * @author Event Booking Team
 */
@Service
public class MockPaymentGateway implements PaymentGateway {

    private static final Logger logger = LoggerFactory.getLogger(MockPaymentGateway.class);

    static final String PAYMENT_FAILED_CODE = "payment_failed";
    static final String INTENT_EXPIRED_CODE = "payment_intent_expired";
    static final String DECLINE_CODE = "card_declined";
    static final String REFUND_SUCCEEDED = "succeeded";

    private final PaymentIntentRepository paymentIntentRepository;
    private final RefundRepository refundRepository;
    private final Clock clock;

    @Value("${eventbooking.payment.intent-ttl-minutes:15}")
    private long intentTtlMinutes = 15;

    @Value("${eventbooking.payment.expired-retention-hours:24}")
    private long expiredRetentionHours = 24;

    public MockPaymentGateway(
            PaymentIntentRepository paymentIntentRepository,
            RefundRepository refundRepository,
            Clock clock
    ) {
        this.paymentIntentRepository = paymentIntentRepository;
        this.refundRepository = refundRepository;
        this.clock = clock;
    }

    @Override
    @Transactional
    public PaymentIntent createPaymentIntent(Booking booking, String paymentMethod) {
        Instant now = clock.instant();

        Optional<PaymentIntent> existing = paymentIntentRepository
                .findFirstByBookingIdAndStatusOrderByCreatedAtDesc(booking.getBookingId(), PaymentIntentStatus.CREATED);
        if (existing.isPresent() && !existing.get().isExpired(now)) {
            logger.info("Reusing payment intent {} for booking {}",
                    existing.get().getPaymentIntentId(), booking.getBookingId());
            return existing.get();
        }

        String paymentIntentId = "pi_" + UUID.randomUUID().toString().replace("-", "");
        PaymentIntent intent = PaymentIntent.builder()
                .paymentIntentId(paymentIntentId)
                .clientSecret(paymentIntentId + "_secret_" + UUID.randomUUID().toString().replace("-", ""))
                .amount(booking.getTotalPrice())
                .currency("inr")
                .status(PaymentIntentStatus.CREATED)
                .paymentMethod(paymentMethod)
                .bookingId(booking.getBookingId())
                .createdAt(now)
                .expiresAt(now.plus(Duration.ofMinutes(intentTtlMinutes)))
                .build();

        intent = paymentIntentRepository.save(intent);
        logger.info("Created payment intent {} for booking {}, amount: {}",
                paymentIntentId, booking.getBookingId(), booking.getTotalPrice());
        return intent;
    }

    @Override
    @Transactional(noRollbackFor = ReservationExpiredException.class)
    public PaymentIntent processPayment(String paymentIntentId, boolean shouldSucceed) {
        PaymentIntent intent = findIntent(paymentIntentId);
        expireIfLapsed(intent);

        if (intent.getStatus() != PaymentIntentStatus.CREATED) {
            throw new InvalidBookingStateException(paymentIntentId, intent.getStatus().name(),
                    String.format("Payment intent is already %s", intent.getStatus().name().toLowerCase()));
        }

        if (shouldSucceed) {
            intent.setStatus(PaymentIntentStatus.SUCCEEDED);
            logger.info("Payment succeeded for intent {}", paymentIntentId);
        } else {
            intent.setStatus(PaymentIntentStatus.FAILED);
            intent.setErrorCode(PAYMENT_FAILED_CODE);
            intent.setDeclineCode(DECLINE_CODE);
            logger.warn("Payment failed for intent {}: {}", paymentIntentId, DECLINE_CODE);
        }

        return paymentIntentRepository.save(intent);
    }

    @Override
    @Transactional(noRollbackFor = ReservationExpiredException.class)
    public boolean verifyPayment(String paymentIntentId) {
        PaymentIntent intent = findIntent(paymentIntentId);
        expireIfLapsed(intent);
        return intent.getStatus() == PaymentIntentStatus.SUCCEEDED;
    }

    /**
     * Runs in its own transaction so a refund failure never poisons the caller's unit of work.
     * The caller's transaction stays open meanwhile, so this borrows a second pooled connection;
     * when none is free within the pool timeout the refund fails and is recorded as REFUND_FAILED.
     */
    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public Refund processRefund(String paymentIntentId, BigDecimal amount, String reason) {
        PaymentIntent intent = findIntent(paymentIntentId);

        if (intent.getStatus() != PaymentIntentStatus.SUCCEEDED) {
            throw new RefundFailedException(paymentIntentId, "Cannot refund unsuccessful payment");
        }

        Optional<Refund> existing = refundRepository.findByPaymentIntentId(paymentIntentId);
        if (existing.isPresent()) {
            logger.info("Refund already exists for payment {}, returning existing refund {}",
                    paymentIntentId, existing.get().getRefundId());
            return existing.get();
        }

        Refund refund = Refund.builder()
                .refundId("re_" + UUID.randomUUID().toString().replace("-", ""))
                .amount(amount)
                .status(REFUND_SUCCEEDED)
                .reason(reason)
                .paymentIntentId(paymentIntentId)
                .createdAt(clock.instant())
                .build();

        refund = refundRepository.save(refund);
        logger.info("Created refund {} for payment {}, amount: {}", refund.getRefundId(), paymentIntentId, amount);
        return refund;
    }

    @Override
    @Transactional
    public int cleanupExpiredPaymentIntents() {
        Instant cutoff = clock.instant().minus(Duration.ofHours(expiredRetentionHours));
        int deleted = paymentIntentRepository.deleteByStatusAndExpiresAtBefore(PaymentIntentStatus.EXPIRED, cutoff);
        if (deleted > 0) {
            logger.info("Deleted {} expired payment intents older than {}", deleted, cutoff);
        }
        return deleted;
    }

    private PaymentIntent findIntent(String paymentIntentId) {
        return paymentIntentRepository.findById(paymentIntentId)
                .orElseThrow(() -> new ResourceNotFoundException("Payment intent", paymentIntentId));
    }

    private void expireIfLapsed(PaymentIntent intent) {
        Instant now = clock.instant();
        if (intent.isExpired(now)) {
            if (intent.getStatus() == PaymentIntentStatus.CREATED || intent.getStatus() == PaymentIntentStatus.EXPIRED) {
                intent.setStatus(PaymentIntentStatus.EXPIRED);
                intent.setErrorCode(INTENT_EXPIRED_CODE);
                paymentIntentRepository.save(intent);
            }
            throw new ReservationExpiredException(intent.getPaymentIntentId(), intent.getExpiresAt(),
                    "Payment intent has expired");
        }
    }
}
