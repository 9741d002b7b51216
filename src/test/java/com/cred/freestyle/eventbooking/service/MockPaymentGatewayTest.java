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
import com.cred.freestyle.eventbooking.testutil.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Optional;

import static com.cred.freestyle.eventbooking.testutil.TestDataBuilder.NOW;
import static com.cred.freestyle.eventbooking.testutil.TestDataBuilder.aBooking;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for MockPaymentGateway.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("MockPaymentGateway Unit Tests")
class MockPaymentGatewayTest {

    @Mock
    private PaymentIntentRepository paymentIntentRepository;

    @Mock
    private RefundRepository refundRepository;

    private MutableClock clock;

    private MockPaymentGateway gateway;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        gateway = new MockPaymentGateway(paymentIntentRepository, refundRepository, clock);
        lenient().when(paymentIntentRepository.save(any(PaymentIntent.class))).thenAnswer(inv -> inv.getArgument(0));
        lenient().when(refundRepository.save(any(Refund.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    private PaymentIntent createdIntent(String id) {
        return PaymentIntent.builder()
                .paymentIntentId(id)
                .clientSecret(id + "_secret")
                .amount(new BigDecimal("1000.00"))
                .status(PaymentIntentStatus.CREATED)
                .paymentMethod("card")
                .bookingId("b-1")
                .createdAt(NOW)
                .expiresAt(NOW.plus(Duration.ofMinutes(15)))
                .build();
    }

    @Test
    @DisplayName("createPaymentIntent - New intent carries the booking amount and a 15 minute TTL")
    void createPaymentIntent_New() {
        // Given
        Booking booking = aBooking().bookingId("b-1").totalPrice("1500.00").build();
        when(paymentIntentRepository.findFirstByBookingIdAndStatusOrderByCreatedAtDesc("b-1", PaymentIntentStatus.CREATED))
                .thenReturn(Optional.empty());

        // When
        PaymentIntent intent = gateway.createPaymentIntent(booking, "card");

        // Then
        assertThat(intent.getPaymentIntentId()).startsWith("pi_");
        assertThat(intent.getClientSecret()).startsWith(intent.getPaymentIntentId() + "_secret_");
        assertThat(intent.getAmount()).isEqualByComparingTo("1500.00");
        assertThat(intent.getCurrency()).isEqualTo("inr");
        assertThat(intent.getStatus()).isEqualTo(PaymentIntentStatus.CREATED);
        assertThat(intent.getExpiresAt()).isEqualTo(NOW.plus(Duration.ofMinutes(15)));
    }

    @Test
    @DisplayName("createPaymentIntent - Live CREATED intent is reused")
    void createPaymentIntent_Reuse() {
        // Given
        PaymentIntent existing = createdIntent("pi_existing");
        when(paymentIntentRepository.findFirstByBookingIdAndStatusOrderByCreatedAtDesc("b-1", PaymentIntentStatus.CREATED))
                .thenReturn(Optional.of(existing));

        // When
        PaymentIntent intent = gateway.createPaymentIntent(aBooking().bookingId("b-1").build(), "card");

        // Then
        assertThat(intent).isSameAs(existing);
        verify(paymentIntentRepository, never()).save(any());
    }

    @Test
    @DisplayName("processPayment - Deterministic success and failure")
    void processPayment_Outcomes() {
        // Given
        when(paymentIntentRepository.findById("pi_ok")).thenReturn(Optional.of(createdIntent("pi_ok")));
        when(paymentIntentRepository.findById("pi_ko")).thenReturn(Optional.of(createdIntent("pi_ko")));

        // When
        PaymentIntent ok = gateway.processPayment("pi_ok", true);
        PaymentIntent ko = gateway.processPayment("pi_ko", false);

        // Then
        assertThat(ok.getStatus()).isEqualTo(PaymentIntentStatus.SUCCEEDED);
        assertThat(ko.getStatus()).isEqualTo(PaymentIntentStatus.FAILED);
        assertThat(ko.getErrorCode()).isEqualTo("payment_failed");
        assertThat(ko.getDeclineCode()).isEqualTo("card_declined");
    }

    @Test
    @DisplayName("processPayment - Settled intent cannot be processed again")
    void processPayment_AlreadySettled() {
        // Given
        PaymentIntent intent = createdIntent("pi_1");
        intent.setStatus(PaymentIntentStatus.SUCCEEDED);
        when(paymentIntentRepository.findById("pi_1")).thenReturn(Optional.of(intent));

        // When / Then
        assertThatThrownBy(() -> gateway.processPayment("pi_1", true))
                .isInstanceOf(InvalidBookingStateException.class)
                .hasMessage("Payment intent is already succeeded");
    }

    @Test
    @DisplayName("processPayment - Lapsed intent is marked EXPIRED and rejected")
    void processPayment_Expired() {
        // Given
        PaymentIntent intent = createdIntent("pi_1");
        when(paymentIntentRepository.findById("pi_1")).thenReturn(Optional.of(intent));
        clock.advance(Duration.ofMinutes(16));

        // When / Then
        assertThatThrownBy(() -> gateway.processPayment("pi_1", true))
                .isInstanceOf(ReservationExpiredException.class);
        assertThat(intent.getStatus()).isEqualTo(PaymentIntentStatus.EXPIRED);
        assertThat(intent.getErrorCode()).isEqualTo("payment_intent_expired");
        verify(paymentIntentRepository).save(intent);
    }

    @Test
    @DisplayName("verifyPayment - Only SUCCEEDED intents verify")
    void verifyPayment() {
        // Given
        PaymentIntent succeeded = createdIntent("pi_ok");
        succeeded.setStatus(PaymentIntentStatus.SUCCEEDED);
        when(paymentIntentRepository.findById("pi_ok")).thenReturn(Optional.of(succeeded));
        when(paymentIntentRepository.findById("pi_new")).thenReturn(Optional.of(createdIntent("pi_new")));
        when(paymentIntentRepository.findById("pi_missing")).thenReturn(Optional.empty());

        // When / Then
        assertThat(gateway.verifyPayment("pi_ok")).isTrue();
        assertThat(gateway.verifyPayment("pi_new")).isFalse();
        assertThatThrownBy(() -> gateway.verifyPayment("pi_missing"))
                .isInstanceOf(ResourceNotFoundException.class)
                .hasMessage("Payment intent not found: pi_missing");
    }

    @Test
    @DisplayName("processRefund - Creates one refund per intent and returns it on repeat")
    void processRefund_Idempotent() {
        // Given
        PaymentIntent succeeded = createdIntent("pi_1");
        succeeded.setStatus(PaymentIntentStatus.SUCCEEDED);
        when(paymentIntentRepository.findById("pi_1")).thenReturn(Optional.of(succeeded));
        when(refundRepository.findByPaymentIntentId("pi_1")).thenReturn(Optional.empty());

        // When
        Refund first = gateway.processRefund("pi_1", new BigDecimal("500.00"), "Refund for booking #b-1");

        when(refundRepository.findByPaymentIntentId("pi_1")).thenReturn(Optional.of(first));
        Refund second = gateway.processRefund("pi_1", new BigDecimal("500.00"), "Refund for booking #b-1");

        // Then
        assertThat(first.getRefundId()).startsWith("re_");
        assertThat(first.getStatus()).isEqualTo("succeeded");
        assertThat(first.getAmount()).isEqualByComparingTo("500.00");
        assertThat(second).isSameAs(first);
        verify(refundRepository, times(1)).save(any(Refund.class));
    }

    @Test
    @DisplayName("processRefund - Unsuccessful payment cannot be refunded")
    void processRefund_NotSucceeded() {
        // Given
        when(paymentIntentRepository.findById("pi_1")).thenReturn(Optional.of(createdIntent("pi_1")));

        // When / Then
        assertThatThrownBy(() -> gateway.processRefund("pi_1", BigDecimal.TEN, "reason"))
                .isInstanceOf(RefundFailedException.class)
                .hasMessage("Cannot refund unsuccessful payment");
        verifyNoInteractions(refundRepository);
    }

    @Test
    @DisplayName("cleanupExpiredPaymentIntents - Deletes EXPIRED intents older than 24 hours")
    void cleanupExpiredPaymentIntents() {
        // Given
        when(paymentIntentRepository.deleteByStatusAndExpiresAtBefore(PaymentIntentStatus.EXPIRED,
                NOW.minus(Duration.ofHours(24)))).thenReturn(4);

        // When / Then
        assertThat(gateway.cleanupExpiredPaymentIntents()).isEqualTo(4);
    }
}
