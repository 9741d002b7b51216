package com.cred.freestyle.eventbooking.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Payment intent owned by the payment gateway stand-in.
 * Linked to exactly one booking.
 *
 * @author Event Booking Team
 */
@Entity
@Table(name = "payment_intents", indexes = {
    @Index(name = "idx_payment_intents_booking", columnList = "booking_id"),
    @Index(name = "idx_payment_intents_status_expires", columnList = "status, expires_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaymentIntent {

    @Id
    @Column(name = "payment_intent_id", nullable = false, length = 64)
    private String paymentIntentId;

    @Column(name = "client_secret", nullable = false, length = 128)
    private String clientSecret;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private PaymentIntentStatus status;

    @Column(name = "amount", nullable = false, precision = 10, scale = 2)
    private BigDecimal amount;

    @Column(name = "currency", nullable = false, length = 8)
    @Builder.Default
    private String currency = "inr";

    @Column(name = "payment_method", nullable = false, length = 32)
    private String paymentMethod;

    @Column(name = "booking_id", nullable = false, length = 36)
    private String bookingId;

    @Column(name = "error_code", length = 64)
    private String errorCode;

    @Column(name = "decline_code", length = 64)
    private String declineCode;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    public boolean isExpired(Instant now) {
        return expiresAt.isBefore(now);
    }

    public enum PaymentIntentStatus {
        CREATED,
        SUCCEEDED,
        FAILED,
        EXPIRED
    }
}
