package com.cred.freestyle.eventbooking.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Refund issued against a payment intent.
 * The unique constraint on payment_intent_id enforces one refund per intent.
 *
 * @author Event Booking Team
 */
@Entity
@Table(name = "refunds", indexes = {
    @Index(name = "idx_refunds_payment_intent", columnList = "payment_intent_id", unique = true)
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Refund {

    @Id
    @Column(name = "refund_id", nullable = false, length = 64)
    private String refundId;

    @Column(name = "amount", nullable = false, precision = 10, scale = 2)
    private BigDecimal amount;

    @Column(name = "status", nullable = false, length = 20)
    private String status;

    @Column(name = "reason")
    private String reason;

    @Column(name = "payment_intent_id", nullable = false, unique = true, length = 64)
    private String paymentIntentId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
}
