package com.cred.freestyle.eventbooking.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Booking entity. A booking starts life as a time-boxed hold on event capacity
 * (RESERVED) and is then confirmed after payment, cancelled by the user, or
 * reclaimed by the expiry sweep.
 *
 * Statuses:
 * - RESERVED: capacity debited, waiting for payment until reservationExpiry
 * - CONFIRMED: payment verified, capacity stays committed
 * - CANCELLED: capacity credited back (terminal)
 * - PAYMENT_FAILED: payment attempt failed
 *
 * @author Event Booking Team
 */
@Entity
@Table(name = "bookings", indexes = {
    @Index(name = "idx_bookings_event_status", columnList = "event_id, status"),
    @Index(name = "idx_bookings_user_event_status", columnList = "user_id, event_id, status"),
    @Index(name = "idx_bookings_reservation_expiry", columnList = "reservation_expiry")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Booking {

    @Id
    @Column(name = "booking_id", nullable = false, length = 36)
    private String bookingId;

    @Column(name = "user_id", nullable = false, length = 36)
    private String userId;

    @Column(name = "event_id", nullable = false, length = 36)
    private String eventId;

    /**
     * Read-only association used for filtering and sorting by event date.
     */
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "event_id", insertable = false, updatable = false)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private Event event;

    @Column(name = "ticket_count", nullable = false)
    private Integer ticketCount;

    @Column(name = "total_price", nullable = false, precision = 10, scale = 2)
    private BigDecimal totalPrice;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private BookingStatus status;

    /**
     * End of the payment window. Only meaningful while RESERVED.
     */
    @Column(name = "reservation_expiry")
    private Instant reservationExpiry;

    @Column(name = "payment_intent_id", length = 64)
    private String paymentIntentId;

    /**
     * Set when a payment intent is created so the expiry sweep leaves the hold
     * alone for the payment grace window.
     */
    @Column(name = "payment_processing", nullable = false)
    @Builder.Default
    private Boolean paymentProcessing = false;

    @Column(name = "payment_initiated_at")
    private Instant paymentInitiatedAt;

    @Column(name = "refund_amount", precision = 10, scale = 2)
    private BigDecimal refundAmount;

    @Enumerated(EnumType.STRING)
    @Column(name = "refund_status", length = 20)
    private RefundStatus refundStatus;

    @Column(name = "refund_id", length = 64)
    private String refundId;

    @Column(name = "refunded_at")
    private Instant refundedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @Column(name = "confirmed_at")
    private Instant confirmedAt;

    @Column(name = "cancelled_at")
    private Instant cancelledAt;

    @PrePersist
    protected void onCreate() {
        if (bookingId == null) {
            bookingId = UUID.randomUUID().toString();
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        updatedAt = createdAt;

        if (status == null) {
            status = BookingStatus.RESERVED;
        }
        if (paymentProcessing == null) {
            paymentProcessing = false;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    /**
     * Whether the hold's payment window has lapsed at the given instant.
     * Evaluated by wall clock, independent of whether the expiry sweep has run.
     */
    public boolean isHoldExpired(Instant now) {
        return reservationExpiry != null && reservationExpiry.isBefore(now);
    }

    /**
     * Confirm the hold after payment verification. Capacity is untouched.
     */
    public void confirm(String paymentIntentId, Instant now) {
        this.status = BookingStatus.CONFIRMED;
        this.paymentIntentId = paymentIntentId;
        this.paymentProcessing = false;
        this.confirmedAt = now;
    }

    /**
     * Cancel the booking. The caller is responsible for crediting capacity
     * in the same unit of work.
     */
    public void cancel(Instant now) {
        this.status = BookingStatus.CANCELLED;
        this.paymentProcessing = false;
        this.cancelledAt = now;
    }

    public void markPaymentProcessing(Instant now) {
        this.paymentProcessing = true;
        this.paymentInitiatedAt = now;
    }

    public void clearPaymentProcessing() {
        this.paymentProcessing = false;
    }

    public enum BookingStatus {
        RESERVED,
        CONFIRMED,
        CANCELLED,
        PAYMENT_FAILED;

        /**
         * Lowercase form used in user-facing messages ("cannot confirm a confirmed booking").
         */
        public String label() {
            return name().toLowerCase().replace('_', ' ');
        }
    }

    public enum RefundStatus {
        FULL_REFUND,
        PARTIAL_REFUND,
        NO_REFUND,
        REFUND_FAILED,
        NOT_APPLICABLE
    }
}
