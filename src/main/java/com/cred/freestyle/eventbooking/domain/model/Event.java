package com.cred.freestyle.eventbooking.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Event entity carrying the shared ticket capacity pool.
 * This is the source of truth for capacity availability.
 *
 * Capacity invariant: 0 <= available_capacity <= total_capacity.
 * available_capacity is only mutated through the conditional updates in
 * EventRepository (reservation debit, cancellation credit, expiry credit).
 *
 * @author Event Booking Team
 */
@Entity
@Table(name = "events", indexes = {
    @Index(name = "idx_events_start_time", columnList = "start_time"),
    @Index(name = "idx_events_status_end_time", columnList = "status, end_time")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Event {

    @Id
    @Column(name = "event_id", nullable = false, length = 36)
    private String eventId;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "venue_name")
    private String venueName;

    @Column(name = "venue_address")
    private String venueAddress;

    @Column(name = "start_time", nullable = false)
    private Instant startTime;

    @Column(name = "end_time", nullable = false)
    private Instant endTime;

    /**
     * Total tickets for the event. Fixed at creation.
     */
    @Column(name = "total_capacity", nullable = false, updatable = false)
    private Integer totalCapacity;

    /**
     * Tickets not held by any RESERVED or CONFIRMED booking.
     */
    @Column(name = "available_capacity", nullable = false)
    private Integer availableCapacity;

    /**
     * Unit ticket price.
     */
    @Column(name = "price", nullable = false, precision = 10, scale = 2)
    private BigDecimal price;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private EventStatus status;

    @Column(name = "booking_enabled", nullable = false)
    @Builder.Default
    private Boolean bookingEnabled = true;

    @Column(name = "created_by", length = 36)
    private String createdBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        if (eventId == null) {
            eventId = UUID.randomUUID().toString();
        }
        createdAt = Instant.now();
        updatedAt = createdAt;

        if (status == null) {
            status = EventStatus.ACTIVE;
        }
        if (availableCapacity == null) {
            availableCapacity = totalCapacity;
        }
        if (bookingEnabled == null) {
            bookingEnabled = true;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    /**
     * Whether the event has started relative to the given instant.
     */
    public boolean hasStarted(Instant now) {
        return !startTime.isAfter(now);
    }

    public enum EventStatus {
        ACTIVE,
        CANCELLED,
        COMPLETED
    }
}
