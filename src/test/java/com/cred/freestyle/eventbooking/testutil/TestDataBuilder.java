package com.cred.freestyle.eventbooking.testutil;

import com.cred.freestyle.eventbooking.domain.model.Booking;
import com.cred.freestyle.eventbooking.domain.model.Booking.BookingStatus;
import com.cred.freestyle.eventbooking.domain.model.Event;
import com.cred.freestyle.eventbooking.domain.model.Event.EventStatus;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Builder class for creating test data objects.
 * Provides fluent API for building domain models with sensible defaults.
 */
public class TestDataBuilder {

    public static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    /**
     * Builder for Event
     */
    public static class EventBuilder {
        private String eventId = UUID.randomUUID().toString();
        private String name = "Test Concert";
        private Instant startTime = NOW.plus(Duration.ofDays(30));
        private Instant endTime = NOW.plus(Duration.ofDays(30)).plus(Duration.ofHours(3));
        private Integer totalCapacity = 100;
        private Integer availableCapacity;
        private BigDecimal price = new BigDecimal("500.00");
        private EventStatus status = EventStatus.ACTIVE;
        private Boolean bookingEnabled = true;

        public EventBuilder eventId(String eventId) {
            this.eventId = eventId;
            return this;
        }

        public EventBuilder name(String name) {
            this.name = name;
            return this;
        }

        public EventBuilder startsIn(Duration fromNow) {
            this.startTime = NOW.plus(fromNow);
            this.endTime = this.startTime.plus(Duration.ofHours(3));
            return this;
        }

        public EventBuilder startTime(Instant startTime) {
            this.startTime = startTime;
            return this;
        }

        public EventBuilder endTime(Instant endTime) {
            this.endTime = endTime;
            return this;
        }

        public EventBuilder capacity(int totalCapacity) {
            this.totalCapacity = totalCapacity;
            return this;
        }

        public EventBuilder available(int availableCapacity) {
            this.availableCapacity = availableCapacity;
            return this;
        }

        public EventBuilder price(String price) {
            this.price = new BigDecimal(price);
            return this;
        }

        public EventBuilder status(EventStatus status) {
            this.status = status;
            return this;
        }

        public EventBuilder bookingDisabled() {
            this.bookingEnabled = false;
            return this;
        }

        public Event build() {
            return Event.builder()
                    .eventId(eventId)
                    .name(name)
                    .venueName("Test Arena")
                    .venueAddress("1 Test Street")
                    .startTime(startTime)
                    .endTime(endTime)
                    .totalCapacity(totalCapacity)
                    .availableCapacity(availableCapacity != null ? availableCapacity : totalCapacity)
                    .price(price)
                    .status(status)
                    .bookingEnabled(bookingEnabled)
                    .build();
        }
    }

    /**
     * Builder for Booking
     */
    public static class BookingBuilder {
        private String bookingId = UUID.randomUUID().toString();
        private String userId = "user-123";
        private String eventId = "event-001";
        private Integer ticketCount = 2;
        private BigDecimal totalPrice = new BigDecimal("1000.00");
        private BookingStatus status = BookingStatus.RESERVED;
        private Instant reservationExpiry = NOW.plus(Duration.ofMinutes(15));
        private String paymentIntentId;
        private Boolean paymentProcessing = false;
        private Instant paymentInitiatedAt;
        private Instant confirmedAt;

        public BookingBuilder bookingId(String bookingId) {
            this.bookingId = bookingId;
            return this;
        }

        public BookingBuilder userId(String userId) {
            this.userId = userId;
            return this;
        }

        public BookingBuilder eventId(String eventId) {
            this.eventId = eventId;
            return this;
        }

        public BookingBuilder tickets(int ticketCount) {
            this.ticketCount = ticketCount;
            return this;
        }

        public BookingBuilder totalPrice(String totalPrice) {
            this.totalPrice = new BigDecimal(totalPrice);
            return this;
        }

        public BookingBuilder expiresAt(Instant reservationExpiry) {
            this.reservationExpiry = reservationExpiry;
            return this;
        }

        public BookingBuilder confirmed(String paymentIntentId) {
            this.status = BookingStatus.CONFIRMED;
            this.paymentIntentId = paymentIntentId;
            this.confirmedAt = NOW.minus(Duration.ofDays(1));
            return this;
        }

        public BookingBuilder status(BookingStatus status) {
            this.status = status;
            return this;
        }

        public BookingBuilder paymentInProgressSince(Instant initiatedAt) {
            this.paymentProcessing = true;
            this.paymentInitiatedAt = initiatedAt;
            return this;
        }

        public Booking build() {
            return Booking.builder()
                    .bookingId(bookingId)
                    .userId(userId)
                    .eventId(eventId)
                    .ticketCount(ticketCount)
                    .totalPrice(totalPrice)
                    .status(status)
                    .reservationExpiry(reservationExpiry)
                    .paymentIntentId(paymentIntentId)
                    .paymentProcessing(paymentProcessing)
                    .paymentInitiatedAt(paymentInitiatedAt)
                    .confirmedAt(confirmedAt)
                    .createdAt(NOW.minus(Duration.ofMinutes(1)))
                    .build();
        }
    }

    public static EventBuilder anEvent() {
        return new EventBuilder();
    }

    public static BookingBuilder aBooking() {
        return new BookingBuilder();
    }
}
