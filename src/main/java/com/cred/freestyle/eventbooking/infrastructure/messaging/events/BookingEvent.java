package com.cred.freestyle.eventbooking.infrastructure.messaging.events;

import java.time.Instant;

/**
 * Booking lifecycle event published to Kafka after a transition committed.
 *
 * Event Types:
 * - RESERVED: hold created, capacity debited
 * - CONFIRMED: payment verified, hold became a booking
 * - CANCELLED: cancelled by the user, capacity credited
 * - EXPIRED: hold reclaimed by the expiry sweep, capacity credited
 *
 * @author Event Booking Team
 */
public class BookingEvent {

    private String bookingId;
    private String userId;
    private String eventId;
    private Integer ticketCount;
    private EventType eventType;
    private String refundStatus;
    private Instant timestamp;

    /**
     * Default constructor for deserialization.
     */
    public BookingEvent() {
    }

    public BookingEvent(
            String bookingId,
            String userId,
            String eventId,
            Integer ticketCount,
            EventType eventType,
            Instant timestamp
    ) {
        this.bookingId = bookingId;
        this.userId = userId;
        this.eventId = eventId;
        this.ticketCount = ticketCount;
        this.eventType = eventType;
        this.timestamp = timestamp;
    }

    public String getBookingId() {
        return bookingId;
    }

    public void setBookingId(String bookingId) {
        this.bookingId = bookingId;
    }

    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = userId;
    }

    public String getEventId() {
        return eventId;
    }

    public void setEventId(String eventId) {
        this.eventId = eventId;
    }

    public Integer getTicketCount() {
        return ticketCount;
    }

    public void setTicketCount(Integer ticketCount) {
        this.ticketCount = ticketCount;
    }

    public EventType getEventType() {
        return eventType;
    }

    public void setEventType(EventType eventType) {
        this.eventType = eventType;
    }

    public String getRefundStatus() {
        return refundStatus;
    }

    public void setRefundStatus(String refundStatus) {
        this.refundStatus = refundStatus;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(Instant timestamp) {
        this.timestamp = timestamp;
    }

    @Override
    public String toString() {
        return "BookingEvent{" +
                "bookingId='" + bookingId + '\'' +
                ", eventId='" + eventId + '\'' +
                ", ticketCount=" + ticketCount +
                ", eventType=" + eventType +
                '}';
    }

    public enum EventType {
        RESERVED,
        CONFIRMED,
        CANCELLED,
        EXPIRED
    }
}
