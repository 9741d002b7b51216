package com.cred.freestyle.eventbooking.api.dto;

import com.cred.freestyle.eventbooking.domain.model.Booking;
import com.cred.freestyle.eventbooking.domain.model.Event;
import org.hibernate.Hibernate;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;

/**
 * Response DTO for bookings and reservations.
 *
 * @author Event Booking Team
 */
public class BookingResponse {

    private String bookingId;
    private String userId;
    private String eventId;
    private String eventName;
    private Instant eventDate;
    private Integer ticketCount;
    private BigDecimal totalPrice;
    private String status;
    private Instant reservationExpiry;
    private Long expiresInSeconds;
    private String paymentIntentId;
    private String refundStatus;
    private BigDecimal refundAmount;
    private Instant createdAt;
    private Instant confirmedAt;
    private Instant cancelledAt;

    public BookingResponse() {
    }

    /**
     * Create response from Booking entity.
     * Event name and date are included only when the event was loaded with the booking.
     *
     * @param booking Booking entity
     * @param now Reference instant for the remaining hold time
     * @return BookingResponse
     */
    public static BookingResponse fromEntity(Booking booking, Instant now) {
        BookingResponse response = new BookingResponse();
        response.setBookingId(booking.getBookingId());
        response.setUserId(booking.getUserId());
        response.setEventId(booking.getEventId());
        response.setTicketCount(booking.getTicketCount());
        response.setTotalPrice(booking.getTotalPrice());
        response.setStatus(booking.getStatus().name());
        response.setPaymentIntentId(booking.getPaymentIntentId());
        response.setRefundAmount(booking.getRefundAmount());
        response.setCreatedAt(booking.getCreatedAt());
        response.setConfirmedAt(booking.getConfirmedAt());
        response.setCancelledAt(booking.getCancelledAt());

        if (booking.getRefundStatus() != null) {
            response.setRefundStatus(booking.getRefundStatus().name());
        }

        Event event = booking.getEvent();
        if (event != null && Hibernate.isInitialized(event)) {
            response.setEventName(event.getName());
            response.setEventDate(event.getStartTime());
        }

        // Remaining hold time only matters while the booking is an unpaid hold
        if (booking.getStatus() == Booking.BookingStatus.RESERVED && booking.getReservationExpiry() != null) {
            response.setReservationExpiry(booking.getReservationExpiry());
            long secondsRemaining = Duration.between(now, booking.getReservationExpiry()).getSeconds();
            response.setExpiresInSeconds(Math.max(0, secondsRemaining));
        }

        return response;
    }

    // Getters and setters
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

    public String getEventName() {
        return eventName;
    }

    public void setEventName(String eventName) {
        this.eventName = eventName;
    }

    public Instant getEventDate() {
        return eventDate;
    }

    public void setEventDate(Instant eventDate) {
        this.eventDate = eventDate;
    }

    public Integer getTicketCount() {
        return ticketCount;
    }

    public void setTicketCount(Integer ticketCount) {
        this.ticketCount = ticketCount;
    }

    public BigDecimal getTotalPrice() {
        return totalPrice;
    }

    public void setTotalPrice(BigDecimal totalPrice) {
        this.totalPrice = totalPrice;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public Instant getReservationExpiry() {
        return reservationExpiry;
    }

    public void setReservationExpiry(Instant reservationExpiry) {
        this.reservationExpiry = reservationExpiry;
    }

    public Long getExpiresInSeconds() {
        return expiresInSeconds;
    }

    public void setExpiresInSeconds(Long expiresInSeconds) {
        this.expiresInSeconds = expiresInSeconds;
    }

    public String getPaymentIntentId() {
        return paymentIntentId;
    }

    public void setPaymentIntentId(String paymentIntentId) {
        this.paymentIntentId = paymentIntentId;
    }

    public String getRefundStatus() {
        return refundStatus;
    }

    public void setRefundStatus(String refundStatus) {
        this.refundStatus = refundStatus;
    }

    public BigDecimal getRefundAmount() {
        return refundAmount;
    }

    public void setRefundAmount(BigDecimal refundAmount) {
        this.refundAmount = refundAmount;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getConfirmedAt() {
        return confirmedAt;
    }

    public void setConfirmedAt(Instant confirmedAt) {
        this.confirmedAt = confirmedAt;
    }

    public Instant getCancelledAt() {
        return cancelledAt;
    }

    public void setCancelledAt(Instant cancelledAt) {
        this.cancelledAt = cancelledAt;
    }
}
