package com.cred.freestyle.eventbooking.api.dto;

import com.cred.freestyle.eventbooking.domain.model.CancellationResult;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Response DTO for a cancellation, with the refund outcome.
 *
 * @author Event Booking Team
 */
public class CancellationResponse {

    private String message;
    private BookingResponse booking;
    private boolean refundProcessed;
    private String refundStatus;
    private BigDecimal refundAmount;
    private String refundId;

    public CancellationResponse() {
    }

    /**
     * A booking that was never confirmed is reported as a cancelled reservation.
     */
    public static CancellationResponse from(CancellationResult result, Instant now) {
        CancellationResponse response = new CancellationResponse();
        boolean wasReservation = result.getBooking().getConfirmedAt() == null;
        response.setMessage(wasReservation ? "Reservation cancelled successfully" : "Booking cancelled successfully");
        response.setBooking(BookingResponse.fromEntity(result.getBooking(), now));
        response.setRefundProcessed(result.isRefundProcessed());
        response.setRefundStatus(result.getRefundStatus().name());
        response.setRefundAmount(result.getRefundAmount());
        response.setRefundId(result.getRefundId());
        return response;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }

    public BookingResponse getBooking() {
        return booking;
    }

    public void setBooking(BookingResponse booking) {
        this.booking = booking;
    }

    public boolean isRefundProcessed() {
        return refundProcessed;
    }

    public void setRefundProcessed(boolean refundProcessed) {
        this.refundProcessed = refundProcessed;
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

    public String getRefundId() {
        return refundId;
    }

    public void setRefundId(String refundId) {
        this.refundId = refundId;
    }
}
