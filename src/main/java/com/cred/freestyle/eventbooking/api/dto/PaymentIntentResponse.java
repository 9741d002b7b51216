package com.cred.freestyle.eventbooking.api.dto;

import com.cred.freestyle.eventbooking.domain.model.PaymentIntent;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Response DTO for a payment intent.
 *
 * @author Event Booking Team
 */
public class PaymentIntentResponse {

    private String paymentIntentId;
    private String clientSecret;
    private String status;
    private BigDecimal amount;
    private String currency;
    private String paymentMethod;
    private String bookingId;
    private String errorCode;
    private String declineCode;
    private Instant createdAt;
    private Instant expiresAt;

    public PaymentIntentResponse() {
    }

    /**
     * Create response from PaymentIntent entity. Status is rendered lowercase
     * (created, succeeded, failed, expired).
     *
     * @param intent PaymentIntent entity
     * @return PaymentIntentResponse
     */
    public static PaymentIntentResponse fromEntity(PaymentIntent intent) {
        PaymentIntentResponse response = new PaymentIntentResponse();
        response.setPaymentIntentId(intent.getPaymentIntentId());
        response.setClientSecret(intent.getClientSecret());
        response.setStatus(intent.getStatus().name().toLowerCase());
        response.setAmount(intent.getAmount());
        response.setCurrency(intent.getCurrency());
        response.setPaymentMethod(intent.getPaymentMethod());
        response.setBookingId(intent.getBookingId());
        response.setErrorCode(intent.getErrorCode());
        response.setDeclineCode(intent.getDeclineCode());
        response.setCreatedAt(intent.getCreatedAt());
        response.setExpiresAt(intent.getExpiresAt());
        return response;
    }

    public String getPaymentIntentId() {
        return paymentIntentId;
    }

    public void setPaymentIntentId(String paymentIntentId) {
        this.paymentIntentId = paymentIntentId;
    }

    public String getClientSecret() {
        return clientSecret;
    }

    public void setClientSecret(String clientSecret) {
        this.clientSecret = clientSecret;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public BigDecimal getAmount() {
        return amount;
    }

    public void setAmount(BigDecimal amount) {
        this.amount = amount;
    }

    public String getCurrency() {
        return currency;
    }

    public void setCurrency(String currency) {
        this.currency = currency;
    }

    public String getPaymentMethod() {
        return paymentMethod;
    }

    public void setPaymentMethod(String paymentMethod) {
        this.paymentMethod = paymentMethod;
    }

    public String getBookingId() {
        return bookingId;
    }

    public void setBookingId(String bookingId) {
        this.bookingId = bookingId;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public void setErrorCode(String errorCode) {
        this.errorCode = errorCode;
    }

    public String getDeclineCode() {
        return declineCode;
    }

    public void setDeclineCode(String declineCode) {
        this.declineCode = declineCode;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }

    public void setExpiresAt(Instant expiresAt) {
        this.expiresAt = expiresAt;
    }
}
