package com.cred.freestyle.eventbooking.api.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * Request DTO for settling a payment intent.
 * {@code shouldSucceed} selects the outcome of the simulated gateway; defaults to success.
 *
 * @author Event Booking Team
 */
public class ProcessPaymentRequest {

    @NotBlank(message = "Payment intent ID is required")
    private String paymentIntentId;

    private Boolean shouldSucceed = Boolean.TRUE;

    public ProcessPaymentRequest() {
    }

    public ProcessPaymentRequest(String paymentIntentId, Boolean shouldSucceed) {
        this.paymentIntentId = paymentIntentId;
        this.shouldSucceed = shouldSucceed;
    }

    public String getPaymentIntentId() {
        return paymentIntentId;
    }

    public void setPaymentIntentId(String paymentIntentId) {
        this.paymentIntentId = paymentIntentId;
    }

    public Boolean getShouldSucceed() {
        return shouldSucceed;
    }

    public void setShouldSucceed(Boolean shouldSucceed) {
        this.shouldSucceed = shouldSucceed;
    }
}
