package com.cred.freestyle.eventbooking.domain.model;

import com.cred.freestyle.eventbooking.domain.model.Booking.RefundStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Outcome of cancelling a booking: the cancelled booking plus what happened to the refund.
 *
 * @author Event Booking Team
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CancellationResult {

    private Booking booking;

    /**
     * Whether a refund was actually issued by the payment gateway.
     */
    private boolean refundProcessed;

    private RefundStatus refundStatus;

    private BigDecimal refundAmount;

    private String refundId;
}
