package com.cred.freestyle.eventbooking.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * What a user needs to pay for a held reservation before it lapses.
 *
 * @author Event Booking Team
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaymentOptions {

    public static final List<PaymentMethod> SUPPORTED_METHODS = List.of(
            new PaymentMethod("card", "Credit/Debit Card"),
            new PaymentMethod("upi", "UPI"),
            new PaymentMethod("netbanking", "Net Banking")
    );

    private String reservationId;
    private String eventName;
    private Instant eventDate;
    private BigDecimal amount;
    private Instant expiresAt;
    private long timeLeftSeconds;
    private List<PaymentMethod> paymentMethods;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PaymentMethod {
        private String id;
        private String name;
    }
}
