package com.cred.freestyle.eventbooking.service;

import com.cred.freestyle.eventbooking.domain.model.Booking.RefundStatus;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;

/**
 * Refund bands for cancelling a paid booking, by whole days until the event starts.
 *
 * <pre>
 * days until event   refund
 * &gt; 7               100% of total price (FULL_REFUND)
 * 2 &lt; days &lt;= 7      50% of total price (PARTIAL_REFUND)
 * &lt;= 2              nothing (NO_REFUND)
 * </pre>
 *
 * Days are rounded up: an event 6 days and 1 minute away counts as 7 days.
 *
 * @author Event Booking Team
 */
@Component
public class RefundPolicy {

    private static final long MILLIS_PER_DAY = Duration.ofDays(1).toMillis();
    private static final int FULL_REFUND_AFTER_DAYS = 7;
    private static final int PARTIAL_REFUND_AFTER_DAYS = 2;
    private static final BigDecimal PARTIAL_REFUND_RATIO = new BigDecimal("0.5");

    /**
     * Evaluate the refund for a booking.
     *
     * @param totalPrice Booking total price
     * @param eventStart Event start time
     * @param now Current timestamp
     * @return Refund band and amount
     */
    public RefundDecision evaluate(BigDecimal totalPrice, Instant eventStart, Instant now) {
        long days = daysUntil(eventStart, now);

        if (days > FULL_REFUND_AFTER_DAYS) {
            return new RefundDecision(RefundStatus.FULL_REFUND, totalPrice, days);
        }
        if (days > PARTIAL_REFUND_AFTER_DAYS) {
            BigDecimal amount = totalPrice.multiply(PARTIAL_REFUND_RATIO).setScale(2, RoundingMode.HALF_UP);
            return new RefundDecision(RefundStatus.PARTIAL_REFUND, amount, days);
        }
        return new RefundDecision(RefundStatus.NO_REFUND, BigDecimal.ZERO, days);
    }

    /**
     * ceil((eventStart - now) / 1 day)
     */
    static long daysUntil(Instant eventStart, Instant now) {
        long millis = Duration.between(now, eventStart).toMillis();
        return -Math.floorDiv(-millis, MILLIS_PER_DAY);
    }

    public static final class RefundDecision {

        private final RefundStatus status;
        private final BigDecimal amount;
        private final long daysUntilEvent;

        public RefundDecision(RefundStatus status, BigDecimal amount, long daysUntilEvent) {
            this.status = status;
            this.amount = amount;
            this.daysUntilEvent = daysUntilEvent;
        }

        public RefundStatus getStatus() {
            return status;
        }

        public BigDecimal getAmount() {
            return amount;
        }

        public long getDaysUntilEvent() {
            return daysUntilEvent;
        }

        public boolean hasAmount() {
            return amount.signum() > 0;
        }
    }
}
