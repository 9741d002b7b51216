package com.cred.freestyle.eventbooking.infrastructure.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Booking-core metrics, shipped to CloudWatch through Micrometer when the CloudWatch registry
 * is enabled (see {@link com.cred.freestyle.eventbooking.config.CloudWatchConfig}).
 *
 * Meters, all under the {@code eventbooking.} prefix:
 * <ul>
 *   <li>reservation.success / reservation.tickets / reservation.failure{reason}, per event</li>
 *   <li>reservation.confirmed, booking.cancelled{refund_status}, reservation.expired</li>
 *   <li>payment.processed{status}, payment.refund{refund_status}, payment.refund.amount</li>
 *   <li>lock.unavailable{lock_type}, transaction.retry, error{error_type, operation}</li>
 *   <li>reservation.latency with p50/p95/p99</li>
 * </ul>
 *
 * @author Event Booking Team
 */
@Service
public class CloudWatchMetricsService {

    private static final Logger logger = LoggerFactory.getLogger(CloudWatchMetricsService.class);

    private static final String PREFIX = "eventbooking.";

    private final MeterRegistry meterRegistry;

    public CloudWatchMetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    public void recordReservationSuccess(String eventId, int ticketCount) {
        count("reservation.success", "Reservations created", 1, "event_id", eventId);
        count("reservation.tickets", "Tickets held by new reservations", ticketCount, "event_id", eventId);
    }

    /**
     * @param reason the failure kind, e.g. CAPACITY_EXCEEDED or QUOTA_EXCEEDED
     */
    public void recordReservationFailure(String eventId, String reason) {
        count("reservation.failure", "Rejected reservation attempts", 1, "event_id", eventId, "reason", reason);
    }

    public void recordReservationConfirmation(String eventId) {
        count("reservation.confirmed", "Reservations confirmed after payment", 1, "event_id", eventId);
    }

    public void recordBookingCancellation(String eventId, String refundStatus) {
        count("booking.cancelled", "User-cancelled bookings", 1, "event_id", eventId, "refund_status", refundStatus);
    }

    /**
     * One increment per hold released by a sweep run; a run that reclaims nothing records nothing.
     */
    public void recordReservationsReclaimed(int reclaimedCount) {
        if (reclaimedCount > 0) {
            count("reservation.expired", "Holds reclaimed by the expiry sweep", reclaimedCount);
        }
    }

    /**
     * @param amount refunded amount, or null when nothing was paid back
     */
    public void recordRefund(String refundStatus, BigDecimal amount) {
        count("payment.refund", "Refund outcomes on cancellation", 1, "refund_status", refundStatus);
        if (amount != null && amount.signum() > 0) {
            count("payment.refund.amount", "Total refunded amount", amount.doubleValue());
        }
    }

    public void recordPayment(String status) {
        count("payment.processed", "Payment intents processed", 1, "status", status);
    }

    /**
     * Tagged by the key's namespace (text before the first ':') so per-booking keys do not
     * explode the tag cardinality.
     */
    public void recordLockContention(String resourceKey) {
        int separator = resourceKey.indexOf(':');
        String lockType = separator < 0 ? resourceKey : resourceKey.substring(0, separator);
        count("lock.unavailable", "Locks not acquired within the retry budget", 1, "lock_type", lockType);
    }

    public void recordTransactionRetry() {
        count("transaction.retry", "Transactions retried after deadlock or lock failure", 1);
    }

    public void recordReservationLatency(long durationMs) {
        Timer.builder(PREFIX + "reservation.latency")
                .description("Reservation latency")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry)
                .record(Duration.ofMillis(durationMs));
    }

    public void recordError(String errorType, String operation) {
        count("error", "Background job and system errors", 1, "error_type", errorType, "operation", operation);
        logger.warn("Recorded error: type={}, operation={}", errorType, operation);
    }

    private void count(String name, String description, double amount, String... tags) {
        Counter.builder(PREFIX + name)
                .description(description)
                .tags(tags)
                .register(meterRegistry)
                .increment(amount);
    }
}
