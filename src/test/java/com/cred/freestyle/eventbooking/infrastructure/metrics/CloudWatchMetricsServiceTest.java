package com.cred.freestyle.eventbooking.infrastructure.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

class CloudWatchMetricsServiceTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final CloudWatchMetricsService metrics = new CloudWatchMetricsService(registry);

    @Test
    @DisplayName("Reservation success counts the hold and its tickets per event")
    void reservationSuccess() {
        // When
        metrics.recordReservationSuccess("event-1", 3);
        metrics.recordReservationSuccess("event-1", 2);

        // Then
        assertThat(registry.get("eventbooking.reservation.success").tag("event_id", "event-1").counter().count())
                .isEqualTo(2.0);
        assertThat(registry.get("eventbooking.reservation.tickets").tag("event_id", "event-1").counter().count())
                .isEqualTo(5.0);
    }

    @Test
    @DisplayName("Lock contention is tagged by key namespace only")
    void lockContentionTag() {
        // When
        metrics.recordLockContention("booking:b-1");
        metrics.recordLockContention("booking:b-2");

        // Then
        assertThat(registry.get("eventbooking.lock.unavailable").tag("lock_type", "booking").counter().count())
                .isEqualTo(2.0);
    }

    @Test
    @DisplayName("Refund without amount records the outcome but no amount")
    void refundWithoutAmount() {
        // When
        metrics.recordRefund("REFUND_FAILED", null);
        metrics.recordRefund("FULL_REFUND", new BigDecimal("150.00"));

        // Then
        assertThat(registry.get("eventbooking.payment.refund").tag("refund_status", "REFUND_FAILED").counter().count())
                .isEqualTo(1.0);
        assertThat(registry.get("eventbooking.payment.refund.amount").counter().count()).isEqualTo(150.0);
    }

    @Test
    @DisplayName("Empty sweep registers no expiry meter")
    void emptySweep() {
        // When
        metrics.recordReservationsReclaimed(0);

        // Then
        assertThat(registry.find("eventbooking.reservation.expired").counter()).isNull();
    }
}
