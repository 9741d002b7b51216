package com.cred.freestyle.eventbooking.service;

import com.cred.freestyle.eventbooking.domain.model.Booking.RefundStatus;
import com.cred.freestyle.eventbooking.service.RefundPolicy.RefundDecision;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for RefundPolicy.
 * Bands: more than 7 days full, more than 2 days half, otherwise nothing.
 */
@DisplayName("RefundPolicy Unit Tests")
class RefundPolicyTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    private static final BigDecimal PRICE = new BigDecimal("1000.00");

    private final RefundPolicy refundPolicy = new RefundPolicy();

    @Test
    @DisplayName("10 days out - full refund of the total price")
    void tenDaysOut_FullRefund() {
        RefundDecision decision = refundPolicy.evaluate(PRICE, NOW.plus(Duration.ofDays(10)), NOW);

        assertThat(decision.getStatus()).isEqualTo(RefundStatus.FULL_REFUND);
        assertThat(decision.getAmount()).isEqualByComparingTo("1000.00");
        assertThat(decision.getDaysUntilEvent()).isEqualTo(10);
        assertThat(decision.hasAmount()).isTrue();
    }

    @Test
    @DisplayName("5 days out - half refund rounded to 2 decimals")
    void fiveDaysOut_PartialRefund() {
        RefundDecision decision = refundPolicy.evaluate(new BigDecimal("999.99"), NOW.plus(Duration.ofDays(5)), NOW);

        assertThat(decision.getStatus()).isEqualTo(RefundStatus.PARTIAL_REFUND);
        assertThat(decision.getAmount()).isEqualByComparingTo("500.00");
    }

    @Test
    @DisplayName("1 day out - no refund")
    void oneDayOut_NoRefund() {
        RefundDecision decision = refundPolicy.evaluate(PRICE, NOW.plus(Duration.ofDays(1)), NOW);

        assertThat(decision.getStatus()).isEqualTo(RefundStatus.NO_REFUND);
        assertThat(decision.getAmount()).isEqualByComparingTo(BigDecimal.ZERO);
        assertThat(decision.hasAmount()).isFalse();
    }

    @Test
    @DisplayName("Exactly 7 days out - partial, the full band is strictly more than 7")
    void exactlySevenDays_Partial() {
        RefundDecision decision = refundPolicy.evaluate(PRICE, NOW.plus(Duration.ofDays(7)), NOW);

        assertThat(decision.getStatus()).isEqualTo(RefundStatus.PARTIAL_REFUND);
        assertThat(decision.getAmount()).isEqualByComparingTo("500.00");
    }

    @Test
    @DisplayName("Exactly 2 days out - no refund, the partial band is strictly more than 2")
    void exactlyTwoDays_NoRefund() {
        RefundDecision decision = refundPolicy.evaluate(PRICE, NOW.plus(Duration.ofDays(2)), NOW);

        assertThat(decision.getStatus()).isEqualTo(RefundStatus.NO_REFUND);
    }

    @Test
    @DisplayName("Partial days round up - 7 days and 1 minute counts as 8")
    void partialDayRoundsUp() {
        Instant start = NOW.plus(Duration.ofDays(7)).plus(Duration.ofMinutes(1));

        assertThat(RefundPolicy.daysUntil(start, NOW)).isEqualTo(8);
        assertThat(refundPolicy.evaluate(PRICE, start, NOW).getStatus()).isEqualTo(RefundStatus.FULL_REFUND);
    }

    @Test
    @DisplayName("2 days and 1 second counts as 3 - partial refund")
    void justOverTwoDays_Partial() {
        Instant start = NOW.plus(Duration.ofDays(2)).plusSeconds(1);

        assertThat(refundPolicy.evaluate(PRICE, start, NOW).getStatus()).isEqualTo(RefundStatus.PARTIAL_REFUND);
    }

    @Test
    @DisplayName("daysUntil - event already started gives zero or negative days")
    void daysUntil_PastEvent() {
        assertThat(RefundPolicy.daysUntil(NOW, NOW)).isZero();
        assertThat(RefundPolicy.daysUntil(NOW.minus(Duration.ofHours(30)), NOW)).isEqualTo(-1);
    }
}
