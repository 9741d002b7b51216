package com.cred.freestyle.eventbooking.infrastructure.scheduler;

import com.cred.freestyle.eventbooking.infrastructure.metrics.CloudWatchMetricsService;
import com.cred.freestyle.eventbooking.service.BookingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Scheduled job that reclaims capacity from lapsed reservation holds.
 *
 * This scheduler:
 * 1. Runs once at startup and then every 5 minutes (configurable), on the scheduling pool,
 *    never on request threads
 * 2. Delegates to BookingService.cleanupExpiredReservations, which selects RESERVED holds
 *    past their expiry (respecting the payment grace window), cancels them and credits capacity
 *    in one unit of work
 *
 * Reliability:
 * - A failed run is logged and counted; the next tick tries again
 * - Idempotent: a hold is released at most once because cancellation is guarded on RESERVED
 * - Confirmation checks expiry by wall clock, so lag here never lets a lapsed hold be confirmed
 *
 * @author Event Booking Team
 */
@Service
public class ReservationExpiryScheduler {

    private static final Logger logger = LoggerFactory.getLogger(ReservationExpiryScheduler.class);

    private final BookingService bookingService;
    private final CloudWatchMetricsService metricsService;

    @Value("${eventbooking.reservation.cleanup.enabled:true}")
    private boolean schedulerEnabled = true;

    public ReservationExpiryScheduler(BookingService bookingService, CloudWatchMetricsService metricsService) {
        this.bookingService = bookingService;
        this.metricsService = metricsService;
    }

    /**
     * Scheduled cleanup job for expired reservations.
     * Fixed delay: the next run starts one interval after the previous one finished.
     */
    @Scheduled(fixedDelayString = "${eventbooking.reservation.cleanup.interval-ms:300000}", initialDelay = 0)
    public void cleanupExpiredReservations() {
        if (!schedulerEnabled) {
            logger.debug("Reservation expiry scheduler is disabled");
            return;
        }
        runCleanup();
    }

    /**
     * Run one sweep, isolating failures.
     *
     * @return Number of reservations reclaimed, or -1 if the sweep failed
     */
    public int runCleanup() {
        long startTime = System.currentTimeMillis();

        try {
            int reclaimed = bookingService.cleanupExpiredReservations();
            long duration = System.currentTimeMillis() - startTime;

            if (reclaimed > 0) {
                logger.info("Cleaned up {} expired reservations in {}ms", reclaimed, duration);
            } else {
                logger.debug("No expired reservations found ({}ms)", duration);
            }
            return reclaimed;

        } catch (Exception e) {
            logger.error("Error in reservation expiry scheduler", e);
            metricsService.recordError("RESERVATION_EXPIRY_SCHEDULER_ERROR", "cleanupExpiredReservations");
            return -1;
        }
    }
}
