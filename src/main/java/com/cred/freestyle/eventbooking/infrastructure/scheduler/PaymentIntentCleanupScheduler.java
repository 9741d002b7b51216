package com.cred.freestyle.eventbooking.infrastructure.scheduler;

import com.cred.freestyle.eventbooking.infrastructure.metrics.CloudWatchMetricsService;
import com.cred.freestyle.eventbooking.service.PaymentGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Hourly purge of expired payment intents past their retention window.
 *
 * @author Event Booking Team
 */
@Service
public class PaymentIntentCleanupScheduler {

    private static final Logger logger = LoggerFactory.getLogger(PaymentIntentCleanupScheduler.class);

    private final PaymentGateway paymentGateway;
    private final CloudWatchMetricsService metricsService;

    @Value("${eventbooking.payment.cleanup-enabled:true}")
    private boolean schedulerEnabled = true;

    public PaymentIntentCleanupScheduler(PaymentGateway paymentGateway, CloudWatchMetricsService metricsService) {
        this.paymentGateway = paymentGateway;
        this.metricsService = metricsService;
    }

    @Scheduled(fixedDelayString = "${eventbooking.payment.cleanup-interval-ms:3600000}",
               initialDelayString = "${eventbooking.payment.cleanup-interval-ms:3600000}")
    public void cleanupExpiredPaymentIntents() {
        if (!schedulerEnabled) {
            return;
        }

        try {
            int deleted = paymentGateway.cleanupExpiredPaymentIntents();
            logger.debug("Payment intent cleanup removed {} intents", deleted);
        } catch (Exception e) {
            logger.error("Error in payment intent cleanup scheduler", e);
            metricsService.recordError("PAYMENT_INTENT_CLEANUP_ERROR", "cleanupExpiredPaymentIntents");
        }
    }
}
