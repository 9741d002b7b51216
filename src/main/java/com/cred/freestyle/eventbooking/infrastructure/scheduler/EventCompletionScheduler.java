package com.cred.freestyle.eventbooking.infrastructure.scheduler;

import com.cred.freestyle.eventbooking.infrastructure.metrics.CloudWatchMetricsService;
import com.cred.freestyle.eventbooking.service.EventService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Marks events whose end time has passed as COMPLETED.
 *
 * @author Event Booking Team
 */
@Service
public class EventCompletionScheduler {

    private static final Logger logger = LoggerFactory.getLogger(EventCompletionScheduler.class);

    private final EventService eventService;
    private final CloudWatchMetricsService metricsService;

    @Value("${eventbooking.event.completion.enabled:true}")
    private boolean schedulerEnabled = true;

    public EventCompletionScheduler(EventService eventService, CloudWatchMetricsService metricsService) {
        this.eventService = eventService;
        this.metricsService = metricsService;
    }

    @Scheduled(fixedDelayString = "${eventbooking.event.completion.interval-ms:300000}", initialDelay = 0)
    public void completeFinishedEvents() {
        if (!schedulerEnabled) {
            return;
        }

        try {
            eventService.completeFinishedEvents();
        } catch (Exception e) {
            logger.error("Error in event completion scheduler", e);
            metricsService.recordError("EVENT_COMPLETION_SCHEDULER_ERROR", "completeFinishedEvents");
        }
    }
}
