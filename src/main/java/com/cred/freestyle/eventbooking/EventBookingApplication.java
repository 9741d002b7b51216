package com.cred.freestyle.eventbooking;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * Main Spring Boot application class for the event booking service.
 *
 * System Overview:
 * - Time-boxed reservation holds against a finite per-event ticket capacity
 * - Confirmation after verified payment, cancellation with banded refunds
 * - Background reclamation of lapsed holds
 * - No oversell under concurrent, multi-instance access
 *
 * Architecture:
 * - API Layer: thin REST controllers with validation
 * - Service Layer: reservation lifecycle, payment checkout, event administration
 * - Data Access Layer: JPA repositories with conditional updates and pessimistic row locks
 * - Infrastructure Layer: Redis distributed lock, deadlock-retrying transactions,
 *   scheduled sweeps, Kafka lifecycle events, CloudWatch metrics
 *
 * @author Event Booking Team
 */
@SpringBootApplication
@EnableJpaRepositories
@EnableTransactionManagement
@EnableScheduling
public class EventBookingApplication {

    public static void main(String[] args) {
        SpringApplication.run(EventBookingApplication.class, args);
    }
}
