package com.cred.freestyle.eventbooking.infrastructure.messaging;

import com.cred.freestyle.eventbooking.domain.model.Booking;
import com.cred.freestyle.eventbooking.infrastructure.messaging.events.BookingEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.concurrent.CompletableFuture;

/**
 * Kafka producer for booking lifecycle events, sent to the template's default (lifecycle) topic.
 *
 * Topic partitioning strategy:
 * - Key: event_id, so all transitions of one event land on the same partition in order
 *
 * Publishing is best-effort and happens after the unit of work committed. A failed publish
 * is logged and never changes the booking outcome.
 *
 * @author Event Booking Team
 */
@Service
public class BookingEventPublisher {

    private static final Logger logger = LoggerFactory.getLogger(BookingEventPublisher.class);

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public BookingEventPublisher(KafkaTemplate<String, String> kafkaTemplate, ObjectMapper objectMapper, Clock clock) {
        this.kafkaTemplate = kafkaTemplate;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public void publishReserved(Booking booking) {
        publish(toEvent(booking, BookingEvent.EventType.RESERVED));
    }

    public void publishConfirmed(Booking booking) {
        publish(toEvent(booking, BookingEvent.EventType.CONFIRMED));
    }

    public void publishCancelled(Booking booking) {
        BookingEvent event = toEvent(booking, BookingEvent.EventType.CANCELLED);
        if (booking.getRefundStatus() != null) {
            event.setRefundStatus(booking.getRefundStatus().name());
        }
        publish(event);
    }

    public void publishExpired(Booking booking) {
        publish(toEvent(booking, BookingEvent.EventType.EXPIRED));
    }

    private BookingEvent toEvent(Booking booking, BookingEvent.EventType type) {
        return new BookingEvent(
                booking.getBookingId(),
                booking.getUserId(),
                booking.getEventId(),
                booking.getTicketCount(),
                type,
                clock.instant()
        );
    }

    private void publish(BookingEvent event) {
        try {
            String payload = objectMapper.writeValueAsString(event);
            CompletableFuture<SendResult<String, String>> future = kafkaTemplate.sendDefault(
                    event.getEventId(),
                    payload
            );

            future.whenComplete((result, ex) -> {
                if (ex == null) {
                    logger.debug("Published {} event for booking {}, event: {}, partition: {}",
                            event.getEventType(), event.getBookingId(), event.getEventId(),
                            result.getRecordMetadata().partition());
                } else {
                    logger.error("Failed to publish {} event for booking {}",
                            event.getEventType(), event.getBookingId(), ex);
                }
            });
        } catch (JsonProcessingException e) {
            logger.error("Error serializing booking event for booking {}", event.getBookingId(), e);
        } catch (RuntimeException e) {
            logger.error("Failed to hand {} event for booking {} to Kafka",
                    event.getEventType(), event.getBookingId(), e);
        }
    }
}
