package com.cred.freestyle.eventbooking.infrastructure.messaging;

import com.cred.freestyle.eventbooking.domain.model.Booking;
import com.cred.freestyle.eventbooking.domain.model.Booking.BookingStatus;
import com.cred.freestyle.eventbooking.domain.model.Booking.RefundStatus;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.apache.kafka.common.errors.TimeoutException;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.concurrent.CompletableFuture;

import static com.cred.freestyle.eventbooking.testutil.TestDataBuilder.NOW;
import static com.cred.freestyle.eventbooking.testutil.TestDataBuilder.aBooking;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for BookingEventPublisher.
 */
@ExtendWith(MockitoExtension.class)
class BookingEventPublisherTest {

    @Mock
    private KafkaTemplate<String, String> kafkaTemplate;

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();

    private BookingEventPublisher publisher;

    @BeforeEach
    void setUp() {
        publisher = new BookingEventPublisher(kafkaTemplate, objectMapper, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("publishCancelled - Keyed by event id and carries the refund outcome")
    void publishCancelled_KeyedByEvent() throws Exception {
        // Arrange
        Booking booking = aBooking().bookingId("b-1").eventId("event-42").tickets(3)
                .status(BookingStatus.CANCELLED).build();
        booking.setRefundStatus(RefundStatus.PARTIAL_REFUND);
        when(kafkaTemplate.sendDefault(anyString(), anyString())).thenReturn(new CompletableFuture<>());

        // Act
        publisher.publishCancelled(booking);

        // Assert
        ArgumentCaptor<String> payload = ArgumentCaptor.forClass(String.class);
        verify(kafkaTemplate).sendDefault(eq("event-42"), payload.capture());

        JsonNode json = objectMapper.readTree(payload.getValue());
        assertThat(json.get("bookingId").asText()).isEqualTo("b-1");
        assertThat(json.get("eventType").asText()).isEqualTo("CANCELLED");
        assertThat(json.get("ticketCount").asInt()).isEqualTo(3);
        assertThat(json.get("refundStatus").asText()).isEqualTo("PARTIAL_REFUND");
    }

    @Test
    @DisplayName("publishReserved - Broker failure is logged, never thrown")
    void publish_FailureIsSwallowedByCaller() {
        // Arrange
        when(kafkaTemplate.sendDefault(anyString(), anyString()))
                .thenThrow(new TimeoutException("metadata not available"));

        // Act / Assert
        assertThatCode(() -> publisher.publishReserved(aBooking().build())).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("publishExpired - Failed send completion does not propagate")
    void publish_AsyncFailure() {
        // Arrange
        CompletableFuture<SendResult<String, String>> failed = new CompletableFuture<>();
        failed.completeExceptionally(new IllegalStateException("broker down"));
        when(kafkaTemplate.sendDefault(anyString(), anyString())).thenReturn(failed);

        // Act / Assert
        assertThatCode(() -> publisher.publishExpired(aBooking().build())).doesNotThrowAnyException();
    }
}
