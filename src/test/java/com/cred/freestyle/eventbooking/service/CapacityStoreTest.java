package com.cred.freestyle.eventbooking.service;

import com.cred.freestyle.eventbooking.repository.EventRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.ZoneOffset;

import static com.cred.freestyle.eventbooking.testutil.TestDataBuilder.NOW;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

/**
 * Unit tests for CapacityStore.
 * The conditional update semantics themselves are exercised against H2 in BookingFlowIntegrationTest.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("CapacityStore Unit Tests")
class CapacityStoreTest {

    @Mock
    private EventRepository eventRepository;

    private CapacityStore capacityStore;

    @BeforeEach
    void setUp() {
        capacityStore = new CapacityStore(eventRepository, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("tryDebit - One row updated means debited")
    void tryDebit_Success() {
        when(eventRepository.debitCapacity("e-1", 2, NOW)).thenReturn(1);

        assertThat(capacityStore.tryDebit("e-1", 2)).isTrue();
    }

    @Test
    @DisplayName("tryDebit - No row updated means insufficient capacity")
    void tryDebit_Insufficient() {
        when(eventRepository.debitCapacity("e-1", 5, NOW)).thenReturn(0);

        assertThat(capacityStore.tryDebit("e-1", 5)).isFalse();
    }

    @Test
    @DisplayName("credit - Rejected credit is an invariant violation")
    void credit_Rejected() {
        when(eventRepository.creditCapacity("e-1", 3, NOW)).thenReturn(0);

        assertThatThrownBy(() -> capacityStore.credit("e-1", 3))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("Cannot release 3 tickets to event e-1");
    }

    @Test
    @DisplayName("availableCapacity - Missing event reads as zero")
    void availableCapacity_Missing() {
        when(eventRepository.getAvailableCapacity("e-1")).thenReturn(null);
        when(eventRepository.getAvailableCapacity("e-2")).thenReturn(42);

        assertThat(capacityStore.availableCapacity("e-1")).isZero();
        assertThat(capacityStore.availableCapacity("e-2")).isEqualTo(42);
    }
}
