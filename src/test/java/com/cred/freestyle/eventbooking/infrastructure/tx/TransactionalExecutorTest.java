package com.cred.freestyle.eventbooking.infrastructure.tx;

import com.cred.freestyle.eventbooking.exception.InvalidBookingStateException;
import com.cred.freestyle.eventbooking.exception.TransientConflictException;
import com.cred.freestyle.eventbooking.infrastructure.metrics.CloudWatchMetricsService;
import org.hibernate.exception.LockAcquisitionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.SimpleTransactionStatus;

import java.sql.SQLException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for TransactionalExecutor retry behaviour.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("TransactionalExecutor Unit Tests")
class TransactionalExecutorTest {

    @Mock
    private PlatformTransactionManager transactionManager;

    @Mock
    private CloudWatchMetricsService metricsService;

    private TransactionalExecutor executor;

    @BeforeEach
    void setUp() {
        lenient().when(transactionManager.getTransaction(any())).thenAnswer(inv -> new SimpleTransactionStatus());
        executor = new TransactionalExecutor(transactionManager, metricsService, 3, 1);
    }

    @Test
    @DisplayName("execute - Success on first attempt commits once")
    void execute_Success() {
        // When
        String result = executor.execute(status -> "done");

        // Then
        assertThat(result).isEqualTo("done");
        verify(transactionManager).commit(any());
        verify(metricsService, never()).recordTransactionRetry();
    }

    @Test
    @DisplayName("execute - Deadlock then success retries the whole unit")
    void execute_DeadlockThenSuccess() {
        // Given
        AtomicInteger attempts = new AtomicInteger();

        // When
        String result = executor.execute(status -> {
            if (attempts.incrementAndGet() < 3) {
                throw new CannotAcquireLockException("deadlock",
                        new SQLException("deadlock detected", "40P01"));
            }
            return "done";
        });

        // Then
        assertThat(result).isEqualTo("done");
        assertThat(attempts.get()).isEqualTo(3);
        verify(transactionManager, times(2)).rollback(any());
        verify(metricsService, times(2)).recordTransactionRetry();
    }

    @Test
    @DisplayName("execute - Persistent conflict gives up with TransientConflictException")
    void execute_RetriesExhausted() {
        // Given
        AtomicInteger attempts = new AtomicInteger();

        // When / Then
        assertThatThrownBy(() -> executor.execute(status -> {
            attempts.incrementAndGet();
            throw new CannotAcquireLockException("deadlock",
                    new SQLException("deadlock detected", "40P01"));
        }))
                .isInstanceOf(TransientConflictException.class)
                .satisfies(e -> assertThat(((TransientConflictException) e).getAttempts()).isEqualTo(4));

        // 1 attempt + 3 retries
        assertThat(attempts.get()).isEqualTo(4);
    }

    @Test
    @DisplayName("execute - Business failures propagate immediately without retry")
    void execute_BusinessFailureNotRetried() {
        // Given
        AtomicInteger attempts = new AtomicInteger();

        // When / Then
        assertThatThrownBy(() -> executor.execute(status -> {
            attempts.incrementAndGet();
            throw new InvalidBookingStateException("b-1", "CANCELLED", "Booking is already cancelled");
        })).isInstanceOf(InvalidBookingStateException.class);

        assertThat(attempts.get()).isEqualTo(1);
        verify(transactionManager).rollback(any());
        verify(metricsService, never()).recordTransactionRetry();
    }

    @Test
    @DisplayName("isRetryable - Walks the cause chain for SQLState 40001 / 40P01")
    void isRetryable_SqlStates() {
        assertThat(TransactionalExecutor.isRetryable(
                new RuntimeException(new SQLException("serialization failure", "40001")))).isTrue();
        assertThat(TransactionalExecutor.isRetryable(
                new RuntimeException(new RuntimeException(new SQLException("deadlock", "40P01"))))).isTrue();
        assertThat(TransactionalExecutor.isRetryable(
                new DataIntegrityViolationException("dup", new SQLException("unique", "23505")))).isFalse();
        assertThat(TransactionalExecutor.isRetryable(new IllegalStateException("boom"))).isFalse();
    }

    @Test
    @DisplayName("execute - Lock-wait timeout propagates after one attempt")
    void execute_LockTimeoutNotRetried() {
        // Given
        AtomicInteger attempts = new AtomicInteger();

        // When / Then
        assertThatThrownBy(() -> executor.execute(status -> {
            attempts.incrementAndGet();
            throw new CannotAcquireLockException("lock timeout",
                    new SQLException("canceling statement due to lock timeout", "55P03"));
        })).isInstanceOf(CannotAcquireLockException.class);

        assertThat(attempts.get()).isEqualTo(1);
        verify(transactionManager).rollback(any());
        verify(metricsService, never()).recordTransactionRetry();
    }

    @Test
    @DisplayName("isRetryable - Lock failures without a deadlock state are not retryable")
    void isRetryable_LockTimeouts() {
        assertThat(TransactionalExecutor.isRetryable(new CannotAcquireLockException("lock timeout"))).isFalse();
        assertThat(TransactionalExecutor.isRetryable(
                new PessimisticLockingFailureException("could not obtain lock",
                        new SQLException("lock not available", "55P03")))).isFalse();
        assertThat(TransactionalExecutor.isRetryable(
                new CannotAcquireLockException("deadlock",
                        new LockAcquisitionException("deadlock", new SQLException("deadlock")))))
                .isTrue();
    }
}
