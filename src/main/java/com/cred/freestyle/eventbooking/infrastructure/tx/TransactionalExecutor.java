package com.cred.freestyle.eventbooking.infrastructure.tx;

import com.cred.freestyle.eventbooking.exception.TransientConflictException;
import com.cred.freestyle.eventbooking.infrastructure.metrics.CloudWatchMetricsService;
import org.hibernate.exception.LockAcquisitionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.SQLException;
import java.util.Set;

/**
 * Runs a unit of work in one database transaction and retries the whole unit when the
 * database aborts it with a deadlock or serialization failure.
 *
 * Retry policy:
 * - Retryable: SQLState 40P01 (deadlock detected) or 40001 (serialization failure) anywhere in
 *   the cause chain, and Hibernate's LockAcquisitionException, which is what both are translated to
 * - Not retryable: lock-wait timeouts (55P03, jakarta.persistence.lock.timeout). A unit that
 *   waited out its row lock once would wait again, and repeating it could outlive the
 *   distributed lock held around it
 * - Backoff: initialDelay * 2^(attempt-1), i.e. 100ms, 200ms, 400ms with defaults
 * - Anything else propagates immediately, without retry
 * - When retries run out the last failure is raised wrapped in TransientConflictException
 *
 * Must be the outermost transaction boundary: a unit joining an outer transaction cannot be
 * retried on its own.
 *
 * @author Event Booking Team
 */
@Component
public class TransactionalExecutor {

    private static final Logger logger = LoggerFactory.getLogger(TransactionalExecutor.class);

    private static final Set<String> RETRYABLE_SQL_STATES = Set.of("40P01", "40001");

    private final TransactionTemplate transactionTemplate;
    private final CloudWatchMetricsService metricsService;
    private final int maxRetries;
    private final long initialDelayMs;

    public TransactionalExecutor(
            PlatformTransactionManager transactionManager,
            CloudWatchMetricsService metricsService,
            @Value("${eventbooking.transaction.max-retries:3}") int maxRetries,
            @Value("${eventbooking.transaction.initial-delay-ms:100}") long initialDelayMs
    ) {
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.metricsService = metricsService;
        this.maxRetries = maxRetries;
        this.initialDelayMs = initialDelayMs;
    }

    /**
     * Execute the unit of work in a new transaction, retrying on transient conflicts.
     *
     * @param work Unit of work; must be safe to run again from scratch
     * @return Result of the unit of work
     * @throws TransientConflictException if every attempt hit a deadlock or serialization failure
     */
    public <T> T execute(TransactionCallback<T> work) {
        int attempt = 0;

        while (true) {
            try {
                return transactionTemplate.execute(work);
            } catch (RuntimeException e) {
                if (!isRetryable(e)) {
                    throw e;
                }

                attempt++;
                if (attempt > maxRetries) {
                    logger.error("Transaction conflict persisted after {} attempts, giving up", attempt, e);
                    throw new TransientConflictException(attempt, e);
                }

                long backoffMs = initialDelayMs * (1L << (attempt - 1));
                logger.warn("Transaction conflict detected (attempt {}/{}), retrying in {}ms: {}",
                        attempt, maxRetries, backoffMs, e.getMessage());
                metricsService.recordTransactionRetry();

                try {
                    Thread.sleep(backoffMs);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new TransientConflictException(attempt, e);
                }
            }
        }
    }

    /**
     * Whether the failure, or anything in its cause chain, is a deadlock or serialization failure.
     */
    static boolean isRetryable(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof LockAcquisitionException) {
                return true;
            }
            if (current instanceof SQLException
                    && RETRYABLE_SQL_STATES.contains(((SQLException) current).getSQLState())) {
                return true;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return false;
    }
}
