package com.cred.freestyle.eventbooking.infrastructure.lock;

import com.cred.freestyle.eventbooking.exception.LockUnavailableException;
import com.cred.freestyle.eventbooking.infrastructure.metrics.CloudWatchMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Collections;
import java.util.UUID;

/**
 * Redis-based distributed lock implementation using the SET NX PX pattern.
 *
 * Lock Pattern:
 * - SET key token NX PX ttl, where token is a fresh UUID per acquisition
 * - Release runs a Lua compare-and-delete, so GET and DEL are one atomic step
 * - Automatic expiry prevents deadlocks if the holder crashes
 *
 * Usage:
 * <pre>
 * Booking booking = distributedLock.withLock(
 *         DistributedLock.userEventKey(userId, eventId),
 *         () -> executor.execute(status -> ...));
 * </pre>
 *
 * @author Event Booking Team
 */
@Service
public class RedisDistributedLock implements DistributedLock {

    private static final Logger logger = LoggerFactory.getLogger(RedisDistributedLock.class);

    static final String LOCK_PREFIX = "lock:";

    private final StringRedisTemplate stringRedisTemplate;
    private final RedisScript<Long> lockReleaseScript;
    private final CloudWatchMetricsService metricsService;

    @Value("${eventbooking.lock.ttl-ms:30000}")
    private long defaultTtlMs = 30000;

    @Value("${eventbooking.lock.max-retries:5}")
    private int defaultMaxRetries = 5;

    @Value("${eventbooking.lock.retry-delay-ms:200}")
    private long defaultRetryDelayMs = 200;

    public RedisDistributedLock(
            StringRedisTemplate stringRedisTemplate,
            RedisScript<Long> lockReleaseScript,
            CloudWatchMetricsService metricsService
    ) {
        this.stringRedisTemplate = stringRedisTemplate;
        this.lockReleaseScript = lockReleaseScript;
        this.metricsService = metricsService;
    }

    @Override
    public String acquire(String resourceKey, Duration ttl, int maxRetries, Duration retryDelay) {
        String lockKey = LOCK_PREFIX + resourceKey;
        String lockToken = UUID.randomUUID().toString();
        int attempt = 0;

        while (attempt <= maxRetries) {
            Boolean acquired = stringRedisTemplate.opsForValue().setIfAbsent(lockKey, lockToken, ttl);

            if (Boolean.TRUE.equals(acquired)) {
                logger.debug("Acquired lock: {} with token: {} after {} attempts", lockKey, lockToken, attempt + 1);
                return lockToken;
            }

            attempt++;
            if (attempt <= maxRetries) {
                try {
                    Thread.sleep(retryDelay.toMillis());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    logger.warn("Lock acquisition interrupted for key: {}", lockKey);
                    return null;
                }
            }
        }

        logger.warn("Failed to acquire lock after {} attempts: {}", attempt, lockKey);
        metricsService.recordLockContention(resourceKey);
        return null;
    }

    @Override
    public boolean release(String resourceKey, String token) {
        if (token == null) {
            return false;
        }
        String lockKey = LOCK_PREFIX + resourceKey;
        try {
            Long result = stringRedisTemplate.execute(
                    lockReleaseScript,
                    Collections.singletonList(lockKey),
                    token
            );

            boolean released = result != null && result == 1L;
            if (released) {
                logger.debug("Released lock: {} with token: {}", lockKey, token);
            } else {
                logger.warn("Lock {} was not released: token no longer owns it (expired or re-acquired)", lockKey);
            }
            return released;
        } catch (Exception e) {
            // The lock expires on its own; a failed release must not mask the task outcome.
            logger.error("Error releasing lock for key: {}", lockKey, e);
            return false;
        }
    }

    @Override
    public <T> T withLock(String resourceKey, Duration ttl, LockedTask<T> task) {
        String token = acquire(resourceKey, ttl, defaultMaxRetries, Duration.ofMillis(defaultRetryDelayMs));
        if (token == null) {
            throw new LockUnavailableException(resourceKey);
        }

        try {
            return task.execute();
        } finally {
            release(resourceKey, token);
        }
    }

    @Override
    public <T> T withLock(String resourceKey, LockedTask<T> task) {
        return withLock(resourceKey, Duration.ofMillis(defaultTtlMs), task);
    }
}
