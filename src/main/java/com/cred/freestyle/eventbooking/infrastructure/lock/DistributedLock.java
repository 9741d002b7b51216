package com.cred.freestyle.eventbooking.infrastructure.lock;

import java.time.Duration;

/**
 * Cross-process mutual exclusion keyed by resource name.
 *
 * Each acquisition returns a unique ownership token. Release only succeeds while the
 * stored token still matches, so a holder whose TTL already lapsed can never delete a
 * lock someone else has since acquired.
 *
 * @author Event Booking Team
 */
public interface DistributedLock {

    /**
     * Attempt to acquire a lock, retrying with a fixed delay.
     *
     * @param resourceKey Resource to lock (e.g., "booking:user:u1:event:e1")
     * @param ttl Lock expiry, must exceed the longest expected critical section
     * @param maxRetries Retries after the first attempt
     * @param retryDelay Delay between attempts
     * @return Lock token if acquired, null if the retry budget was exhausted
     */
    String acquire(String resourceKey, Duration ttl, int maxRetries, Duration retryDelay);

    /**
     * Release a lock, only if the token still owns it.
     *
     * @param resourceKey Locked resource
     * @param token Token returned from acquire
     * @return true if the lock was deleted
     */
    boolean release(String resourceKey, String token);

    /**
     * Execute a task while holding the lock. The lock is released on every exit path.
     *
     * @param resourceKey Resource to lock
     * @param ttl Lock expiry
     * @param task Task to run
     * @return Task result
     * @throws com.cred.freestyle.eventbooking.exception.LockUnavailableException if the lock could not be acquired
     */
    <T> T withLock(String resourceKey, Duration ttl, LockedTask<T> task);

    /**
     * Execute a task while holding the lock, using the configured default TTL.
     */
    <T> T withLock(String resourceKey, LockedTask<T> task);

    /**
     * Lock key serializing reservation attempts of one user against one event.
     */
    static String userEventKey(String userId, String eventId) {
        return String.format("booking:user:%s:event:%s", userId, eventId);
    }

    @FunctionalInterface
    interface LockedTask<T> {
        T execute();
    }
}
