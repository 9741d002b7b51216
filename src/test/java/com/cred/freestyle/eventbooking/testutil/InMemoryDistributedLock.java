package com.cred.freestyle.eventbooking.testutil;

import com.cred.freestyle.eventbooking.exception.LockUnavailableException;
import com.cred.freestyle.eventbooking.infrastructure.lock.DistributedLock;

import java.time.Duration;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Single-JVM stand-in for the Redis lock in full-context tests, with the same
 * token-checked release semantics. TTLs are not enforced.
 */
public class InMemoryDistributedLock implements DistributedLock {

    private final Map<String, String> owners = new ConcurrentHashMap<>();

    @Override
    public String acquire(String resourceKey, Duration ttl, int maxRetries, Duration retryDelay) {
        for (int attempt = 0; attempt <= maxRetries; attempt++) {
            String token = UUID.randomUUID().toString();
            if (owners.putIfAbsent(resourceKey, token) == null) {
                return token;
            }
            try {
                Thread.sleep(retryDelay.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return null;
            }
        }
        return null;
    }

    @Override
    public boolean release(String resourceKey, String token) {
        return token != null && owners.remove(resourceKey, token);
    }

    @Override
    public <T> T withLock(String resourceKey, Duration ttl, LockedTask<T> task) {
        String token = acquire(resourceKey, ttl, 500, Duration.ofMillis(20));
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
        return withLock(resourceKey, Duration.ofSeconds(30), task);
    }
}
