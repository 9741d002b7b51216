package com.cred.freestyle.eventbooking.infrastructure.lock;

import com.cred.freestyle.eventbooking.exception.LockUnavailableException;
import com.cred.freestyle.eventbooking.infrastructure.metrics.CloudWatchMetricsService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Duration;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for RedisDistributedLock.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("RedisDistributedLock Unit Tests")
class RedisDistributedLockTest {

    private static final String RESOURCE = "booking:user:u1:event:e1";
    private static final String LOCK_KEY = "lock:" + RESOURCE;

    @Mock
    private StringRedisTemplate redisTemplate;

    @Mock
    private ValueOperations<String, String> valueOperations;

    @Mock
    private RedisScript<Long> releaseScript;

    @Mock
    private CloudWatchMetricsService metricsService;

    private RedisDistributedLock lock;

    @BeforeEach
    void setUp() {
        lenient().when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        lock = new RedisDistributedLock(redisTemplate, releaseScript, metricsService);
    }

    @Test
    @DisplayName("acquire - Free lock is taken with SET NX PX and a unique token")
    void acquire_FreeLock() {
        // Given
        when(valueOperations.setIfAbsent(eq(LOCK_KEY), anyString(), eq(Duration.ofSeconds(30)))).thenReturn(true);

        // When
        String token = lock.acquire(RESOURCE, Duration.ofSeconds(30), 3, Duration.ofMillis(1));

        // Then
        assertThat(token).isNotBlank();
        verify(valueOperations, times(1)).setIfAbsent(eq(LOCK_KEY), eq(token), any(Duration.class));
    }

    @Test
    @DisplayName("acquire - Held lock is retried maxRetries times, then null and contention metric")
    void acquire_Contended() {
        // Given
        when(valueOperations.setIfAbsent(eq(LOCK_KEY), anyString(), any(Duration.class))).thenReturn(false);

        // When
        String token = lock.acquire(RESOURCE, Duration.ofSeconds(30), 2, Duration.ofMillis(1));

        // Then
        assertThat(token).isNull();
        verify(valueOperations, times(3)).setIfAbsent(eq(LOCK_KEY), anyString(), any(Duration.class));
        verify(metricsService).recordLockContention(RESOURCE);
    }

    @Test
    @DisplayName("acquire - Lock freed during retries is acquired")
    void acquire_FreedDuringRetry() {
        // Given
        when(valueOperations.setIfAbsent(eq(LOCK_KEY), anyString(), any(Duration.class)))
                .thenReturn(false, false, true);

        // When
        String token = lock.acquire(RESOURCE, Duration.ofSeconds(30), 5, Duration.ofMillis(1));

        // Then
        assertThat(token).isNotNull();
        verify(metricsService, never()).recordLockContention(anyString());
    }

    @Test
    @DisplayName("release - Runs compare-and-delete with the caller's token")
    @SuppressWarnings("unchecked")
    void release_OwnToken() {
        // Given
        when(redisTemplate.execute(eq(releaseScript), anyList(), eq("token-1"))).thenReturn(1L);

        // When
        boolean released = lock.release(RESOURCE, "token-1");

        // Then
        assertThat(released).isTrue();
        ArgumentCaptor<List<String>> keys = ArgumentCaptor.forClass(List.class);
        verify(redisTemplate).execute(eq(releaseScript), keys.capture(), eq("token-1"));
        assertThat(keys.getValue()).isEqualTo(Collections.singletonList(LOCK_KEY));
    }

    @Test
    @DisplayName("release - Stale token does not delete someone else's lock")
    void release_StaleToken() {
        // Given
        when(redisTemplate.execute(eq(releaseScript), anyList(), eq("stale"))).thenReturn(0L);

        // When / Then
        assertThat(lock.release(RESOURCE, "stale")).isFalse();
    }

    @Test
    @DisplayName("release - Redis failure is logged, not thrown")
    void release_RedisDown() {
        // Given
        when(redisTemplate.execute(eq(releaseScript), anyList(), anyString()))
                .thenThrow(new RedisConnectionFailureException("down"));

        // When / Then
        assertThat(lock.release(RESOURCE, "token-1")).isFalse();
    }

    @Test
    @DisplayName("withLock - Runs the task and always releases")
    void withLock_ReleasesAfterFailure() {
        // Given
        when(valueOperations.setIfAbsent(eq(LOCK_KEY), anyString(), any(Duration.class))).thenReturn(true);
        when(redisTemplate.execute(eq(releaseScript), anyList(), anyString())).thenReturn(1L);

        // When
        String result = lock.withLock(RESOURCE, () -> "ok");

        // Then
        assertThat(result).isEqualTo("ok");

        assertThatThrownBy(() -> lock.withLock(RESOURCE, () -> {
            throw new IllegalStateException("task failed");
        })).isInstanceOf(IllegalStateException.class);

        verify(redisTemplate, times(2)).execute(eq(releaseScript), anyList(), anyString());
    }

    @Test
    @DisplayName("withLock - Unavailable lock raises LockUnavailableException without running the task")
    void withLock_Unavailable() {
        // Given
        ReflectionTestUtils.setField(lock, "defaultRetryDelayMs", 1L);
        when(valueOperations.setIfAbsent(eq(LOCK_KEY), anyString(), any(Duration.class))).thenReturn(false);

        // When / Then
        assertThatThrownBy(() -> lock.withLock(RESOURCE, () -> {
            throw new AssertionError("task must not run");
        }))
                .isInstanceOf(LockUnavailableException.class)
                .hasMessageContaining(RESOURCE);

        // 1 attempt + 5 default retries, never released since never owned
        verify(valueOperations, times(6)).setIfAbsent(eq(LOCK_KEY), anyString(), any(Duration.class));
        verify(redisTemplate, never()).execute(eq(releaseScript), anyList(), anyString());
    }

    @Test
    @DisplayName("userEventKey - Stable key per (user, event)")
    void userEventKey() {
        assertThat(DistributedLock.userEventKey("u1", "e1")).isEqualTo(RESOURCE);
    }
}
