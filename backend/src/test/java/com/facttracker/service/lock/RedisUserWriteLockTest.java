package com.facttracker.service.lock;

import com.facttracker.exception.BusyException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.ArgumentMatchers;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.data.redis.core.script.RedisScript;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for RedisUserWriteLock.
 *
 * Redis is mocked; lock semantics against a real server are covered by
 * FactFlowIntegrationTest.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("RedisUserWriteLock Unit Tests")
class RedisUserWriteLockTest {

    private static final String LOCK_KEY = "facts:lock:user:7";

    @Mock
    private RedisTemplate<String, String> redisStringTemplate;

    @Mock
    private ValueOperations<String, String> valueOperations;

    private RedisUserWriteLock lock;

    @BeforeEach
    void setUp() {
        when(redisStringTemplate.opsForValue()).thenReturn(valueOperations);
        lock = new RedisUserWriteLock(redisStringTemplate,
                Duration.ofMillis(60), Duration.ofSeconds(10), Duration.ofMillis(5));
    }

    @Test
    @DisplayName("executeLocked sets the key with a lease and releases it with the same token")
    void testExecuteLocked_AcquireAndRelease() {
        // Arrange
        when(valueOperations.setIfAbsent(eq(LOCK_KEY), anyString(), eq(10_000L), eq(TimeUnit.MILLISECONDS)))
                .thenReturn(true);
        when(redisStringTemplate.execute(ArgumentMatchers.<RedisScript<Long>>any(), anyList(), any()))
                .thenReturn(1L);

        // Act
        String result = lock.executeLocked(7L, () -> "written");

        // Assert
        assertEquals("written", result);

        ArgumentCaptor<String> acquiredToken = ArgumentCaptor.forClass(String.class);
        verify(valueOperations).setIfAbsent(eq(LOCK_KEY), acquiredToken.capture(), eq(10_000L), eq(TimeUnit.MILLISECONDS));

        ArgumentCaptor<Object> releasedToken = ArgumentCaptor.forClass(Object.class);
        verify(redisStringTemplate).execute(ArgumentMatchers.<RedisScript<Long>>any(),
                eq(List.of(LOCK_KEY)), releasedToken.capture());
        assertEquals(acquiredToken.getValue(), releasedToken.getValue());
    }

    @Test
    @DisplayName("a key held by someone else until the timeout throws busy without running the action")
    void testExecuteLocked_Timeout() {
        // Arrange
        when(valueOperations.setIfAbsent(eq(LOCK_KEY), anyString(), anyLong(), any(TimeUnit.class)))
                .thenReturn(false);
        AtomicBoolean ran = new AtomicBoolean(false);

        // Act & Assert
        assertThrows(BusyException.class, () -> lock.executeLocked(7L, () -> {
            ran.set(true);
            return null;
        }));
        assertFalse(ran.get());
        verify(redisStringTemplate, never()).execute(ArgumentMatchers.<RedisScript<Long>>any(), anyList(), any());
    }

    @Test
    @DisplayName("an unreachable Redis throws busy")
    void testExecuteLocked_RedisDown() {
        // Arrange
        when(valueOperations.setIfAbsent(anyString(), anyString(), anyLong(), any(TimeUnit.class)))
                .thenThrow(new RedisConnectionFailureException("connection refused"));

        // Act & Assert
        BusyException ex = assertThrows(BusyException.class, () -> lock.executeLocked(7L, () -> "never"));
        assertInstanceOf(RedisConnectionFailureException.class, ex.getCause());
    }

    @Test
    @DisplayName("the key is released when the action throws")
    void testExecuteLocked_ReleasedOnFailure() {
        // Arrange
        when(valueOperations.setIfAbsent(anyString(), anyString(), anyLong(), any(TimeUnit.class)))
                .thenReturn(true);
        when(redisStringTemplate.execute(ArgumentMatchers.<RedisScript<Long>>any(), anyList(), any()))
                .thenReturn(1L);

        // Act
        assertThrows(IllegalStateException.class, () -> lock.executeLocked(7L, () -> {
            throw new IllegalStateException("write failed");
        }));

        // Assert
        verify(redisStringTemplate).execute(ArgumentMatchers.<RedisScript<Long>>any(), eq(List.of(LOCK_KEY)), any());
    }

    @Test
    @DisplayName("a failed release does not hide the action result")
    void testExecuteLocked_ReleaseFailureIgnored() {
        // Arrange
        when(valueOperations.setIfAbsent(anyString(), anyString(), anyLong(), any(TimeUnit.class)))
                .thenReturn(true);
        when(redisStringTemplate.execute(ArgumentMatchers.<RedisScript<Long>>any(), anyList(), any()))
                .thenThrow(new RedisConnectionFailureException("gone"));

        // Act & Assert
        assertEquals(3, lock.executeLocked(7L, () -> 3));
    }
}
