package io.timecapsule4j.utils;

import io.timecapsule4j.core.RetryExhaustedException;
import io.timecapsule4j.core.RetrySettings;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AttemptsTest {

    @Test
    void shouldStopAtFirstSuccess() {
        AtomicInteger calls = new AtomicInteger();

        int used = Attempts.withFixedDelay("op", new RetrySettings(5, Duration.ZERO), attempt -> {
            if (calls.incrementAndGet() < 3) {
                throw new IllegalStateException("not yet");
            }
        });

        assertEquals(3, used);
        assertEquals(3, calls.get());
    }

    @Test
    void shouldGiveUpAfterLimitWithLastFailureAsCause() {
        AtomicInteger calls = new AtomicInteger();

        RetryExhaustedException e = assertThrows(RetryExhaustedException.class, () ->
                Attempts.withFixedDelay("requeue", new RetrySettings(4, Duration.ofMillis(1)), attempt -> {
                    throw new IllegalStateException("boom " + calls.incrementAndGet());
                }));

        assertEquals(4, calls.get());
        assertEquals(4, e.attempts());
        assertEquals("boom 4", e.getCause().getMessage());
        assertTrue(e.getMessage().startsWith("requeue failed after 4 attempts"));
    }

    @Test
    void shouldWaitFixedIntervalBetweenAttempts() {
        long start = System.nanoTime();

        assertThrows(RetryExhaustedException.class, () ->
                Attempts.withFixedDelay("op", new RetrySettings(3, Duration.ofMillis(30)), attempt -> {
                    throw new IllegalStateException("fail");
                }));

        long elapsedMs = Duration.ofNanos(System.nanoTime() - start).toMillis();
        assertTrue(elapsedMs >= 60, "expected two pauses of 30ms, took " + elapsedMs + "ms");
    }

    @Test
    void shouldRespectDeadline() {
        AtomicInteger calls = new AtomicInteger();

        assertThrows(RetryExhaustedException.class, () ->
                Attempts.withFixedDelay("op", new RetrySettings(1000, Duration.ofMillis(20)),
                        Instant.now().plusMillis(100), attempt -> {
                            calls.incrementAndGet();
                            throw new IllegalStateException("fail");
                        }));

        assertTrue(calls.get() < 1000);
    }

    @Test
    void retrySettingsShouldRejectNonPositiveLimit() {
        assertThrows(IllegalArgumentException.class, () -> new RetrySettings(0, Duration.ZERO));
    }
}
