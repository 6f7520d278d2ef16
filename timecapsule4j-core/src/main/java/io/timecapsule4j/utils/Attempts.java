package io.timecapsule4j.utils;

import io.timecapsule4j.core.RetryExhaustedException;
import io.timecapsule4j.core.RetrySettings;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Fixed-delay retry helper.
 *
 * <p>No back-off: every failed attempt is followed by the same pause. The last failure is attached
 * as the cause of the {@link RetryExhaustedException}.
 */
public final class Attempts {
    private Attempts() {
    }

    @FunctionalInterface
    public interface Attempt {
        void run(int attempt) throws Exception;
    }

    /**
     * Runs {@code attempt} until it completes normally or {@code settings.limit()} attempts failed.
     *
     * @param operation short description used in the failure message
     * @return the number of attempts used (1 on first-try success)
     */
    public static int withFixedDelay(String operation, RetrySettings settings, Attempt attempt) {
        return withFixedDelay(operation, settings, null, attempt);
    }

    /**
     * Same as {@link #withFixedDelay(String, RetrySettings, Attempt)} but gives up early once
     * {@code deadline} has passed. A null deadline means no deadline.
     */
    public static int withFixedDelay(String operation, RetrySettings settings, Instant deadline, Attempt attempt) {
        Objects.requireNonNull(settings, "settings must not be null");
        Objects.requireNonNull(attempt, "attempt must not be null");

        Exception last = null;
        int tried = 0;
        for (int i = 0; i < settings.limit(); i++) {
            tried++;
            try {
                attempt.run(i);
                return tried;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new RetryExhaustedException(operation + " (interrupted)", tried, e);
            } catch (Exception e) {
                last = e;
            }

            if (i + 1 >= settings.limit()) {
                break;
            }
            if (deadline != null && !Instant.now().plus(settings.interval()).isBefore(deadline)) {
                break;
            }
            if (!pause(settings.interval())) {
                throw new RetryExhaustedException(operation + " (interrupted)", tried, last);
            }
        }
        throw new RetryExhaustedException(operation, tried, last);
    }

    private static boolean pause(Duration interval) {
        if (interval.isZero()) {
            return true;
        }
        try {
            Thread.sleep(interval.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
