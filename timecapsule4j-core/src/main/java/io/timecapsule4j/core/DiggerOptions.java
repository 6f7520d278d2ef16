package io.timecapsule4j.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Runtime configuration for a digger.
 *
 * <p>Options built with {@link #builder()} may be partial: a non-positive number, a null duration
 * or a null logger means "keep the default" when merged over {@link #defaults()}.
 */
public final class DiggerOptions {

    public static final int DEFAULT_RETRY_LIMIT = 100;
    public static final Duration DEFAULT_RETRY_INTERVAL = Duration.ofMillis(500);
    public static final Duration DEFAULT_OPERATION_TIMEOUT = Duration.ofMinutes(1);
    public static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(10);

    private static final Logger DEFAULT_LOGGER = LoggerFactory.getLogger("io.timecapsule4j.Digger");

    private final int retryLimit; // destroy re-attempts made by the digger
    private final Duration retryInterval;
    private final Logger logger;
    private final Duration operationTimeout; // per dig / destroy
    private final Duration shutdownTimeout;

    private DiggerOptions(Builder b) {
        this.retryLimit = b.retryLimit;
        this.retryInterval = b.retryInterval;
        this.logger = b.logger;
        this.operationTimeout = b.operationTimeout;
        this.shutdownTimeout = b.shutdownTimeout;
    }

    public static DiggerOptions defaults() {
        return builder()
                .retryLimit(DEFAULT_RETRY_LIMIT)
                .retryInterval(DEFAULT_RETRY_INTERVAL)
                .logger(DEFAULT_LOGGER)
                .operationTimeout(DEFAULT_OPERATION_TIMEOUT)
                .shutdownTimeout(DEFAULT_SHUTDOWN_TIMEOUT)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns a copy of this where every usable value of {@code override} wins.
     */
    public DiggerOptions merge(DiggerOptions override) {
        if (override == null) {
            return this;
        }
        return builder()
                .retryLimit(override.retryLimit > 0 ? override.retryLimit : retryLimit)
                .retryInterval(isPositive(override.retryInterval) ? override.retryInterval : retryInterval)
                .logger(override.logger != null ? override.logger : logger)
                .operationTimeout(isPositive(override.operationTimeout) ? override.operationTimeout : operationTimeout)
                .shutdownTimeout(isPositive(override.shutdownTimeout) ? override.shutdownTimeout : shutdownTimeout)
                .build();
    }

    private static boolean isPositive(Duration d) {
        return d != null && !d.isZero() && !d.isNegative();
    }

    public int retryLimit() {
        return retryLimit;
    }

    public Duration retryInterval() {
        return retryInterval;
    }

    public Logger logger() {
        return logger;
    }

    public Duration operationTimeout() {
        return operationTimeout;
    }

    public Duration shutdownTimeout() {
        return shutdownTimeout;
    }

    public static final class Builder {
        private int retryLimit;
        private Duration retryInterval;
        private Logger logger;
        private Duration operationTimeout;
        private Duration shutdownTimeout;

        private Builder() {
        }

        public Builder retryLimit(int retryLimit) {
            this.retryLimit = retryLimit;
            return this;
        }

        public Builder retryInterval(Duration retryInterval) {
            this.retryInterval = retryInterval;
            return this;
        }

        public Builder logger(Logger logger) {
            this.logger = logger;
            return this;
        }

        /**
         * Upper bound for a single dig or destroy call.
         */
        public Builder operationTimeout(Duration operationTimeout) {
            this.operationTimeout = operationTimeout;
            return this;
        }

        /**
         * How long {@code stop()} waits for an in-flight tick before interrupting it.
         */
        public Builder shutdownTimeout(Duration shutdownTimeout) {
            this.shutdownTimeout = shutdownTimeout;
            return this;
        }

        public DiggerOptions build() {
            return new DiggerOptions(this);
        }
    }
}
