package io.timecapsule4j.config;

import java.time.Duration;

import io.timecapsule4j.core.DiggerOptions;
import io.timecapsule4j.core.RetrySettings;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Runtime configuration for the capsule store and its digger.
 */
@ConfigurationProperties(prefix = "timecapsule")
public class TimeCapsuleProperties {
    private boolean enabled = true;
    private String key = "timecapsule"; // sorted-set key shared by producers and diggers
    private Duration digInterval = Duration.ofSeconds(1);
    private int retryLimit = DiggerOptions.DEFAULT_RETRY_LIMIT; // destroy re-attempts per capsule
    private Duration retryInterval = DiggerOptions.DEFAULT_RETRY_INTERVAL;
    private Duration operationTimeout = DiggerOptions.DEFAULT_OPERATION_TIMEOUT;
    private Duration shutdownTimeout = DiggerOptions.DEFAULT_SHUTDOWN_TIMEOUT;
    private int requeueAttempts = RetrySettings.DEFAULT_LIMIT;
    private Duration requeueInterval = RetrySettings.DEFAULT_INTERVAL;
    private boolean autoStartup = true;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getKey() {
        return key;
    }

    public void setKey(String key) {
        this.key = key;
    }

    public Duration getDigInterval() {
        return digInterval;
    }

    public void setDigInterval(Duration digInterval) {
        this.digInterval = digInterval;
    }

    public int getRetryLimit() {
        return retryLimit;
    }

    public void setRetryLimit(int retryLimit) {
        this.retryLimit = retryLimit;
    }

    public Duration getRetryInterval() {
        return retryInterval;
    }

    public void setRetryInterval(Duration retryInterval) {
        this.retryInterval = retryInterval;
    }

    public Duration getOperationTimeout() {
        return operationTimeout;
    }

    public void setOperationTimeout(Duration operationTimeout) {
        this.operationTimeout = operationTimeout;
    }

    public Duration getShutdownTimeout() {
        return shutdownTimeout;
    }

    public void setShutdownTimeout(Duration shutdownTimeout) {
        this.shutdownTimeout = shutdownTimeout;
    }

    public int getRequeueAttempts() {
        return requeueAttempts;
    }

    public void setRequeueAttempts(int requeueAttempts) {
        this.requeueAttempts = requeueAttempts;
    }

    public Duration getRequeueInterval() {
        return requeueInterval;
    }

    public void setRequeueInterval(Duration requeueInterval) {
        this.requeueInterval = requeueInterval;
    }

    public boolean isAutoStartup() {
        return autoStartup;
    }

    public void setAutoStartup(boolean autoStartup) {
        this.autoStartup = autoStartup;
    }

    RetrySettings toRetrySettings() {
        return new RetrySettings(requeueAttempts, requeueInterval);
    }

    DiggerOptions toDiggerOptions() {
        return DiggerOptions.builder()
                .retryLimit(retryLimit)
                .retryInterval(retryInterval)
                .operationTimeout(operationTimeout)
                .shutdownTimeout(shutdownTimeout)
                .build();
    }
}
