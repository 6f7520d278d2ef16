package io.timecapsule4j.config;

import io.timecapsule4j.Digger;
import org.springframework.context.SmartLifecycle;

/**
 * Bridges digger start/stop with the Spring container lifecycle.
 */
public class DiggerLifecycle implements SmartLifecycle {
    private final Digger<?> digger;
    private final boolean autoStartup;

    public DiggerLifecycle(Digger<?> digger, boolean autoStartup) {
        this.digger = digger;
        this.autoStartup = autoStartup;
    }

    @Override
    public void start() {
        digger.start();
    }

    @Override
    public void stop() {
        digger.stop();
    }

    @Override
    public boolean isRunning() {
        return digger.isRunning();
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }

    @Override
    public boolean isAutoStartup() {
        return autoStartup;
    }
}
