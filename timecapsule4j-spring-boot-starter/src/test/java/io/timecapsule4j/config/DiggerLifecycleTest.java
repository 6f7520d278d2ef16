package io.timecapsule4j.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.timecapsule4j.core.CapsuleCodec;
import io.timecapsule4j.internal.PollingDigger;
import io.timecapsule4j.internal.memory.InMemoryCapsuleStore;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class DiggerLifecycleTest {

    @Test
    void shouldFollowDiggerState() {
        InMemoryCapsuleStore<String> store = new InMemoryCapsuleStore<>("lifecycle",
                new CapsuleCodec<>(new ObjectMapper(), String.class));
        PollingDigger<String> digger = new PollingDigger<>(store, Duration.ofMillis(100));
        DiggerLifecycle lifecycle = new DiggerLifecycle(digger, false);

        assertThat(lifecycle.isAutoStartup()).isFalse();
        assertThat(lifecycle.isRunning()).isFalse();

        lifecycle.start();
        assertThat(lifecycle.isRunning()).isTrue();

        lifecycle.stop();
        assertThat(lifecycle.isRunning()).isFalse();
    }
}
