package io.timecapsule4j;

import java.time.Duration;

/**
 * Polling engine that digs due capsules out of a {@link CapsuleStore}, hands them to a handler and
 * destroys them.
 *
 * <p>Delivery is at-least-once: a capsule whose destroy fails may be delivered again.
 */
public interface Digger<P> {

    /**
     * Register the handler. May be called only once.
     */
    void setHandler(DigHandler<P> handler);

    /**
     * Start polling. Idempotent while running.
     */
    void start();

    /**
     * Stop polling. Idempotent; no new tick starts once this returns.
     */
    void stop();

    boolean isRunning();

    CapsuleStore<P> store();

    default void buryFor(P payload, Duration duration) {
        store().buryFor(payload, duration);
    }

    default void buryUntil(P payload, long dueTimeMillis) {
        store().buryUntil(payload, dueTimeMillis);
    }
}
