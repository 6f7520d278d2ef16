package io.timecapsule4j;

import io.timecapsule4j.core.TimeCapsule;

/**
 * Receives capsules dug up by a {@link Digger}. Invoked synchronously on the digger's polling thread.
 */
@FunctionalInterface
public interface DigHandler<P> {

    void handle(Digger<P> digger, TimeCapsule<P> capsule) throws Exception;
}
