package io.timecapsule4j;

import io.timecapsule4j.core.TimeCapsule;

import java.time.Duration;
import java.util.Optional;

/**
 * Capsule storage over a sorted, score-addressable collection.
 *
 * <p>Every entry is a pair (score = due time in epoch millis, member = encoded capsule). The store's
 * atomic pop is the only synchronization point between concurrent diggers: each entry is handed to
 * at most one {@link #dig()} caller per pop.
 *
 * <p>All operations may block on I/O and report failures as unchecked
 * {@link io.timecapsule4j.core.TimeCapsuleException}s.
 *
 * @param <P> payload type
 */
public interface CapsuleStore<P> {

    /**
     * Name of the backend adapter, for diagnostics only.
     */
    String type();

    /**
     * Bury {@code payload} so that it becomes due after {@code duration}.
     */
    void buryFor(P payload, Duration duration);

    /**
     * Bury {@code payload} so that it becomes due at {@code dueTimeMillis} (epoch millis).
     * Each call inserts a new entry; identical payloads are told apart by their burial time.
     */
    void buryUntil(P payload, long dueTimeMillis);

    /**
     * Pop the earliest due capsule.
     *
     * <p>Returns empty when nothing is due, when another digger won the pop, or when the popped entry
     * turned out not to be due yet (it is then put back with its original score).
     *
     * @throws io.timecapsule4j.core.CapsuleDecodeException   if the popped member is malformed (it is dropped)
     * @throws io.timecapsule4j.core.RetryExhaustedException  if a premature pop could not be put back
     * @throws io.timecapsule4j.core.CapsuleStoreException    on transport failure
     */
    Optional<TimeCapsule<P>> dig();

    /**
     * Remove {@code capsule}'s member regardless of its score. Removing an absent member succeeds.
     */
    void destroy(TimeCapsule<P> capsule);

    /**
     * Remove every entry under this store's key.
     */
    void destroyAll();
}
