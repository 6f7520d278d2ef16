package io.timecapsule4j.internal;

import io.timecapsule4j.CapsuleStore;
import io.timecapsule4j.core.CapsuleCodec;
import io.timecapsule4j.core.RetrySettings;
import io.timecapsule4j.core.ScoredMember;
import io.timecapsule4j.core.TimeCapsule;
import io.timecapsule4j.utils.Attempts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bury / dig / destroy protocol shared by every backend.
 *
 * <p>Subclasses only provide the sorted-set primitives:
 * <ul>
 *   <li>{@link #insert}: {@code ZADD key score member}</li>
 *   <li>{@link #hasMemberWithin}: {@code ZRANGEBYSCORE key min max LIMIT 0 1}</li>
 *   <li>{@link #popMin}: {@code ZPOPMIN key 1}, the only atomic step of a dig</li>
 *   <li>{@link #remove}: {@code ZREM key member}</li>
 *   <li>{@link #removeAll}: {@code DEL key}</li>
 * </ul>
 * Primitives must report "nothing there" as an empty result rather than an error, and wrap transport
 * failures in {@link io.timecapsule4j.core.CapsuleStoreException}.
 *
 * <p>Dig flow:
 * <pre>
 *   ZRANGEBYSCORE key 0 now ── none ──▶ empty
 *            │
 *        ZPOPMIN key 1 ──── none ──▶ empty (another digger won)
 *            │
 *      score &lt;= now ? ── no ──▶ ZADD key score member (original score), empty
 *            │ yes
 *     decode, dugOutAt = now
 * </pre>
 * The existence check and the pop are separate commands, so the popped entry can be one that is not
 * due yet. Two diggers requeueing the same entry concurrently may briefly leave a duplicate.
 */
public abstract class AbstractCapsuleStore<P> implements CapsuleStore<P> {
    private static final Logger log = LoggerFactory.getLogger(AbstractCapsuleStore.class);

    private final String key;
    private final CapsuleCodec<P> codec;
    private final RetrySettings retrySettings;
    private final AtomicLong lastBuriedAt = new AtomicLong();

    protected AbstractCapsuleStore(String key, CapsuleCodec<P> codec, RetrySettings retrySettings) {
        Objects.requireNonNull(key, "key must not be null");
        if (key.isBlank()) {
            throw new IllegalArgumentException("key must not be blank");
        }
        this.key = key;
        this.codec = Objects.requireNonNull(codec, "codec must not be null");
        this.retrySettings = retrySettings != null ? retrySettings : RetrySettings.defaults();
    }

    protected abstract void insert(long score, String member);

    protected abstract boolean hasMemberWithin(long minScore, long maxScore);

    protected abstract Optional<ScoredMember> popMin();

    protected abstract void remove(String member);

    protected abstract void removeAll();

    public String key() {
        return key;
    }

    public CapsuleCodec<P> codec() {
        return codec;
    }

    public RetrySettings retrySettings() {
        return retrySettings;
    }

    @Override
    public void buryFor(P payload, Duration duration) {
        Objects.requireNonNull(duration, "duration must not be null");
        buryUntil(payload, nowMillis() + duration.toMillis());
    }

    @Override
    public void buryUntil(P payload, long dueTimeMillis) {
        TimeCapsule<P> capsule = new TimeCapsule<>(payload, nextBuriedAt());
        insert(dueTimeMillis, codec.encode(capsule));
        log.debug("TimeCapsule buried store={} key={} dueAt={}", type(), key, dueTimeMillis);
    }

    @Override
    public Optional<TimeCapsule<P>> dig() {
        long now = nowMillis();

        if (!hasMemberWithin(0L, now)) {
            return Optional.empty();
        }

        Optional<ScoredMember> popped = popMin();
        if (popped.isEmpty()) {
            return Optional.empty();
        }

        ScoredMember head = popped.get();
        if (head.score() > now) {
            log.debug("TimeCapsule popped before due, requeueing store={} key={} score={} now={}",
                    type(), key, head.score(), now);
            Attempts.withFixedDelay("requeue capsule at score " + head.score(), retrySettings,
                    attempt -> insert(head.score(), head.member()));
            return Optional.empty();
        }

        TimeCapsule<P> capsule = codec.decode(head.member());
        return Optional.of(capsule.dugOut(now));
    }

    @Override
    public void destroy(TimeCapsule<P> capsule) {
        Objects.requireNonNull(capsule, "capsule must not be null");
        String member = codec.encode(capsule);
        Attempts.withFixedDelay("destroy capsule", retrySettings, attempt -> remove(member));
    }

    @Override
    public void destroyAll() {
        removeAll();
        log.debug("TimeCapsule store cleared store={} key={}", type(), key);
    }

    /**
     * Burial timestamps are strictly increasing per store so that identical payloads buried within
     * the same millisecond still encode to distinct members.
     */
    private long nextBuriedAt() {
        long now = nowMillis();
        return lastBuriedAt.updateAndGet(last -> Math.max(now, last + 1));
    }

    /**
     * Current time source in epoch millis (useful for tests).
     */
    protected long nowMillis() {
        return System.currentTimeMillis();
    }
}
