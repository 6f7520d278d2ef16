package io.timecapsule4j.core;

import java.util.Objects;

/**
 * A buried payload plus its burial and dig-out timestamps.
 *
 * <p>Instances are immutable except for the memoized transport string. Once a capsule has been
 * encoded (or was produced by decoding), the cached string is what identifies it as a member of the
 * store, so {@link #dugOut(long)} hands the cache over to the copy it creates.
 *
 * @param <P> payload type
 */
public final class TimeCapsule<P> {

    private final P payload;
    private final long buriedAt;
    private final long dugOutAt;

    private volatile String encoded;

    public TimeCapsule(P payload, long buriedAt) {
        this(payload, buriedAt, 0L, null);
    }

    TimeCapsule(P payload, long buriedAt, long dugOutAt, String encoded) {
        this.payload = payload;
        this.buriedAt = buriedAt;
        this.dugOutAt = dugOutAt;
        this.encoded = encoded;
    }

    public P payload() {
        return payload;
    }

    /**
     * Epoch millis at which the capsule was buried.
     */
    public long buriedAt() {
        return buriedAt;
    }

    /**
     * Epoch millis at which the capsule was judged due, or 0 if it was never dug.
     */
    public long dugOutAt() {
        return dugOutAt;
    }

    public boolean isDugOut() {
        return dugOutAt > 0;
    }

    /**
     * Returns a copy marked as dug out at {@code dugOutAt}, keeping the original member identity.
     */
    public TimeCapsule<P> dugOut(long dugOutAt) {
        if (dugOutAt <= 0) {
            throw new IllegalArgumentException("dugOutAt must be positive");
        }
        return new TimeCapsule<>(payload, buriedAt, dugOutAt, encoded);
    }

    String cachedEncoding() {
        return encoded;
    }

    void cacheEncoding(String encoded) {
        this.encoded = encoded;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TimeCapsule<?> other)) return false;
        return buriedAt == other.buriedAt
                && dugOutAt == other.dugOutAt
                && Objects.equals(payload, other.payload);
    }

    @Override
    public int hashCode() {
        return Objects.hash(payload, buriedAt, dugOutAt);
    }

    @Override
    public String toString() {
        return "TimeCapsule{payload=" + payload + ", buriedAt=" + buriedAt + ", dugOutAt=" + dugOutAt + "}";
    }
}
