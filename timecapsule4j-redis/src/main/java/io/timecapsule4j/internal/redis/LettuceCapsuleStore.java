package io.timecapsule4j.internal.redis;

import io.lettuce.core.Limit;
import io.lettuce.core.Range;
import io.lettuce.core.RedisException;
import io.lettuce.core.ScoredValue;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.api.sync.RedisCommands;
import io.timecapsule4j.core.CapsuleCodec;
import io.timecapsule4j.core.CapsuleStoreException;
import io.timecapsule4j.core.RetrySettings;
import io.timecapsule4j.core.ScoredMember;
import io.timecapsule4j.internal.AbstractCapsuleStore;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Capsule store over a plain Lettuce connection, for applications that do not use Spring Data.
 *
 * <p>Lettuce connections are thread-safe, so a single connection can back every digger of the
 * process. The connection is not closed by this store.
 */
public class LettuceCapsuleStore<P> extends AbstractCapsuleStore<P> {

    private final StatefulRedisConnection<String, String> connection;

    public LettuceCapsuleStore(String key, StatefulRedisConnection<String, String> connection, CapsuleCodec<P> codec) {
        this(key, connection, codec, RetrySettings.defaults());
    }

    public LettuceCapsuleStore(String key,
                               StatefulRedisConnection<String, String> connection,
                               CapsuleCodec<P> codec,
                               RetrySettings retrySettings) {
        super(key, codec, retrySettings);
        this.connection = Objects.requireNonNull(connection, "connection must not be null");
    }

    @Override
    public String type() {
        return "Lettuce";
    }

    @Override
    protected void insert(long score, String member) {
        call("ZADD", () -> commands().zadd(key(), (double) score, member));
    }

    @Override
    protected boolean hasMemberWithin(long minScore, long maxScore) {
        List<String> members = call("ZRANGEBYSCORE",
                () -> commands().zrangebyscore(key(), Range.create(minScore, maxScore), Limit.create(0, 1)));
        return members != null && !members.isEmpty();
    }

    @Override
    protected Optional<ScoredMember> popMin() {
        ScoredValue<String> head = call("ZPOPMIN", () -> commands().zpopmin(key()));
        if (head == null || !head.hasValue()) {
            return Optional.empty();
        }
        return Optional.of(new ScoredMember((long) head.getScore(), head.getValue()));
    }

    @Override
    protected void remove(String member) {
        call("ZREM", () -> commands().zrem(key(), member));
    }

    @Override
    protected void removeAll() {
        call("DEL", () -> commands().del(key()));
    }

    private RedisCommands<String, String> commands() {
        return connection.sync();
    }

    private <T> T call(String command, Supplier<T> action) {
        try {
            return action.get();
        } catch (RedisException e) {
            throw new CapsuleStoreException(command + " " + key() + " failed: " + e.getMessage(), e);
        }
    }
}
