package io.timecapsule4j.internal.redis;

import io.timecapsule4j.core.CapsuleCodec;
import io.timecapsule4j.core.CapsuleStoreException;
import io.timecapsule4j.core.RetrySettings;
import io.timecapsule4j.core.ScoredMember;
import io.timecapsule4j.internal.AbstractCapsuleStore;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisOperations;
import org.springframework.data.redis.core.ZSetOperations;

import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Capsule store over Spring Data Redis.
 *
 * <p>Usually constructed with a {@code StringRedisTemplate}; the template (and its connection
 * factory) is owned by the caller and may be shared by any number of stores and diggers.
 */
public class RedisTemplateCapsuleStore<P> extends AbstractCapsuleStore<P> {

    private final RedisOperations<String, String> redisOperations;

    public RedisTemplateCapsuleStore(String key, RedisOperations<String, String> redisOperations, CapsuleCodec<P> codec) {
        this(key, redisOperations, codec, RetrySettings.defaults());
    }

    public RedisTemplateCapsuleStore(String key,
                                     RedisOperations<String, String> redisOperations,
                                     CapsuleCodec<P> codec,
                                     RetrySettings retrySettings) {
        super(key, codec, retrySettings);
        this.redisOperations = Objects.requireNonNull(redisOperations, "redisOperations must not be null");
    }

    @Override
    public String type() {
        return "RedisTemplate";
    }

    @Override
    protected void insert(long score, String member) {
        call("ZADD", () -> zSet().add(key(), member, score));
    }

    @Override
    protected boolean hasMemberWithin(long minScore, long maxScore) {
        Set<String> members = call("ZRANGEBYSCORE", () -> zSet().rangeByScore(key(), minScore, maxScore, 0, 1));
        return members != null && !members.isEmpty();
    }

    @Override
    protected Optional<ScoredMember> popMin() {
        ZSetOperations.TypedTuple<String> head = call("ZPOPMIN", () -> zSet().popMin(key()));
        if (head == null || head.getValue() == null || head.getScore() == null) {
            return Optional.empty();
        }
        return Optional.of(new ScoredMember(head.getScore().longValue(), head.getValue()));
    }

    @Override
    protected void remove(String member) {
        call("ZREM", () -> zSet().remove(key(), member));
    }

    @Override
    protected void removeAll() {
        call("DEL", () -> redisOperations.delete(key()));
    }

    private ZSetOperations<String, String> zSet() {
        return redisOperations.opsForZSet();
    }

    private <T> T call(String command, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            throw new CapsuleStoreException(command + " " + key() + " failed: " + e.getMessage(), e);
        }
    }
}
