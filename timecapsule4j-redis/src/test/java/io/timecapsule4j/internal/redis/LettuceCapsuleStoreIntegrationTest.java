package io.timecapsule4j.internal.redis;

import io.lettuce.core.RedisClient;
import io.lettuce.core.ScoredValue;
import io.lettuce.core.api.StatefulRedisConnection;
import io.timecapsule4j.core.ScoredMember;
import io.timecapsule4j.internal.AbstractCapsuleStore;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.List;
import java.util.stream.Collectors;

@Testcontainers(disabledWithoutDocker = true)
class LettuceCapsuleStoreIntegrationTest extends AbstractRedisCapsuleStoreIntegrationTest {

    @Container
    static final GenericContainer<?> REDIS = new GenericContainer<>("redis:7-alpine").withExposedPorts(6379);

    private static RedisClient client;
    private static StatefulRedisConnection<String, String> connection;

    @BeforeAll
    static void connect() {
        client = RedisClient.create("redis://" + REDIS.getHost() + ":" + REDIS.getMappedPort(6379));
        connection = client.connect();
    }

    @AfterAll
    static void disconnect() {
        connection.close();
        client.shutdown();
    }

    @Override
    AbstractCapsuleStore<String> store() {
        return new LettuceCapsuleStore<>(KEY, connection, codec);
    }

    @Override
    AbstractCapsuleStore<String> storeClaimingDue() {
        return new LettuceCapsuleStore<>(KEY, connection, codec) {
            @Override
            protected boolean hasMemberWithin(long minScore, long maxScore) {
                return true;
            }
        };
    }

    @Override
    List<ScoredMember> rawEntries() {
        List<ScoredValue<String>> values = connection.sync().zrangeWithScores(KEY, 0, -1);
        return values.stream()
                .map(v -> new ScoredMember((long) v.getScore(), v.getValue()))
                .collect(Collectors.toList());
    }

    @Override
    void rawInsert(long score, String member) {
        connection.sync().zadd(KEY, (double) score, member);
    }
}
