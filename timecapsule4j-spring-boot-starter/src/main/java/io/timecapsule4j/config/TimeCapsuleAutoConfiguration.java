package io.timecapsule4j.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.timecapsule4j.CapsuleHandler;
import io.timecapsule4j.CapsuleStore;
import io.timecapsule4j.Digger;
import io.timecapsule4j.core.CapsuleCodec;
import io.timecapsule4j.internal.PollingDigger;
import io.timecapsule4j.internal.redis.RedisTemplateCapsuleStore;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.condition.ConditionalOnSingleCandidate;
import org.springframework.boot.autoconfigure.data.redis.RedisAutoConfiguration;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Spring Boot auto-configuration entrypoint for the capsule store and digger.
 *
 * <p>The payload type comes from the application's single {@link CapsuleHandler} bean. Without one,
 * only {@link TimeCapsuleProperties} is registered.
 */
@AutoConfiguration(after = {RedisAutoConfiguration.class, JacksonAutoConfiguration.class})
@ConditionalOnClass({Digger.class, StringRedisTemplate.class})
@EnableConfigurationProperties(TimeCapsuleProperties.class)
@ConditionalOnProperty(prefix = "timecapsule", name = "enabled", havingValue = "true", matchIfMissing = true)
public class TimeCapsuleAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnSingleCandidate(CapsuleHandler.class)
    @ConditionalOnBean(StringRedisTemplate.class)
    public CapsuleStore<?> capsuleStore(TimeCapsuleProperties props,
                                        StringRedisTemplate redisTemplate,
                                        ObjectMapper objectMapper,
                                        CapsuleHandler<?> handler) {
        return redisStore(props, redisTemplate, objectMapper, handler.payloadType());
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnSingleCandidate(CapsuleHandler.class)
    @ConditionalOnBean(CapsuleStore.class)
    public Digger<?> digger(TimeCapsuleProperties props, CapsuleStore<?> store, CapsuleHandler<?> handler) {
        return pollingDigger(props, store, handler);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(Digger.class)
    public DiggerLifecycle diggerLifecycle(Digger<?> digger, TimeCapsuleProperties props) {
        return new DiggerLifecycle(digger, props.isAutoStartup());
    }

    private static <P> CapsuleStore<P> redisStore(TimeCapsuleProperties props,
                                                  StringRedisTemplate redisTemplate,
                                                  ObjectMapper objectMapper,
                                                  Class<P> payloadType) {
        CapsuleCodec<P> codec = new CapsuleCodec<>(objectMapper, payloadType);
        return new RedisTemplateCapsuleStore<>(props.getKey(), redisTemplate, codec, props.toRetrySettings());
    }

    // the store bean was built from this handler's payload type
    @SuppressWarnings("unchecked")
    private static <P> Digger<P> pollingDigger(TimeCapsuleProperties props,
                                               CapsuleStore<?> store,
                                               CapsuleHandler<P> handler) {
        PollingDigger<P> digger = new PollingDigger<>((CapsuleStore<P>) store, props.getDigInterval(),
                props.toDiggerOptions());
        digger.setHandler(handler);
        return digger;
    }
}
