package com.ridematch.shared.store;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.data.redis.RedisAutoConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Registers a Redis-backed EphemeralStore whenever spring-data-redis is on the
 * classpath. Services that include shared-lib get the bean without component-scan changes.
 */
@AutoConfiguration(after = RedisAutoConfiguration.class)
@ConditionalOnClass(StringRedisTemplate.class)
public class EphemeralStoreAutoConfiguration {

    @Bean
    @ConditionalOnBean(StringRedisTemplate.class)
    @ConditionalOnMissingBean(EphemeralStore.class)
    public EphemeralStore ephemeralStore(StringRedisTemplate redisTemplate) {
        return new RedisEphemeralStore(redisTemplate);
    }
}
