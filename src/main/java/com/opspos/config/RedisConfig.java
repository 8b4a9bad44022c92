package com.opspos.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.GenericJackson2JsonRedisSerializer;
import org.springframework.data.redis.serializer.StringRedisSerializer;

/**
 * Redis configuration for the relay host's shared presence store.
 *
 * <p>All keys are prefixed with "pos:" because the relay host's Redis can be shared
 * with other store-level services.
 *
 * <p>Key schema:
 * <pre>
 *   pos:terminal:presence:{terminalId} → last heartbeat instant (TTL = miss threshold x relay interval)
 * </pre>
 */
@Configuration
public class RedisConfig {

    public static final String KEY_PREFIX = "pos:";

    public static final String KEY_PREFIX_TERMINAL_PRESENCE = KEY_PREFIX + "terminal:presence:";

    @Bean
    public RedisTemplate<String, Object> redisTemplate(RedisConnectionFactory redisConnectionFactory) {
        RedisTemplate<String, Object> redisTemplate = new RedisTemplate<>();
        redisTemplate.setConnectionFactory(redisConnectionFactory);

        StringRedisSerializer stringRedisSerializer = new StringRedisSerializer();
        GenericJackson2JsonRedisSerializer jsonRedisSerializer = new GenericJackson2JsonRedisSerializer();

        redisTemplate.setKeySerializer(stringRedisSerializer);
        redisTemplate.setValueSerializer(jsonRedisSerializer);
        redisTemplate.setHashKeySerializer(stringRedisSerializer);
        redisTemplate.setHashValueSerializer(jsonRedisSerializer);

        return redisTemplate;
    }
}
