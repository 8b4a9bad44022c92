package com.opspos.repository.redis;

import com.opspos.config.RedisConfig;
import java.time.Duration;
import java.time.Instant;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Repository;

/**
 * Terminal presence keys on the relay host's Redis. A key exists while its terminal keeps
 * heartbeating; it expires on its own once the terminal stops.
 */
@Repository
public class TerminalPresenceRedisRepository {

    private final RedisTemplate<String, Object> redisTemplate;

    public TerminalPresenceRedisRepository(RedisTemplate<String, Object> redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    /**
     * Refreshes the presence key. The previous value comes back from the same GETSET that writes
     * the new one, so of two concurrent touches after an absence only one reports first contact.
     *
     * @return true if the key did not exist before (the terminal just reappeared)
     */
    public boolean touch(String terminalId, Instant seenAt, Duration ttl) {
        String key = RedisConfig.KEY_PREFIX_TERMINAL_PRESENCE + terminalId;
        Object previous = redisTemplate.opsForValue().getAndSet(key, seenAt.toString());
        redisTemplate.expire(key, ttl);
        return previous == null;
    }

    public boolean isPresent(String terminalId) {
        return Boolean.TRUE.equals(redisTemplate.hasKey(RedisConfig.KEY_PREFIX_TERMINAL_PRESENCE + terminalId));
    }
}
