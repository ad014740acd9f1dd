package com.portfoliotracker.engine.infrastructure;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * {@link ResultCache} backed by Redis. Values are stored as JSON and expire through Redis key
 * expiry. A value that cannot be read back is treated as a miss.
 */
@RequiredArgsConstructor
@Slf4j
public class RedisResultCache implements ResultCache {

    private static final String KEY_PREFIX = "portfolio:cache:";

    private final RedisTemplate<String, String> redisTemplate;
    private final ObjectMapper objectMapper;

    @Override
    public <T> Optional<T> get(String key, Class<T> type) {
        String json = redisTemplate.opsForValue().get(KEY_PREFIX + key);
        if (json == null) {
            return Optional.empty();
        }

        try {
            return Optional.of(objectMapper.readValue(json, type));
        } catch (JsonProcessingException e) {
            log.warn("Discarding unreadable cache entry {}: {}", key, e.getMessage());
            redisTemplate.delete(KEY_PREFIX + key);
            return Optional.empty();
        }
    }

    @Override
    public void set(String key, Object value, Duration ttl) {
        if (value == null || ttl.isNegative() || ttl.isZero()) {
            return;
        }

        try {
            redisTemplate.opsForValue().set(KEY_PREFIX + key, objectMapper.writeValueAsString(value), ttl);
        } catch (JsonProcessingException e) {
            log.warn("Not caching {}: value could not be serialized: {}", key, e.getMessage());
        }
    }

    @Override
    public Optional<Duration> ttl(String key) {
        Long millis = redisTemplate.getExpire(KEY_PREFIX + key, TimeUnit.MILLISECONDS);
        if (millis == null || millis <= 0) {
            return Optional.empty();
        }
        return Optional.of(Duration.ofMillis(millis));
    }

    @Override
    public void evict(String key) {
        redisTemplate.delete(KEY_PREFIX + key);
    }
}
