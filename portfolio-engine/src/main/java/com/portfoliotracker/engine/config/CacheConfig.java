package com.portfoliotracker.engine.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.portfoliotracker.engine.infrastructure.InMemoryResultCache;
import com.portfoliotracker.engine.infrastructure.RedisResultCache;
import com.portfoliotracker.engine.infrastructure.ResultCache;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.StringRedisSerializer;

import java.time.Clock;

/**
 * Result cache selection. {@code portfolio.cache.type=redis} shares cached results
 * through Redis; anything else keeps them in process.
 */
@Configuration
public class CacheConfig {

    @Bean
    @ConditionalOnProperty(name = "portfolio.cache.type", havingValue = "memory", matchIfMissing = true)
    public ResultCache inMemoryResultCache(Clock clock) {
        return new InMemoryResultCache(clock);
    }

    @Configuration
    @ConditionalOnProperty(name = "portfolio.cache.type", havingValue = "redis")
    static class RedisCacheConfig {

        @Bean
        public RedisTemplate<String, String> resultCacheRedisTemplate(RedisConnectionFactory connectionFactory) {
            RedisTemplate<String, String> template = new RedisTemplate<>();
            template.setConnectionFactory(connectionFactory);

            // Values are JSON documents written by the cache itself
            template.setKeySerializer(new StringRedisSerializer());
            template.setValueSerializer(new StringRedisSerializer());

            template.afterPropertiesSet();
            return template;
        }

        @Bean
        public ResultCache redisResultCache(RedisTemplate<String, String> resultCacheRedisTemplate,
                ObjectMapper objectMapper) {
            return new RedisResultCache(resultCacheRedisTemplate, objectMapper);
        }
    }
}
