package com.portfoliotracker.engine.infrastructure;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RedisResultCacheTest {

    @Mock
    private RedisTemplate<String, String> redisTemplate;

    @Mock
    private ValueOperations<String, String> valueOperations;

    private RedisResultCache cache;

    @BeforeEach
    void setUp() {
        cache = new RedisResultCache(redisTemplate, new ObjectMapper());
    }

    @Test
    void testSet_WritesJsonWithTtl() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);

        cache.set("sector:THYAO", SectorInfo.builder()
                .sector("Industrials").industry("Airlines").source("configuration").build(), Duration.ofHours(24));

        verify(valueOperations).set(eq("portfolio:cache:sector:THYAO"),
                contains("\"sector\":\"Industrials\""), eq(Duration.ofHours(24)));
    }

    @Test
    void testGet_ReadsJson() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.get("portfolio:cache:sector:THYAO"))
                .thenReturn("{\"sector\":\"Industrials\",\"industry\":\"Airlines\",\"source\":\"configuration\"}");

        Optional<SectorInfo> info = cache.get("sector:THYAO", SectorInfo.class);

        assertTrue(info.isPresent());
        assertEquals("Airlines", info.get().getIndustry());
    }

    @Test
    void testGet_UnreadableEntryIsDiscarded() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.get(anyString())).thenReturn("not json");

        assertTrue(cache.get("sector:THYAO", SectorInfo.class).isEmpty());
        verify(redisTemplate).delete("portfolio:cache:sector:THYAO");
    }

    @Test
    void testSet_NonPositiveTtlSkipsWrite() {
        cache.set("dashboard_metrics", "payload", Duration.ZERO);

        verify(redisTemplate, never()).opsForValue();
        verify(valueOperations, never()).set(anyString(), anyString(), any(Duration.class));
    }

    @Test
    void testTtl_FromKeyExpiry() {
        when(redisTemplate.getExpire("portfolio:cache:dashboard_metrics", TimeUnit.MILLISECONDS)).thenReturn(12_000L);
        when(redisTemplate.getExpire("portfolio:cache:missing", TimeUnit.MILLISECONDS)).thenReturn(-2L);

        assertEquals(Optional.of(Duration.ofSeconds(12)), cache.ttl("dashboard_metrics"));
        assertTrue(cache.ttl("missing").isEmpty());
    }
}
