package com.hao.feedhub.integration.cache;

import com.hao.feedhub.common.util.JsonUtil;
import com.hao.feedhub.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Redis 响应缓存测试
 */
public class RedisResponseCacheTest {

    private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");

    private StringRedisTemplate template;
    private ValueOperations<String, String> valueOps;
    private RedisResponseCache cache;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        template = mock(StringRedisTemplate.class);
        valueOps = mock(ValueOperations.class);
        when(template.opsForValue()).thenReturn(valueOps);
        cache = new RedisResponseCache(template, new MutableClock(NOW));
    }

    @Test
    @DisplayName("写入使用 SETEX 语义")
    void testSet_WithTtl() {
        CacheEntry entry = new CacheEntry();
        entry.setContent("{}");
        entry.setEtag("abc");

        cache.set("api:/api/jobs/list", entry, 180);

        verify(valueOps).set(eq("api:/api/jobs/list"), anyString(), eq(Duration.ofSeconds(180)));
        assertEquals(NOW.toEpochMilli() + 180_000L, entry.getExpiresAt());
    }

    @Test
    @DisplayName("读取反序列化条目")
    void testGet_Hit() {
        CacheEntry stored = new CacheEntry("api:/x", "{\"ok\":true}", "abc", NOW.toEpochMilli() + 1000, NOW.toEpochMilli());
        when(valueOps.get("api:/x")).thenReturn(JsonUtil.toJson(stored));

        CacheEntry entry = cache.get("api:/x");

        assertEquals("{\"ok\":true}", entry.getContent());
        assertEquals("abc", entry.getEtag());
    }

    @Test
    @DisplayName("损坏的缓存值视为未命中并删除")
    void testGet_Corrupted() {
        when(valueOps.get("api:/x")).thenReturn("not-json");

        assertNull(cache.get("api:/x"));
        verify(template).delete("api:/x");
    }

    @Test
    @DisplayName("前缀中的通配符被转义")
    void testEscapeGlob() {
        assertEquals("api:/search\\?q=a\\*b\\[1\\]", RedisResponseCache.escapeGlob("api:/search?q=a*b[1]"));
    }
}
