package com.hao.feedhub.integration.cache;

import com.hao.feedhub.common.enums.RedisKeysEnum;
import com.hao.feedhub.common.util.JsonUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Redis 响应缓存
 *
 * 类职责：
 * 以 JSON 字符串形式把响应缓存条目存入 Redis，多实例共享缓存。
 *
 * 核心实现思路：
 * - 写入使用 SETEX，Redis 自身负责过期回收；读取时再按 expiresAt 校验一次。
 * - 前缀失效使用 SCAN MATCH prefix* 分批遍历后 DEL，不使用阻塞的 KEYS。
 * - 异常不在此处处理，由 FailoverResponseCache 统一降级。
 */
@Slf4j
public class RedisResponseCache implements ResponseCache {

    private static final int SCAN_BATCH = 500;

    private final StringRedisTemplate stringRedisTemplate;
    private final Clock clock;

    public RedisResponseCache(StringRedisTemplate stringRedisTemplate, Clock clock) {
        this.stringRedisTemplate = stringRedisTemplate;
        this.clock = clock;
    }

    @Override
    public CacheEntry get(String key) {
        String json = stringRedisTemplate.opsForValue().get(key);
        if (json == null) {
            return null;
        }
        CacheEntry entry = JsonUtil.toBean(json, CacheEntry.class);
        if (entry == null || entry.expiredAt(clock.millis())) {
            stringRedisTemplate.delete(key);
            return null;
        }
        return entry;
    }

    @Override
    public void set(String key, CacheEntry entry, long ttlSeconds) {
        entry.setKey(key);
        entry.setExpiresAt(clock.millis() + ttlSeconds * 1000L);
        String json = JsonUtil.toJson(entry);
        if (json == null) {
            return;
        }
        stringRedisTemplate.opsForValue().set(key, json, Duration.ofSeconds(ttlSeconds));
    }

    /**
     * 按前缀批量删除
     *
     * 实现逻辑：
     * 1. SCAN MATCH 遍历匹配键（前缀中的通配字符先转义）。
     * 2. 再用 startsWith 二次确认，避免误删。
     * 3. 批量 DEL。
     */
    @Override
    public long invalidate(String prefix) {
        ScanOptions options = ScanOptions.scanOptions()
                .match(escapeGlob(prefix) + "*")
                .count(SCAN_BATCH)
                .build();
        List<String> keys = new ArrayList<>();
        try (Cursor<String> cursor = stringRedisTemplate.scan(options)) {
            while (cursor.hasNext()) {
                String key = cursor.next();
                if (key.startsWith(prefix)) {
                    keys.add(key);
                }
            }
        }
        if (keys.isEmpty()) {
            return 0;
        }
        Long deleted = stringRedisTemplate.delete(keys);
        log.debug("Redis缓存前缀失效|Redis_cache_invalidated,prefix={},deleted={}", prefix, deleted);
        return deleted == null ? 0 : deleted;
    }

    @Override
    public void clear() {
        invalidate(RedisKeysEnum.API_CACHE_PREFIX.getKey());
    }

    @Override
    public String name() {
        return "redis";
    }

    static String escapeGlob(String raw) {
        StringBuilder sb = new StringBuilder(raw.length() + 8);
        for (char c : raw.toCharArray()) {
            if (c == '*' || c == '?' || c == '[' || c == ']' || c == '\\') {
                sb.append('\\');
            }
            sb.append(c);
        }
        return sb.toString();
    }
}
