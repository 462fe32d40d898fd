package com.hao.feedhub.integration.cache;

import com.github.benmanes.caffeine.cache.Cache;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;

/**
 * 本地响应缓存
 *
 * 类职责：
 * 基于 Caffeine 的进程内响应缓存，Redis 不可用时的兜底实现。
 *
 * 核心实现思路：
 * - Caffeine 负责容量上限，条目 TTL 由 expiresAt 在读取时判断。
 * - 前缀失效直接遍历 asMap 视图，ConcurrentMap 的弱一致迭代不会抛并发修改异常。
 */
@Slf4j
public class LocalResponseCache implements ResponseCache {

    private final Cache<String, CacheEntry> store;
    private final Clock clock;

    public LocalResponseCache(Cache<String, CacheEntry> store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    @Override
    public CacheEntry get(String key) {
        CacheEntry entry = store.getIfPresent(key);
        if (entry == null) {
            return null;
        }
        if (entry.expiredAt(clock.millis())) {
            // 读到过期条目时顺手清理
            store.asMap().remove(key, entry);
            return null;
        }
        return entry;
    }

    @Override
    public void set(String key, CacheEntry entry, long ttlSeconds) {
        entry.setKey(key);
        entry.setExpiresAt(clock.millis() + ttlSeconds * 1000L);
        store.put(key, entry);
    }

    @Override
    public long invalidate(String prefix) {
        long removed = 0;
        for (String key : store.asMap().keySet()) {
            if (key.startsWith(prefix) && store.asMap().remove(key) != null) {
                removed++;
            }
        }
        log.debug("本地缓存前缀失效|Local_cache_invalidated,prefix={},removed={}", prefix, removed);
        return removed;
    }

    @Override
    public void clear() {
        store.invalidateAll();
    }

    @Override
    public String name() {
        return "memory";
    }
}
