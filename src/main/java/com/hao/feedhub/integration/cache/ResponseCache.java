package com.hao.feedhub.integration.cache;

/**
 * 响应缓存存储接口
 * <p>
 * 职责：
 * 带 TTL 的键值存储，支持按前缀失效。Redis 实现与本地实现可互相替换。
 * <p>
 * 约定：
 * 1. 过期判断在读取时按墙钟比较，读到过期条目即删除，不依赖后台清理线程。
 * 2. invalidate(prefix) 只删除键以 prefix 开头的条目。
 */
public interface ResponseCache {

    /**
     * 读取未过期的条目
     *
     * @param key 缓存键
     * @return 条目，不存在或已过期时返回 null
     */
    CacheEntry get(String key);

    /**
     * 写入条目，expiresAt 由实现按 ttl 计算
     *
     * @param key 缓存键
     * @param entry 条目
     * @param ttlSeconds 存活秒数
     */
    void set(String key, CacheEntry entry, long ttlSeconds);

    /**
     * 删除键以 prefix 开头的全部条目
     *
     * @param prefix 键前缀
     * @return 删除条目数
     */
    long invalidate(String prefix);

    /**
     * 清空全部响应缓存
     */
    void clear();

    String name();
}
