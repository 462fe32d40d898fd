package com.hao.feedhub.integration.ratelimit;

import com.github.benmanes.caffeine.cache.Cache;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;

/**
 * 单机限流后端
 *
 * 类职责：
 * 为每个客户端在本地内存维护固定窗口计数器，作为 Redis 不可用时的兜底后端。
 *
 * 设计目的：
 * 1. 零网络开销，单进程部署时直接使用。
 * 2. 与 Redis 后端保持同样的窗口桶算法，降级前后行为一致。
 *
 * 核心实现思路：
 * - 使用 Caffeine 存放计数器，expireAfterAccess + maximumSize 回收沉默客户端，防止随机 IP 撑爆内存。
 * - 计数器内部加锁，窗口切换时重置计数。
 */
@Slf4j
public class LocalRateLimitBackend implements RateLimitBackend {

    private final Cache<String, WindowCounter> counters;
    private final Clock clock;

    public LocalRateLimitBackend(Cache<String, WindowCounter> counters, Clock clock) {
        this.counters = counters;
        this.clock = clock;
    }

    /**
     * 尝试获取访问许可
     *
     * 实现逻辑：
     * 1. 从 Caffeine 获取或创建客户端计数器。
     * 2. 在计数器锁内完成窗口校准与计数。
     *
     * @param clientKey 客户端键
     * @param limit 限制次数
     * @param windowSeconds 时间窗口（秒）
     * @return 判定结果
     */
    @Override
    public RateLimitDecision tryAcquire(String clientKey, int limit, int windowSeconds) {
        long now = clock.millis();
        long bucket = FixedWindow.bucketOf(now, windowSeconds);

        // Caffeine 的 get 是原子的“获取或创建”
        WindowCounter counter = counters.get(clientKey, k -> new WindowCounter());
        boolean allowed = counter.tryIncrement(bucket, limit);
        if (!allowed) {
            log.debug("本地窗口超限|Local_window_exceeded,client={},limit={}", clientKey, limit);
        }
        return new RateLimitDecision(allowed, limit, windowSeconds, FixedWindow.retryAfterSeconds(now, windowSeconds));
    }

    @Override
    public String name() {
        return "memory";
    }

    /**
     * 单客户端窗口计数器
     */
    public static final class WindowCounter {

        private long bucket = Long.MIN_VALUE;
        private int count;

        synchronized boolean tryIncrement(long currentBucket, int limit) {
            if (currentBucket != bucket) {
                bucket = currentBucket;
                count = 0;
            }
            if (count >= limit) {
                return false;
            }
            count++;
            return true;
        }
    }
}
