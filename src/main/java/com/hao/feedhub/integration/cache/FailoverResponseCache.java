package com.hao.feedhub.integration.cache;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

/**
 * 带降级的响应缓存
 *
 * 类职责：
 * 优先使用共享缓存（Redis），一旦出现运行期异常就切换到本地缓存并只告警一次。
 *
 * 为什么需要该类：
 * 缓存是加速手段而不是依赖，Redis 故障绝不能把异常传播到业务接口。
 *
 * 核心实现思路：
 * - shared 为 null 表示启动探测失败，直接使用本地缓存。
 * - 降级后不再尝试恢复，直到进程重启。
 */
@Slf4j
public class FailoverResponseCache implements ResponseCache {

    private final ResponseCache shared;
    private final ResponseCache local;
    private final AtomicBoolean degraded = new AtomicBoolean(false);

    public FailoverResponseCache(ResponseCache shared, ResponseCache local) {
        this.shared = shared;
        this.local = local;
        log.info("响应缓存初始化|Response_cache_init,backend={}", name());
    }

    @Override
    public CacheEntry get(String key) {
        return execute(cache -> cache.get(key));
    }

    @Override
    public void set(String key, CacheEntry entry, long ttlSeconds) {
        execute(cache -> {
            cache.set(key, entry, ttlSeconds);
            return null;
        });
    }

    @Override
    public long invalidate(String prefix) {
        return execute(cache -> cache.invalidate(prefix));
    }

    @Override
    public void clear() {
        execute(cache -> {
            cache.clear();
            return null;
        });
    }

    @Override
    public String name() {
        return useShared() ? shared.name() : local.name();
    }

    public boolean isDegraded() {
        return degraded.get();
    }

    private boolean useShared() {
        return shared != null && !degraded.get();
    }

    private <T> T execute(Function<ResponseCache, T> operation) {
        if (useShared()) {
            try {
                return operation.apply(shared);
            } catch (RuntimeException e) {
                if (degraded.compareAndSet(false, true)) {
                    log.warn("共享缓存不可用_降级本地缓存|Response_cache_degraded,backend={},error={}",
                            shared.name(), e.getMessage(), e);
                }
            }
        }
        return operation.apply(local);
    }
}
