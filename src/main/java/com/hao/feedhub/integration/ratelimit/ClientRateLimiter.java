package com.hao.feedhub.integration.ratelimit;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.LongAdder;

/**
 * 客户端限流器
 *
 * 类职责：
 * 按客户端维度执行“每窗口 N 次”的限流判定，并在共享存储故障时降级到本地后端。
 *
 * 设计目的：
 * 1. 多进程部署时通过 Redis 共享计数，单进程或 Redis 不可用时退回本地计数。
 * 2. 限流器自身故障不能阻断业务请求。
 *
 * 为什么需要该类：
 * 过滤器只关心“放行还是拒绝”，后端选择、降级与统计集中在这里处理。
 *
 * 核心实现思路：
 * - 启动探测决定初始后端（sharedBackend 为 null 即本地模式）。
 * - 运行期 Redis 异常：首次记录 WARN，之后一直使用本地后端，直到进程重启。
 * - 统计总请求数、拒绝数以及各后端命中数。
 */
@Slf4j
public class ClientRateLimiter {

    private final RateLimitBackend sharedBackend;
    private final RateLimitBackend localBackend;

    @Getter
    private final int limit;

    @Getter
    private final int windowSeconds;

    private final AtomicBoolean degraded = new AtomicBoolean(false);

    private final LongAdder totalRequests = new LongAdder();
    private final LongAdder rateLimited = new LongAdder();
    private final LongAdder redisHits = new LongAdder();
    private final LongAdder memoryHits = new LongAdder();

    /**
     * @param sharedBackend 共享存储后端，启动探测失败时为 null
     * @param localBackend 本地后端
     * @param limit 窗口内最大请求数，必须大于 0
     * @param windowSeconds 窗口长度（秒），必须大于 0
     */
    public ClientRateLimiter(RateLimitBackend sharedBackend, RateLimitBackend localBackend, int limit, int windowSeconds) {
        if (limit <= 0 || windowSeconds <= 0) {
            throw new IllegalArgumentException("rate limit requires positive limit and window, limit=" + limit + ", window=" + windowSeconds);
        }
        this.sharedBackend = sharedBackend;
        this.localBackend = localBackend;
        this.limit = limit;
        this.windowSeconds = windowSeconds;
        log.info("客户端限流器初始化|Client_rate_limiter_init,backend={},limit={},windowSeconds={}",
                activeBackendName(), limit, windowSeconds);
    }

    /**
     * 对客户端执行一次限流检查
     *
     * 实现逻辑：
     * 1. 未降级且存在共享后端时走 Redis。
     * 2. Redis 抛出异常则标记降级，本次请求改走本地后端。
     * 3. 记录统计。
     *
     * @param clientKey 客户端键
     * @return 判定结果
     */
    public RateLimitDecision check(String clientKey) {
        totalRequests.increment();
        RateLimitDecision decision = null;

        if (sharedBackend != null && !degraded.get()) {
            try {
                decision = sharedBackend.tryAcquire(clientKey, limit, windowSeconds);
                redisHits.increment();
            } catch (RuntimeException e) {
                // 只有第一个发现故障的线程打日志
                if (degraded.compareAndSet(false, true)) {
                    log.warn("共享限流存储不可用_降级本地计数|Rate_limit_store_degraded,backend={},error={}",
                            sharedBackend.name(), e.getMessage(), e);
                }
            }
        }

        if (decision == null) {
            decision = localBackend.tryAcquire(clientKey, limit, windowSeconds);
            memoryHits.increment();
        }

        if (!decision.isAllowed()) {
            rateLimited.increment();
        }
        return decision;
    }

    /**
     * 当前生效的后端名称
     */
    public String activeBackendName() {
        if (sharedBackend != null && !degraded.get()) {
            return sharedBackend.name();
        }
        return localBackend.name();
    }

    public boolean isDegraded() {
        return degraded.get();
    }

    /**
     * 限流统计快照
     */
    public Map<String, Object> getStats() {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("total_requests", totalRequests.sum());
        stats.put("rate_limited", rateLimited.sum());
        stats.put("redis_hits", redisHits.sum());
        stats.put("memory_hits", memoryHits.sum());
        stats.put("backend", activeBackendName());
        stats.put("limit", limit + "/" + windowSeconds + "s");
        return stats;
    }
}
