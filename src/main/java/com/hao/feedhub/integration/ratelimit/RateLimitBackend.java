package com.hao.feedhub.integration.ratelimit;

/**
 * 限流计数后端接口
 * <p>
 * 职责：
 * 定义“客户端 + 固定窗口”计数的统一行为，共享存储实现与本地实现可互相替换。
 * <p>
 * 约定：
 * 1. 两种实现使用同一套窗口桶算法（见 {@link FixedWindow}），相同请求时序得到相同的放行/拒绝序列。
 * 2. 被拒绝的请求不计入存量，窗口内计数不超过 limit+1。
 * 3. 实现类遇到基础设施故障直接抛出运行时异常，由 {@link ClientRateLimiter} 负责降级。
 */
public interface RateLimitBackend {

    /**
     * 尝试为客户端占用一次配额
     *
     * @param clientKey 客户端键（通常是 IP）
     * @param limit 窗口内最大请求数
     * @param windowSeconds 窗口长度（秒）
     * @return 判定结果
     */
    RateLimitDecision tryAcquire(String clientKey, int limit, int windowSeconds);

    /**
     * 后端名称，用于统计与日志
     */
    String name();
}
