package com.hao.feedhub.integration.ratelimit;

import com.hao.feedhub.common.enums.RedisKeysEnum;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.scripting.support.ResourceScriptSource;

import java.time.Clock;
import java.util.Collections;

/**
 * Redis 分布式限流后端
 *
 * 类职责：
 * 基于 Redis + Lua 脚本实现多进程共享的固定窗口计数。
 *
 * 设计目的：
 * 1. 保证操作原子性：使用 Lua 脚本封装 "INCR + EXPIRE + CHECK + 超限回退" 逻辑，避免并发竞态。
 * 2. 降低网络开销：将多次 Redis 交互合并为一次网络请求。
 *
 * 实现思路：
 * - 计数键 = rate_limit:{client}:{bucket}，窗口切换即换键，旧键随过期自然回收。
 * - 首次自增时设置过期时间。
 * - 脚本执行异常不在此处吞掉，交给 ClientRateLimiter 统一降级到本地后端。
 */
@Slf4j
public class RedisRateLimitBackend implements RateLimitBackend {

    private final StringRedisTemplate stringRedisTemplate;
    private final DefaultRedisScript<Long> limitScript;
    private final Clock clock;

    public RedisRateLimitBackend(StringRedisTemplate stringRedisTemplate, Clock clock) {
        this.stringRedisTemplate = stringRedisTemplate;
        this.clock = clock;
        // 初始化 Lua 脚本
        this.limitScript = new DefaultRedisScript<>();
        this.limitScript.setScriptSource(new ResourceScriptSource(new ClassPathResource("scripts/rate_limiter.lua")));
        this.limitScript.setResultType(Long.class);
    }

    /**
     * 尝试获取访问许可
     *
     * 实现逻辑：
     * 1. 按当前时间计算窗口桶并构造 Redis Key。
     * 2. 执行 Lua 脚本进行原子计数校验。
     * 3. 自增后计数不超过阈值即放行。
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
        String redisKey = RedisKeysEnum.RATE_LIMIT_PREFIX.join(clientKey + ":" + bucket);

        // 参数说明：KEYS=[key], ARGV=[limit, expireSeconds]
        Long count = stringRedisTemplate.execute(
                limitScript,
                Collections.singletonList(redisKey),
                String.valueOf(limit),
                String.valueOf(windowSeconds + 1)
        );
        if (count == null) {
            // 管道/事务模式下才会返回 null，视为存储不可用
            throw new IllegalStateException("rate limit script returned no result, key=" + redisKey);
        }

        boolean allowed = count <= limit;
        if (!allowed) {
            log.debug("分布式窗口超限|Redis_window_exceeded,key={},count={},limit={}", redisKey, count, limit);
        }
        return new RateLimitDecision(allowed, limit, windowSeconds, FixedWindow.retryAfterSeconds(now, windowSeconds));
    }

    @Override
    public String name() {
        return "redis";
    }
}
