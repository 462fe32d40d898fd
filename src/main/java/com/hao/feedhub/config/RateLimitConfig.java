package com.hao.feedhub.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.hao.feedhub.common.constants.RateLimitConstants;
import com.hao.feedhub.integration.ratelimit.ClientRateLimiter;
import com.hao.feedhub.integration.ratelimit.LocalRateLimitBackend;
import com.hao.feedhub.integration.ratelimit.RateLimitBackend;
import com.hao.feedhub.integration.ratelimit.RedisRateLimitBackend;
import com.hao.feedhub.integration.redis.SharedStoreProbe;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;

/**
 * 限流配置类
 *
 * 类职责：
 * 读取 rate.limit.* 配置并按启动探测结果装配客户端限流器。
 *
 * 核心实现思路：
 * - 本地后端始终存在。
 * - 只有启动时 Redis PING 成功才装配 Redis 后端。
 */
@Configuration
public class RateLimitConfig {

    @Bean
    public ClientRateLimiter clientRateLimiter(
            SharedStoreProbe sharedStoreProbe,
            StringRedisTemplate stringRedisTemplate,
            @Qualifier("rateLimitCounterCache") Cache<String, LocalRateLimitBackend.WindowCounter> counterCache,
            Clock clock,
            @Value("${rate.limit.requests:" + RateLimitConstants.DEFAULT_REQUESTS + "}") int requests,
            @Value("${rate.limit.window-seconds:" + RateLimitConstants.DEFAULT_WINDOW_SECONDS + "}") int windowSeconds) {
        RateLimitBackend local = new LocalRateLimitBackend(counterCache, clock);
        RateLimitBackend shared = sharedStoreProbe.isAvailable() ? new RedisRateLimitBackend(stringRedisTemplate, clock) : null;
        return new ClientRateLimiter(shared, local, requests, windowSeconds);
    }
}
