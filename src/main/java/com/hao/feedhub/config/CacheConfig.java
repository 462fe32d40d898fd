package com.hao.feedhub.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.hao.feedhub.common.constants.CacheConstants;
import com.hao.feedhub.common.constants.RateLimitConstants;
import com.hao.feedhub.integration.cache.CacheEntry;
import com.hao.feedhub.integration.cache.FailoverResponseCache;
import com.hao.feedhub.integration.cache.LocalResponseCache;
import com.hao.feedhub.integration.cache.RedisResponseCache;
import com.hao.feedhub.integration.cache.ResponseCache;
import com.hao.feedhub.integration.ratelimit.LocalRateLimitBackend;
import com.hao.feedhub.integration.redis.SharedStoreProbe;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;
import java.util.concurrent.TimeUnit;

/**
 * 本地缓存与响应缓存配置类
 *
 * 类职责：
 * 统一管理项目中使用的 Caffeine 本地缓存实例，并按启动探测结果装配响应缓存。
 *
 * 设计目的：
 * 1. 集中配置：缓存的容量、过期策略等参数集中管理，便于调优。
 * 2. 差异化配置：限流计数器与响应缓存使用不同配置的 Cache 实例。
 * 3. 策略一次性选定：Redis 可用时装配带降级的 Redis 缓存，否则只用本地缓存。
 */
@Configuration
public class CacheConfig {

    /**
     * 统一时钟，测试中可替换为固定时钟
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * 限流计数器缓存实例
     *
     * 实现逻辑：
     * 1. expireAfterAccess：客户端在一段时间内无请求，其计数器被自动回收。
     * 2. maximumSize：限制条目数，防止随机 IP 扫描导致 OOM。
     *
     * @return 配置好的计数器 Cache Bean
     */
    @Bean("rateLimitCounterCache")
    public Cache<String, LocalRateLimitBackend.WindowCounter> rateLimitCounterCache() {
        return Caffeine.newBuilder()
                .expireAfterAccess(10, TimeUnit.MINUTES)
                .maximumSize(RateLimitConstants.LOCAL_MAX_CLIENTS)
                .build();
    }

    /**
     * 本地响应缓存实例
     * 条目 TTL 由 CacheEntry.expiresAt 在读取时判断，这里的 expireAfterWrite 只兜底回收长期不读的条目。
     */
    @Bean("responseCacheStore")
    public Cache<String, CacheEntry> responseCacheStore() {
        return Caffeine.newBuilder()
                .expireAfterWrite(1, TimeUnit.HOURS)
                .maximumSize(CacheConstants.LOCAL_MAX_ENTRIES)
                .build();
    }

    /**
     * 响应缓存
     *
     * 实现逻辑：
     * 1. 始终构建本地缓存作为兜底。
     * 2. 启动探测 Redis 可用时，外层包一层 Redis 缓存，运行期故障自动降级。
     */
    @Bean
    public ResponseCache responseCache(SharedStoreProbe sharedStoreProbe,
                                       StringRedisTemplate stringRedisTemplate,
                                       @Qualifier("responseCacheStore") Cache<String, CacheEntry> responseCacheStore,
                                       Clock clock) {
        ResponseCache local = new LocalResponseCache(responseCacheStore, clock);
        ResponseCache shared = sharedStoreProbe.isAvailable() ? new RedisResponseCache(stringRedisTemplate, clock) : null;
        return new FailoverResponseCache(shared, local);
    }
}
