package com.hao.feedhub.integration.redis;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.stereotype.Component;

/**
 * 共享存储启动探测
 *
 * 类职责：
 * 在容器启动时对 Redis 做一次 PING，决定限流、缓存、跨进程推送采用共享后端还是本地后端。
 *
 * 为什么需要该类：
 * 后端选择是一次性的策略决策，集中探测一次，避免每个组件各自重试连接拖慢启动。
 *
 * 核心实现思路：
 * - app.redis.enabled=false 时跳过探测，直接按不可用处理。
 * - 探测依赖 Lettuce 的连接/命令超时（约 2 秒），Redis 宕机时不会卡住启动。
 */
@Slf4j
@Component
public class SharedStoreProbe {

    private final boolean available;

    public SharedStoreProbe(RedisConnectionFactory connectionFactory,
                            @Value("${app.redis.enabled:true}") boolean enabled) {
        if (!enabled) {
            log.info("共享存储已禁用_使用本地后端|Shared_store_disabled");
            this.available = false;
        } else {
            this.available = ping(connectionFactory);
        }
    }

    public boolean isAvailable() {
        return available;
    }

    private static boolean ping(RedisConnectionFactory connectionFactory) {
        try (RedisConnection connection = connectionFactory.getConnection()) {
            String pong = connection.ping();
            boolean ok = "PONG".equalsIgnoreCase(pong);
            log.info("共享存储探测完成|Shared_store_probe_done,available={},reply={}", ok, pong);
            return ok;
        } catch (Exception e) {
            log.warn("共享存储不可达_使用本地后端|Shared_store_unreachable,error={}", e.getMessage());
            return false;
        }
    }
}
