package com.hao.feedhub.controller;

import com.hao.feedhub.integration.datasource.ReadWriteRouter;
import com.hao.feedhub.integration.ratelimit.ClientRateLimiter;
import com.hao.feedhub.realtime.NotificationHub;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 系统状态控制器
 *
 * 类职责：
 * 提供健康检查、限流统计、副本健康与在线用户查询接口。
 */
@RestController
@RequiredArgsConstructor
public class SystemController {

    private final ClientRateLimiter clientRateLimiter;
    private final ReadWriteRouter readWriteRouter;
    private final NotificationHub notificationHub;
    private final Clock clock;

    @GetMapping("/health")
    public Map<String, Object> health() {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("status", "healthy");
        result.put("timestamp", clock.instant().toString());
        result.put("rate_limit_backend", clientRateLimiter.activeBackendName());
        result.put("replica_enabled", readWriteRouter.hasReplica());
        result.put("hub_distributed", notificationHub.isDistributed());
        return result;
    }

    @GetMapping("/health/ping")
    public Map<String, Object> ping() {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("status", "ok");
        return result;
    }

    @GetMapping("/api/system/rate-limit/stats")
    public Map<String, Object> rateLimitStats() {
        return clientRateLimiter.getStats();
    }

    /**
     * 副本健康与连接池状态
     */
    @GetMapping("/api/system/replica/health")
    public Map<String, Object> replicaHealth() {
        Map<String, Object> result = new LinkedHashMap<>(readWriteRouter.checkReplicaHealth());
        result.put("pools", readWriteRouter.poolStatus());
        return result;
    }

    @GetMapping("/api/presence/online")
    public Map<String, Object> onlineUsers() {
        List<String> users = notificationHub.getOnlineUsers();
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("online_users", users);
        result.put("count", users.size());
        result.put("connections", notificationHub.getConnectionCount());
        return result;
    }
}
