package com.hao.feedhub.config;

import com.hao.feedhub.common.enums.RedisKeysEnum;
import com.hao.feedhub.integration.redis.SharedStoreProbe;
import com.hao.feedhub.realtime.NotificationHub;
import com.hao.feedhub.realtime.auth.JwtTokenVerifier;
import com.hao.feedhub.realtime.auth.TokenVerifier;
import com.hao.feedhub.realtime.bridge.FanoutBridge;
import com.hao.feedhub.realtime.bridge.LocalFanoutBridge;
import com.hao.feedhub.realtime.bridge.RedisFanoutBridge;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * 实时推送配置类
 *
 * 类职责：
 * 装配推送中心及其依赖：投递线程池、令牌校验器、跨进程桥接。
 *
 * 核心实现思路：
 * - 投递线程池所有连接共享，每个连接的出站队列同一时刻最多占用一个线程。
 * - 启动探测 Redis 可用时使用发布订阅桥接，否则退化为单进程并告警。
 * - 节点 ID 未配置时随机生成，只用于识别并丢弃自己发布的信封。
 */
@Slf4j
@Configuration
public class NotificationHubConfig {

    @Bean("hubDeliveryExecutor")
    public ThreadPoolTaskExecutor hubDeliveryExecutor(@Value("${app.hub.delivery-threads:8}") int threads,
                                                      @Value("${app.hub.delivery-queue-capacity:10000}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("hub-delivery-");
        // 队列满时拒绝，帧留在连接出站队列中等下一次调度；调用方可能持有推送中心的锁，不能由它代发
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(5);
        executor.initialize();
        return executor;
    }

    @Bean
    public TokenVerifier tokenVerifier(@Value("${app.hub.jwt-secret}") String secret) {
        return new JwtTokenVerifier(secret);
    }

    @Bean
    public FanoutBridge fanoutBridge(SharedStoreProbe sharedStoreProbe,
                                     StringRedisTemplate stringRedisTemplate,
                                     @Value("${app.hub.node-id:}") String configuredNodeId) {
        String nodeId = StringUtils.hasText(configuredNodeId) ? configuredNodeId : UUID.randomUUID().toString();
        if (!sharedStoreProbe.isAvailable()) {
            return new LocalFanoutBridge(nodeId);
        }
        return new RedisFanoutBridge(stringRedisTemplate, RedisKeysEnum.HUB_CHANNEL.getKey(), nodeId);
    }

    /**
     * 跨进程订阅容器，仅在使用 Redis 桥接时订阅频道
     */
    @Bean
    public RedisMessageListenerContainer hubListenerContainer(RedisConnectionFactory connectionFactory,
                                                              FanoutBridge fanoutBridge) {
        RedisMessageListenerContainer container = new RedisMessageListenerContainer();
        container.setConnectionFactory(connectionFactory);
        if (fanoutBridge instanceof RedisFanoutBridge) {
            container.addMessageListener((RedisFanoutBridge) fanoutBridge, new ChannelTopic(RedisKeysEnum.HUB_CHANNEL.getKey()));
            log.info("推送频道订阅注册|Hub_channel_subscribed,channel={}", RedisKeysEnum.HUB_CHANNEL.getKey());
        }
        return container;
    }

    @Bean(destroyMethod = "shutdown")
    public NotificationHub notificationHub(TokenVerifier tokenVerifier,
                                           FanoutBridge fanoutBridge,
                                           @Qualifier("hubDeliveryExecutor") Executor hubDeliveryExecutor,
                                           Clock clock,
                                           @Value("${app.hub.max-pending-frames:1000}") int maxPendingFrames) {
        return new NotificationHub(tokenVerifier, fanoutBridge, hubDeliveryExecutor, clock, maxPendingFrames);
    }
}
