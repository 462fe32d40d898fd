package com.hao.feedhub.realtime.bridge;

import com.hao.feedhub.common.util.JsonUtil;
import com.hao.feedhub.realtime.HubEnvelope;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.connection.Message;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Redis 发布订阅桥接
 *
 * 类职责：
 * 通过 Redis PUBLISH/SUBSCRIBE 在多个进程之间转发推送事件。
 *
 * 核心实现思路：
 * - 每个信封带 origin 节点 ID，收到自己发布的信封直接丢弃，避免重复投递。
 * - 只保证“最终送达”，不保证跨进程顺序与持久化。
 * - 首次发布失败即永久降级为仅本地投递并告警一次，之后不再调用 Redis，请求线程不会反复等待命令超时。
 *   与限流、响应缓存的降级方式一致，恢复需要重启进程。
 */
@Slf4j
public class RedisFanoutBridge implements FanoutBridge, MessageListener {

    private final StringRedisTemplate stringRedisTemplate;
    private final String channel;
    private final String nodeId;
    private final AtomicBoolean degraded = new AtomicBoolean(false);

    private volatile Consumer<HubEnvelope> sink;

    public RedisFanoutBridge(StringRedisTemplate stringRedisTemplate, String channel, String nodeId) {
        this.stringRedisTemplate = stringRedisTemplate;
        this.channel = channel;
        this.nodeId = nodeId;
        log.info("推送跨进程桥接启用|Hub_redis_bridge_enabled,channel={},nodeId={}", channel, nodeId);
    }

    @Override
    public String nodeId() {
        return nodeId;
    }

    @Override
    public void publish(HubEnvelope envelope) {
        if (degraded.get()) {
            return;
        }
        envelope.setOrigin(nodeId);
        String json = JsonUtil.toJson(envelope);
        if (json == null) {
            return;
        }
        try {
            stringRedisTemplate.convertAndSend(channel, json);
        } catch (RuntimeException e) {
            if (degraded.compareAndSet(false, true)) {
                log.warn("推送桥接发布失败_降级仅本地投递|Hub_bridge_degraded_local_only,channel={},error={}",
                        channel, e.getMessage(), e);
            }
        }
    }

    @Override
    public void subscribe(Consumer<HubEnvelope> sink) {
        this.sink = sink;
    }

    @Override
    public boolean isDistributed() {
        return !degraded.get();
    }

    public boolean isDegraded() {
        return degraded.get();
    }

    /**
     * 订阅回调
     *
     * 实现逻辑：
     * 1. 反序列化信封，格式错误直接丢弃。
     * 2. 丢弃本节点发布的信封。
     * 3. 交给本地接收端投递。
     */
    @Override
    public void onMessage(Message message, byte[] pattern) {
        HubEnvelope envelope = JsonUtil.toBean(new String(message.getBody(), StandardCharsets.UTF_8), HubEnvelope.class);
        if (envelope == null || nodeId.equals(envelope.getOrigin())) {
            return;
        }
        Consumer<HubEnvelope> current = sink;
        if (current != null) {
            current.accept(envelope);
        }
    }
}
