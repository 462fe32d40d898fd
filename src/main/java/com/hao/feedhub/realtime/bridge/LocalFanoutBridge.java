package com.hao.feedhub.realtime.bridge;

import com.hao.feedhub.realtime.HubEnvelope;
import lombok.extern.slf4j.Slf4j;

import java.util.function.Consumer;

/**
 * 单进程桥接
 *
 * 未配置共享消息总线时使用：发布为空操作，推送只在当前进程内有效。
 * 多实例部署时连接在其他实例上的用户收不到事件，启动时记录该限制。
 */
@Slf4j
public class LocalFanoutBridge implements FanoutBridge {

    private final String nodeId;

    public LocalFanoutBridge(String nodeId) {
        this.nodeId = nodeId;
        log.warn("推送仅限单进程|Hub_single_process_only,nodeId={},reason=no_shared_bus", nodeId);
    }

    @Override
    public String nodeId() {
        return nodeId;
    }

    @Override
    public void publish(HubEnvelope envelope) {
        // 无共享总线
    }

    @Override
    public void subscribe(Consumer<HubEnvelope> sink) {
        // 不会收到其他进程的事件
    }

    @Override
    public boolean isDistributed() {
        return false;
    }
}
