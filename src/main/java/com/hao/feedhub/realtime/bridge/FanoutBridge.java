package com.hao.feedhub.realtime.bridge;

import com.hao.feedhub.realtime.HubEnvelope;

import java.util.function.Consumer;

/**
 * 跨进程推送桥接
 * <p>
 * 职责：
 * 把本进程的推送事件发布给兄弟进程，并把兄弟进程的事件交给本进程投递。
 * 与限流后端一样，实现类在启动时一次性选定。
 */
public interface FanoutBridge {

    /**
     * 本节点 ID，写入信封 origin
     */
    String nodeId();

    /**
     * 发布信封，失败不抛异常
     */
    void publish(HubEnvelope envelope);

    /**
     * 注册接收端，只会收到其他节点发布的信封
     */
    void subscribe(Consumer<HubEnvelope> sink);

    /**
     * 是否具备跨进程能力
     */
    boolean isDistributed();
}
