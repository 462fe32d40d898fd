package com.hao.feedhub.realtime;

import java.io.IOException;

/**
 * 连接传输层抽象
 * <p>
 * NotificationHub 只依赖这个接口，不感知具体的 WebSocket 实现，便于单元测试。
 * 同一个连接的 send 由 HubConnection 串行调用，实现类无需自行加锁。
 */
public interface ConnectionTransport {

    /**
     * 连接唯一标识
     */
    String id();

    /**
     * 发送一帧文本
     *
     * @param frame JSON 文本帧
     * @throws IOException 底层连接写失败
     */
    void send(String frame) throws IOException;

    /**
     * 关闭连接
     *
     * @param code 关闭码
     * @param reason 关闭原因
     */
    void close(int code, String reason);

    boolean isOpen();
}
