package com.hao.feedhub.realtime.ws;

import com.hao.feedhub.realtime.ConnectionTransport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;

/**
 * 基于 Spring WebSocketSession 的传输实现
 */
@Slf4j
public class WebSocketSessionTransport implements ConnectionTransport {

    private final WebSocketSession session;

    public WebSocketSessionTransport(WebSocketSession session) {
        this.session = session;
    }

    @Override
    public String id() {
        return session.getId();
    }

    @Override
    public void send(String frame) throws IOException {
        session.sendMessage(new TextMessage(frame));
    }

    @Override
    public void close(int code, String reason) {
        try {
            session.close(new CloseStatus(code, reason));
        } catch (IOException e) {
            log.warn("关闭连接失败|Ws_close_fail,sessionId={},error={}", session.getId(), e.getMessage());
        }
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }
}
