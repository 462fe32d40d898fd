package com.hao.feedhub.realtime.ws;

import com.fasterxml.jackson.core.type.TypeReference;
import com.hao.feedhub.common.util.JsonUtil;
import com.hao.feedhub.realtime.AuthenticatedUser;
import com.hao.feedhub.realtime.HubConnection;
import com.hao.feedhub.realtime.HubEvents;
import com.hao.feedhub.realtime.NotificationHub;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.util.Map;

/**
 * 通知 WebSocket 处理器
 *
 * 类职责：
 * 把 Spring WebSocket 会话事件翻译为 NotificationHub 的连接生命周期与客户端事件。
 *
 * 核心实现思路：
 * - 握手已携带有效令牌：连接建立即注册。
 * - 握手未携带令牌：连接处于 CONNECTING，只接受 connect 帧，其余帧以 1008 关闭。
 * - 已注册连接的帧交给 NotificationHub.dispatch。
 */
@Slf4j
public class NotificationWebSocketHandler extends TextWebSocketHandler {

    private static final TypeReference<Map<String, Object>> FRAME_TYPE = new TypeReference<Map<String, Object>>() {
    };

    private final NotificationHub notificationHub;

    public NotificationWebSocketHandler(NotificationHub notificationHub) {
        this.notificationHub = notificationHub;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        Object user = session.getAttributes().get(TokenHandshakeInterceptor.USER_ATTRIBUTE);
        if (user instanceof AuthenticatedUser) {
            notificationHub.register(new WebSocketSessionTransport(session), (AuthenticatedUser) user);
        } else {
            log.debug("等待 connect 帧鉴权|Ws_awaiting_connect_frame,sessionId={}", session.getId());
        }
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        Map<String, Object> frame = JsonUtil.toBean(message.getPayload(), FRAME_TYPE);
        String event = frame == null || frame.get("event") == null ? null : frame.get("event").toString();
        Map<String, Object> data = frame == null ? null : asMap(frame.get("data"));

        HubConnection connection = notificationHub.getConnection(session.getId());
        if (connection == null) {
            if (HubEvents.CONNECT.equals(event)) {
                Object token = data == null ? null : data.get("token");
                notificationHub.connect(new WebSocketSessionTransport(session), token == null ? null : token.toString());
            } else {
                log.info("未鉴权连接发送业务帧|Ws_unauthenticated_frame,sessionId={},event={}", session.getId(), event);
                new WebSocketSessionTransport(session).close(HubEvents.CLOSE_POLICY_VIOLATION, "authentication required");
            }
            return;
        }
        if (HubEvents.CONNECT.equals(event)) {
            // 已注册连接重复 connect，忽略
            return;
        }
        notificationHub.dispatch(session.getId(), event, data);
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        notificationHub.disconnect(session.getId(), "closed_" + status.getCode());
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("连接传输异常|Ws_transport_error,sessionId={},error={}", session.getId(), exception.getMessage());
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object data) {
        return data instanceof Map ? (Map<String, Object>) data : null;
    }
}
