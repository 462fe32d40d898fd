package com.hao.feedhub.config;

import com.hao.feedhub.realtime.NotificationHub;
import com.hao.feedhub.realtime.auth.TokenVerifier;
import com.hao.feedhub.realtime.ws.NotificationWebSocketHandler;
import com.hao.feedhub.realtime.ws.TokenHandshakeInterceptor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import org.springframework.web.socket.server.standard.ServletServerContainerFactoryBean;

/**
 * WebSocket 端点配置类
 *
 * 类职责：
 * 注册 /ws/notifications 端点及握手鉴权拦截器，并设置容器级空闲超时。
 *
 * 核心实现思路：
 * - 空闲超时交给 Servlet 容器处理，超时关闭会走 afterConnectionClosed 完成断开清理。
 */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    public static final String NOTIFICATION_ENDPOINT = "/ws/notifications";

    private final NotificationHub notificationHub;
    private final TokenVerifier tokenVerifier;

    @Value("${app.hub.allowed-origins:*}")
    private String[] allowedOrigins;

    public WebSocketConfig(NotificationHub notificationHub, TokenVerifier tokenVerifier) {
        this.notificationHub = notificationHub;
        this.tokenVerifier = tokenVerifier;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(new NotificationWebSocketHandler(notificationHub), NOTIFICATION_ENDPOINT)
                .addInterceptors(new TokenHandshakeInterceptor(tokenVerifier))
                .setAllowedOriginPatterns(allowedOrigins);
    }

    @Bean
    public ServletServerContainerFactoryBean createWebSocketContainer(
            @Value("${app.hub.idle-timeout-ms:60000}") long idleTimeoutMs,
            @Value("${app.hub.max-text-buffer-size:65536}") int maxTextBufferSize) {
        ServletServerContainerFactoryBean container = new ServletServerContainerFactoryBean();
        container.setMaxSessionIdleTimeout(idleTimeoutMs);
        container.setMaxTextMessageBufferSize(maxTextBufferSize);
        return container;
    }
}
