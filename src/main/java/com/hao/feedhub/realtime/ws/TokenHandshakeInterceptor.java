package com.hao.feedhub.realtime.ws;

import com.hao.feedhub.realtime.AuthenticatedUser;
import com.hao.feedhub.realtime.auth.HubAuthenticationException;
import com.hao.feedhub.realtime.auth.TokenVerifier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.util.StringUtils;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.Map;

/**
 * 握手鉴权拦截器
 *
 * 类职责：
 * 在 HTTP 升级阶段读取令牌并校验，校验通过的用户写入会话属性。
 *
 * 实现逻辑：
 * 1. 令牌来源：查询参数 token，其次 Authorization: Bearer。
 * 2. 携带了令牌但校验失败，直接返回 401，不升级。
 * 3. 未携带令牌时允许升级，由客户端第一帧 connect 事件补交令牌。
 */
@Slf4j
public class TokenHandshakeInterceptor implements HandshakeInterceptor {

    public static final String USER_ATTRIBUTE = "hubUser";

    private static final String TOKEN_PARAM = "token";
    private static final String BEARER_PREFIX = "Bearer ";

    private final TokenVerifier tokenVerifier;

    public TokenHandshakeInterceptor(TokenVerifier tokenVerifier) {
        this.tokenVerifier = tokenVerifier;
    }

    @Override
    public boolean beforeHandshake(ServerHttpRequest request, ServerHttpResponse response,
                                   WebSocketHandler wsHandler, Map<String, Object> attributes) {
        String token = extractToken(request);
        if (!StringUtils.hasText(token)) {
            return true;
        }
        try {
            AuthenticatedUser user = tokenVerifier.verify(token);
            attributes.put(USER_ATTRIBUTE, user);
            return true;
        } catch (HubAuthenticationException e) {
            log.info("握手鉴权失败|Ws_handshake_auth_fail,remote={},reason={}", request.getRemoteAddress(), e.getMessage());
            response.setStatusCode(HttpStatus.UNAUTHORIZED);
            return false;
        }
    }

    @Override
    public void afterHandshake(ServerHttpRequest request, ServerHttpResponse response,
                               WebSocketHandler wsHandler, Exception exception) {
        // no-op
    }

    static String extractToken(ServerHttpRequest request) {
        String token = UriComponentsBuilder.fromUri(request.getURI()).build().getQueryParams().getFirst(TOKEN_PARAM);
        if (StringUtils.hasText(token)) {
            return token;
        }
        String authorization = request.getHeaders().getFirst(HttpHeaders.AUTHORIZATION);
        if (authorization != null && authorization.startsWith(BEARER_PREFIX)) {
            return authorization.substring(BEARER_PREFIX.length()).trim();
        }
        return null;
    }
}
