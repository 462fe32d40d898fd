package com.hao.feedhub.realtime.auth;

import com.hao.feedhub.realtime.AuthenticatedUser;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;

/**
 * JWT 令牌校验器
 *
 * 类职责：
 * 使用 HMAC-SHA256 共享密钥校验推送连接携带的 JWT。
 *
 * 核心实现思路：
 * - 用户 ID 取 sub，缺失时取 user_id 声明；用户名取 username 声明。
 * - 密钥长度不足 32 字节时启动即失败，避免弱密钥上线。
 * - 所有解析异常统一转换为 HubAuthenticationException。
 */
@Slf4j
public class JwtTokenVerifier implements TokenVerifier {

    private static final int MIN_SECRET_LENGTH = 32;

    private final SecretKey secretKey;

    public JwtTokenVerifier(String secret) {
        if (secret == null || secret.getBytes(StandardCharsets.UTF_8).length < MIN_SECRET_LENGTH) {
            throw new IllegalStateException("JWT secret must be at least " + MIN_SECRET_LENGTH + " bytes");
        }
        this.secretKey = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public AuthenticatedUser verify(String token) {
        if (token == null || token.isBlank()) {
            throw new HubAuthenticationException("missing token");
        }
        Claims claims;
        try {
            claims = Jwts.parser()
                    .verifyWith(secretKey)
                    .build()
                    .parseSignedClaims(token.trim())
                    .getPayload();
        } catch (ExpiredJwtException e) {
            log.debug("连接令牌已过期|Hub_token_expired,subject={}", e.getClaims().getSubject());
            throw new HubAuthenticationException("token expired", e);
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("连接令牌无效|Hub_token_invalid,error={}", e.getMessage());
            throw new HubAuthenticationException("invalid token", e);
        }

        String userId = claims.getSubject();
        if (userId == null || userId.isBlank()) {
            Object fallback = claims.get("user_id");
            userId = fallback == null ? null : fallback.toString();
        }
        if (userId == null || userId.isBlank()) {
            throw new HubAuthenticationException("token has no user id");
        }
        Object userName = claims.get("username");
        return new AuthenticatedUser(userId, userName == null ? null : userName.toString());
    }
}
