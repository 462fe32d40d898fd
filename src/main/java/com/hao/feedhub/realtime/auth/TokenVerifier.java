package com.hao.feedhub.realtime.auth;

import com.hao.feedhub.realtime.AuthenticatedUser;

/**
 * 连接令牌校验器
 */
public interface TokenVerifier {

    /**
     * 同步校验令牌（签名 + 过期时间）
     *
     * @param token Bearer 令牌
     * @return 令牌对应的用户
     * @throws HubAuthenticationException 校验失败
     */
    AuthenticatedUser verify(String token);
}
