package com.hao.feedhub.realtime.auth;

/**
 * 推送连接鉴权失败异常
 *
 * 令牌缺失、签名错误、已过期或缺少用户标识时抛出，连接会被立即拒绝。
 */
public class HubAuthenticationException extends RuntimeException {

    public HubAuthenticationException(String message) {
        super(message);
    }

    public HubAuthenticationException(String message, Throwable cause) {
        super(message, cause);
    }
}
