package com.hao.feedhub.common.util;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.util.StringUtils;

/**
 * 客户端 IP 解析工具
 *
 * 优先级：X-Forwarded-For 第一个地址 > X-Real-IP > 对端地址 > "unknown"
 */
public final class ClientIpResolver {

    public static final String UNKNOWN = "unknown";

    private ClientIpResolver() {
    }

    /**
     * 解析客户端 IP 地址
     *
     * @param request 请求对象
     * @return 客户端 IP，无法解析时返回 unknown
     */
    public static String resolve(HttpServletRequest request) {
        // X-Forwarded-For 可能是 "client, proxy1, proxy2"，只取第一个
        String forwarded = request.getHeader("X-Forwarded-For");
        if (StringUtils.hasText(forwarded)) {
            String first = forwarded.split(",")[0].trim();
            if (StringUtils.hasText(first) && !UNKNOWN.equalsIgnoreCase(first)) {
                return first;
            }
        }
        String realIp = request.getHeader("X-Real-IP");
        if (StringUtils.hasText(realIp) && !UNKNOWN.equalsIgnoreCase(realIp.trim())) {
            return realIp.trim();
        }
        String remote = request.getRemoteAddr();
        return StringUtils.hasText(remote) ? remote : UNKNOWN;
    }
}
