package com.hao.feedhub.common.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * 客户端 IP 解析测试
 */
public class ClientIpResolverTest {

    @Test
    @DisplayName("优先取 X-Forwarded-For 第一个地址")
    void testResolve_ForwardedFor() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.addHeader("X-Forwarded-For", " 1.2.3.4 , 10.0.0.1");
        request.addHeader("X-Real-IP", "5.6.7.8");
        assertEquals("1.2.3.4", ClientIpResolver.resolve(request));
    }

    @Test
    @DisplayName("其次取 X-Real-IP")
    void testResolve_RealIp() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.addHeader("X-Forwarded-For", "unknown");
        request.addHeader("X-Real-IP", "5.6.7.8");
        assertEquals("5.6.7.8", ClientIpResolver.resolve(request));
    }

    @Test
    @DisplayName("无代理头时取连接地址")
    void testResolve_RemoteAddr() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.setRemoteAddr("9.9.9.9");
        assertEquals("9.9.9.9", ClientIpResolver.resolve(request));
    }

    @Test
    @DisplayName("全部缺失时返回 unknown")
    void testResolve_Unknown() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.setRemoteAddr(null);
        assertEquals("unknown", ClientIpResolver.resolve(request));
    }
}
