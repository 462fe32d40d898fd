package com.hao.feedhub.common.aspect;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.hao.feedhub.common.cache.ApiResponseCache;
import com.hao.feedhub.common.cache.CacheStrategy;
import com.hao.feedhub.integration.cache.CacheEntry;
import com.hao.feedhub.integration.cache.LocalResponseCache;
import com.hao.feedhub.support.MutableClock;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.reflect.MethodSignature;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.ResponseEntity;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * 接口缓存切面测试
 *
 * 设计思路：
 * - Mock 切点与方法签名，绑定 RequestContextHolder 模拟 MVC 请求线程。
 */
public class ApiResponseCacheAspectTest {

    private ApiResponseCacheAspect aspect;
    private ApiCacheable cacheable;

    @BeforeEach
    void setUp() {
        MutableClock clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        ApiResponseCache apiResponseCache = new ApiResponseCache(
                new LocalResponseCache(Caffeine.newBuilder().<String, CacheEntry>build(), clock), clock);
        aspect = new ApiResponseCacheAspect(apiResponseCache);
        cacheable = mock(ApiCacheable.class);
        when(cacheable.ttl()).thenReturn(60L);
        when(cacheable.strategy()).thenReturn(CacheStrategy.POSTS);
    }

    @AfterEach
    void tearDown() {
        RequestContextHolder.resetRequestAttributes();
    }

    @Test
    @DisplayName("第二次调用命中缓存不再执行方法")
    void testAround_CachesResponseEntity() throws Throwable {
        bindRequest("/api/posts/list");
        ProceedingJoinPoint point = joinPoint(ResponseEntity.class, ResponseEntity.ok(Map.of("data", "x")));

        ResponseEntity<?> first = (ResponseEntity<?>) aspect.around(point, cacheable);
        ResponseEntity<?> second = (ResponseEntity<?>) aspect.around(point, cacheable);

        assertEquals("MISS", first.getHeaders().getFirst("X-Cache"));
        assertEquals("HIT", second.getHeaders().getFirst("X-Cache"));
        assertTrue(second.getHeaders().getCacheControl().contains("max-age=30"));
        verify(point, times(1)).proceed();
    }

    @Test
    @DisplayName("返回值不是 ResponseEntity 时直接执行")
    void testAround_UnsupportedReturnType() throws Throwable {
        bindRequest("/api/posts/list");
        Map<String, String> body = Map.of("data", "x");
        ProceedingJoinPoint point = joinPoint(Map.class, body);

        assertSame(body, aspect.around(point, cacheable));
        assertSame(body, aspect.around(point, cacheable));
        verify(point, times(2)).proceed();
    }

    @Test
    @DisplayName("无请求上下文时直接执行")
    void testAround_NoRequest() throws Throwable {
        ResponseEntity<String> body = ResponseEntity.ok("x");
        ProceedingJoinPoint point = joinPoint(ResponseEntity.class, body);

        assertSame(body, aspect.around(point, cacheable));
        verify(point, times(1)).proceed();
    }

    private static void bindRequest(String path) {
        RequestContextHolder.setRequestAttributes(new ServletRequestAttributes(new MockHttpServletRequest("GET", path)));
    }

    private static ProceedingJoinPoint joinPoint(Class<?> returnType, Object result) throws Throwable {
        ProceedingJoinPoint point = mock(ProceedingJoinPoint.class);
        MethodSignature signature = mock(MethodSignature.class);
        when(signature.getReturnType()).thenReturn(returnType);
        when(signature.toShortString()).thenReturn("FeedController.listPosts(..)");
        when(point.getSignature()).thenReturn(signature);
        when(point.proceed()).thenReturn(result);
        return point;
    }
}
