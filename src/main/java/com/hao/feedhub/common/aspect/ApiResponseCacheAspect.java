package com.hao.feedhub.common.aspect;

import com.hao.feedhub.common.cache.ApiResponseCache;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

/**
 * 接口响应缓存切面
 *
 * 类职责：
 * 拦截带有 @ApiCacheable 注解的方法，交给 ApiResponseCache 完成缓存查找、304 协商与写入。
 *
 * 为什么需要该类：
 * 缓存是横切关注点，集中在切面中才能保证所有列表接口行为一致。
 *
 * 实现思路：
 * - 使用 Spring AOP @Around 环绕通知拦截目标方法。
 * - 从 RequestContextHolder 取当前请求；不在 Web 请求上下文中时直接执行原方法。
 * - 方法声明的返回类型不是 ResponseEntity 时直接执行，不做缓存。
 */
@Slf4j
@Aspect
@Component
public class ApiResponseCacheAspect {

    private final ApiResponseCache apiResponseCache;

    public ApiResponseCacheAspect(ApiResponseCache apiResponseCache) {
        this.apiResponseCache = apiResponseCache;
    }

    /**
     * 环绕通知处理缓存逻辑
     *
     * @param point 切点
     * @param cacheable 注解对象
     * @return 业务执行结果或缓存内容
     * @throws Throwable 业务异常
     */
    @Around("@annotation(cacheable)")
    public Object around(ProceedingJoinPoint point, ApiCacheable cacheable) throws Throwable {
        HttpServletRequest request = getCurrentRequest();
        if (request == null) {
            return point.proceed();
        }

        Class<?> returnType = ((MethodSignature) point.getSignature()).getReturnType();
        if (!ResponseEntity.class.isAssignableFrom(returnType)) {
            log.warn("缓存注解要求返回ResponseEntity|Api_cacheable_unsupported_return,method={}",
                    point.getSignature().toShortString());
            return point.proceed();
        }

        return apiResponseCache.handle(request, cacheable.strategy(), cacheable.ttl(),
                () -> (ResponseEntity<?>) point.proceed());
    }

    private HttpServletRequest getCurrentRequest() {
        ServletRequestAttributes attributes =
                (ServletRequestAttributes) RequestContextHolder.getRequestAttributes();
        if (attributes != null) {
            return attributes.getRequest();
        }
        return null;
    }
}
