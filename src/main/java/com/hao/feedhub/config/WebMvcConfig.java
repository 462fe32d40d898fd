package com.hao.feedhub.config;

import com.hao.feedhub.common.interceptor.ReplicaRouteInterceptor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Web 拦截器配置类
 *
 * 类职责：
 * 统一注册系统内的拦截器并配置拦截路径规则。
 *
 * 核心实现思路：
 * - 副本路由拦截器只作用于 /api/**，具体是否走副本由 ReadWriteRouter 的路径白名单决定。
 * - 系统接口放行，副本健康检查需要直接访问各连接池。
 */
@Configuration
public class WebMvcConfig implements WebMvcConfigurer {

    private final ReplicaRouteInterceptor replicaRouteInterceptor;

    public WebMvcConfig(ReplicaRouteInterceptor replicaRouteInterceptor) {
        this.replicaRouteInterceptor = replicaRouteInterceptor;
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(replicaRouteInterceptor)
                .addPathPatterns("/api/**")
                .excludePathPatterns("/api/system/**");
    }
}
