package com.hao.feedhub.common.interceptor;

import com.hao.feedhub.integration.datasource.DataSourceRoute;
import com.hao.feedhub.integration.datasource.ReadWriteRouter;
import com.hao.feedhub.integration.datasource.ReadWriteRoutingDataSource;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * 副本路由拦截器
 *
 * 类职责：
 * 对白名单内的只读接口（GET），在请求处理期间把线程路由切到只读副本。
 *
 * 为什么需要该类：
 * 列表接口的业务代码不需要显式调用 ReadWriteRouter.read，中间件按路径统一路由。
 *
 * 核心实现思路：
 * - preHandle 绑定 REPLICA 并把之前的路由存入请求属性。
 * - afterCompletion 无论成功失败都恢复之前的路由，避免线程复用时路由泄漏。
 */
@Slf4j
@Component
public class ReplicaRouteInterceptor implements HandlerInterceptor {

    private static final String PREVIOUS_ROUTE_ATTRIBUTE = ReplicaRouteInterceptor.class.getName() + ".previous";

    private final ReadWriteRouter readWriteRouter;

    public ReplicaRouteInterceptor(ReadWriteRouter readWriteRouter) {
        this.readWriteRouter = readWriteRouter;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        if (HttpMethod.GET.matches(request.getMethod()) && readWriteRouter.shouldUseReplica(request.getRequestURI())) {
            DataSourceRoute previous = ReadWriteRoutingDataSource.bind(DataSourceRoute.REPLICA);
            // 属性值不能为 null，用 PRIMARY 占位表示“之前未绑定”
            request.setAttribute(PREVIOUS_ROUTE_ATTRIBUTE, previous == null ? DataSourceRoute.PRIMARY : previous);
            log.debug("请求路由到只读副本|Request_routed_to_replica,path={}", request.getRequestURI());
        }
        return true;
    }

    @Override
    public void afterCompletion(HttpServletRequest request, HttpServletResponse response, Object handler, Exception ex) {
        Object previous = request.getAttribute(PREVIOUS_ROUTE_ATTRIBUTE);
        if (previous != null) {
            ReadWriteRoutingDataSource.restore((DataSourceRoute) previous);
            request.removeAttribute(PREVIOUS_ROUTE_ATTRIBUTE);
        }
    }
}
