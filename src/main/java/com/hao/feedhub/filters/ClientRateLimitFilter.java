package com.hao.feedhub.filters;

import com.hao.feedhub.common.constants.RateLimitConstants;
import com.hao.feedhub.common.util.ClientIpResolver;
import com.hao.feedhub.common.util.JsonUtil;
import com.hao.feedhub.integration.ratelimit.ClientRateLimiter;
import com.hao.feedhub.integration.ratelimit.RateLimitDecision;
import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 客户端限流过滤器
 *
 * 类职责：
 * 对进入服务的 HTTP 请求按客户端 IP 执行“每窗口 N 次”的流量控制。
 *
 * 设计目的：
 * 1. 系统级保护：防止单个客户端（爬虫、脚本）耗尽线程池与数据库连接。
 * 2. 默认开启：无需在每个接口上单独配置。
 *
 * 为什么需要该类：
 * 当系统入口缺乏硬性阈值时，任何下游资源都会被动承压并放大故障。
 *
 * 核心实现思路：
 * - 在 DispatcherServlet 之前拦截，健康检查等路径直接放行。
 * - 过滤器里抛出的异常到不了 @RestControllerAdvice，因此 429 响应在这里直接写出。
 * - 放行与拒绝的响应都带上 X-RateLimit-Limit / X-RateLimit-Window。
 */
@Slf4j
@Component
@Order(1) // 保证优先级最高，最先执行
public class ClientRateLimitFilter implements Filter {

    private final ClientRateLimiter clientRateLimiter;
    private final List<String> excludePaths;

    public ClientRateLimitFilter(ClientRateLimiter clientRateLimiter,
                                 @Value("${rate.limit.exclude-paths:" + RateLimitConstants.DEFAULT_EXCLUDE_PATHS + "}")
                                 List<String> excludePaths) {
        this.clientRateLimiter = clientRateLimiter;
        this.excludePaths = excludePaths;
    }

    /**
     * 限流拦截入口
     *
     * 实现逻辑：
     * 1. 排除路径直接放行，不解析客户端键。
     * 2. 解析客户端 IP 并执行限流检查。
     * 3. 写入观测头；超限时返回 429，否则放行请求链。
     */
    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain) throws IOException, ServletException {
        HttpServletRequest httpRequest = (HttpServletRequest) request;
        HttpServletResponse httpResponse = (HttpServletResponse) response;

        if (isExcluded(httpRequest.getRequestURI())) {
            chain.doFilter(request, response);
            return;
        }

        String clientKey = ClientIpResolver.resolve(httpRequest);
        RateLimitDecision decision = clientRateLimiter.check(clientKey);

        // 响应头必须在写 body 之前设置
        httpResponse.setHeader(RateLimitConstants.HEADER_LIMIT, String.valueOf(decision.getLimit()));
        httpResponse.setHeader(RateLimitConstants.HEADER_WINDOW, String.valueOf(decision.getWindowSeconds()));

        if (!decision.isAllowed()) {
            log.warn("客户端限流触发|Client_rate_limit_triggered,client={},path={},retryAfter={}",
                    clientKey, httpRequest.getRequestURI(), decision.getRetryAfterSeconds());
            writeRejection(httpResponse, decision);
            return;
        }

        chain.doFilter(request, response);
    }

    private boolean isExcluded(String path) {
        if (path == null) {
            return false;
        }
        for (String prefix : excludePaths) {
            if (!prefix.isBlank() && path.startsWith(prefix.trim())) {
                return true;
            }
        }
        return false;
    }

    private void writeRejection(HttpServletResponse response, RateLimitDecision decision) throws IOException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("detail", RateLimitConstants.REJECT_DETAIL);
        body.put("limit", decision.getLimit());
        body.put("window", decision.getWindowSeconds());

        response.setStatus(HttpStatus.TOO_MANY_REQUESTS.value());
        response.setHeader(HttpHeaders.RETRY_AFTER, String.valueOf(decision.getRetryAfterSeconds()));
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        response.getWriter().write(JsonUtil.toJson(body));
    }
}
