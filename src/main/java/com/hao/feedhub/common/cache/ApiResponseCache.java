package com.hao.feedhub.common.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.hao.feedhub.common.constants.CacheConstants;
import com.hao.feedhub.common.util.JsonUtil;
import com.hao.feedhub.integration.cache.CacheEntry;
import com.hao.feedhub.integration.cache.ResponseCache;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.time.Clock;

/**
 * 接口响应缓存
 *
 * 类职责：
 * 把“缓存键推导 + 响应缓存存储 + 缓存头策略”组合在一起，包裹一个 GET 接口的执行。
 *
 * 设计目的：
 * 1. 命中且 ETag 匹配时返回 304，省掉响应体传输。
 * 2. 命中时直接返回缓存内容，不执行业务方法。
 * 3. 未命中时执行业务方法并写入缓存。
 *
 * 为什么需要该类：
 * 列表接口读多写少，响应级缓存配合 CDN 头可以挡掉绝大部分重复查询。
 *
 * 使用约定：
 * 写操作必须自行调用 {@link #invalidate(String)} 使受影响路径前缀的缓存失效，这里不会自动感知数据变化。
 */
@Slf4j
@Component
public class ApiResponseCache {

    /**
     * 被缓存的接口调用
     */
    @FunctionalInterface
    public interface CachedHandler {
        ResponseEntity<?> proceed() throws Throwable;
    }

    private final ResponseCache responseCache;
    private final Clock clock;

    public ApiResponseCache(ResponseCache responseCache, Clock clock) {
        this.responseCache = responseCache;
        this.clock = clock;
    }

    /**
     * 以缓存方式执行接口
     *
     * 实现逻辑：
     * 1. 非 GET 请求直接执行，不参与缓存。
     * 2. 推导缓存键并查缓存；命中时按 If-None-Match 返回 304 或缓存内容。
     * 3. 未命中时执行业务方法；非 2xx 结果原样返回。
     * 4. 序列化并计算 ETag，成功则写缓存；序列化失败则跳过缓存直接返回。
     *
     * @param request 当前请求
     * @param strategy 缓存策略
     * @param ttlSeconds 缓存时长（秒）
     * @param handler 业务调用
     * @return 响应
     * @throws Throwable 业务方法抛出的异常原样传播
     */
    public ResponseEntity<?> handle(HttpServletRequest request, CacheStrategy strategy, long ttlSeconds,
                                    CachedHandler handler) throws Throwable {
        if (!HttpMethod.GET.matches(request.getMethod())) {
            return handler.proceed();
        }

        String cacheKey = ApiCacheKeyBuilder.build(request.getRequestURI(), request.getParameterMap(),
                strategy, resolveUserId(request));

        CacheEntry cached = responseCache.get(cacheKey);
        if (cached != null) {
            return respondFromCache(request, strategy, cached);
        }

        ResponseEntity<?> result = handler.proceed();
        if (result == null || !result.getStatusCode().is2xxSuccessful()) {
            return result;
        }

        String content;
        String etag;
        try {
            content = JsonUtil.mapper().writeValueAsString(result.getBody());
            etag = CacheHeaderPolicy.generateEtag(result.getBody());
        } catch (JsonProcessingException e) {
            log.warn("响应序列化失败_跳过缓存|Response_serialize_fail_skip_cache,key={},error={}", cacheKey, e.getMessage());
            return result;
        }

        long now = clock.millis();
        CacheEntry entry = new CacheEntry();
        entry.setContent(content);
        entry.setEtag(etag);
        entry.setLastModified(now);
        responseCache.set(cacheKey, entry, ttlSeconds);
        log.debug("接口缓存写入|Api_cache_stored,key={},ttl={}", cacheKey, ttlSeconds);

        HttpHeaders headers = new HttpHeaders();
        headers.putAll(result.getHeaders());
        CacheHeaderPolicy.applyHeaders(headers, strategy, etag);
        headers.setLastModified(now);
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set(CacheConstants.HEADER_X_CACHE, CacheConstants.CACHE_MISS);
        return new ResponseEntity<>(content, headers, result.getStatusCode());
    }

    /**
     * 使路径前缀下的全部缓存失效
     *
     * @param pathPrefix 接口路径前缀，如 /api/posts
     * @return 删除条目数
     */
    public long invalidate(String pathPrefix) {
        long removed = responseCache.invalidate(ApiCacheKeyBuilder.prefixOf(pathPrefix));
        log.info("接口缓存失效|Api_cache_invalidated,prefix={},removed={}", pathPrefix, removed);
        return removed;
    }

    public void clear() {
        responseCache.clear();
    }

    private ResponseEntity<?> respondFromCache(HttpServletRequest request, CacheStrategy strategy, CacheEntry cached) {
        HttpHeaders headers = new HttpHeaders();
        CacheHeaderPolicy.applyHeaders(headers, strategy, cached.getEtag());
        headers.set(CacheConstants.HEADER_X_CACHE, CacheConstants.CACHE_HIT);

        if (CacheHeaderPolicy.checkEtagMatch(request.getHeader(HttpHeaders.IF_NONE_MATCH), cached.getEtag())) {
            log.debug("ETag匹配_返回304|Etag_matched_not_modified,key={}", cached.getKey());
            return new ResponseEntity<>(headers, HttpStatus.NOT_MODIFIED);
        }

        headers.setLastModified(cached.getLastModified());
        headers.setContentType(MediaType.APPLICATION_JSON);
        return new ResponseEntity<>(cached.getContent(), headers, HttpStatus.OK);
    }

    /**
     * 用户维度缓存身份，只认认证层写入的请求属性，无身份时归入 anonymous；客户端请求头不参与
     */
    private String resolveUserId(HttpServletRequest request) {
        Object attribute = request.getAttribute(CacheConstants.USER_ID_ATTRIBUTE);
        if (attribute != null && StringUtils.hasText(attribute.toString())) {
            return attribute.toString();
        }
        return CacheConstants.ANONYMOUS;
    }
}
