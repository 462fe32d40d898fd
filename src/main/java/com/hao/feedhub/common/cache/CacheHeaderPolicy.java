package com.hao.feedhub.common.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.google.common.base.Splitter;
import com.google.common.hash.Hashing;
import com.hao.feedhub.common.constants.CacheConstants;
import com.hao.feedhub.common.util.JsonUtil;
import org.springframework.http.HttpHeaders;

import java.nio.charset.StandardCharsets;

/**
 * 缓存响应头策略
 *
 * 类职责：
 * 计算 ETag、按策略输出 Cache-Control / CDN-Cache-Control / Vary，处理条件请求匹配。
 *
 * 设计目的：
 * 1. ETag 只取决于内容本身：稳定序列化后做 SHA-256，Map 插入顺序不同也得到同一个 ETag。
 * 2. If-None-Match 的解析兼容列表、弱校验器（W/）与通配符（*）。
 */
public final class CacheHeaderPolicy {

    private static final int ETAG_LENGTH = 32;

    private static final Splitter ETAG_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();

    private CacheHeaderPolicy() {
    }

    /**
     * 生成 ETag（不带引号）
     *
     * @param content 响应内容
     * @return SHA-256 十六进制前 32 位
     * @throws JsonProcessingException 内容无法序列化
     */
    public static String generateEtag(Object content) throws JsonProcessingException {
        String stable = JsonUtil.toStableJson(content);
        return Hashing.sha256().hashString(stable, StandardCharsets.UTF_8).toString().substring(0, ETAG_LENGTH);
    }

    /**
     * 条件请求匹配
     *
     * @param ifNoneMatch 请求头 If-None-Match 原文，可为 null
     * @param etag 服务端 ETag（不带引号）
     * @return 匹配时返回 true，应响应 304
     */
    public static boolean checkEtagMatch(String ifNoneMatch, String etag) {
        if (ifNoneMatch == null || ifNoneMatch.isBlank() || etag == null) {
            return false;
        }
        for (String candidate : ETAG_SPLITTER.split(ifNoneMatch)) {
            if ("*".equals(candidate)) {
                return true;
            }
            // 弱比较：忽略 W/ 前缀
            if (candidate.startsWith("W/")) {
                candidate = candidate.substring(2);
            }
            if (stripQuotes(candidate).equals(etag)) {
                return true;
            }
        }
        return false;
    }

    /**
     * 写入策略对应的缓存头
     *
     * @param headers 响应头
     * @param strategy 缓存策略
     * @param etag 不带引号的 ETag，可为 null
     */
    public static void applyHeaders(HttpHeaders headers, CacheStrategy strategy, String etag) {
        headers.set(HttpHeaders.CACHE_CONTROL, strategy.getCacheControl());
        if (strategy.getCdnCacheControl() != null) {
            headers.set(CacheConstants.HEADER_CDN_CACHE_CONTROL, strategy.getCdnCacheControl());
        }
        if (strategy.getVary() != null) {
            headers.set(HttpHeaders.VARY, strategy.getVary());
        }
        if (etag != null) {
            headers.set(HttpHeaders.ETAG, quote(etag));
        }
    }

    public static String quote(String etag) {
        return "\"" + etag + "\"";
    }

    private static String stripQuotes(String value) {
        if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
            return value.substring(1, value.length() - 1);
        }
        return value;
    }
}
