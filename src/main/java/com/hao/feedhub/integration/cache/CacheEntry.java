package com.hao.feedhub.integration.cache;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 响应缓存条目
 *
 * content 是序列化后的 JSON 响应体，etag 不带引号；
 * expiresAt / lastModified 为 epoch 毫秒。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CacheEntry {

    private String key;

    private String content;

    private String etag;

    private long expiresAt;

    private long lastModified;

    public boolean expiredAt(long nowMillis) {
        return nowMillis >= expiresAt;
    }
}
