package com.hao.feedhub.common.constants;

/**
 * 响应缓存常量定义
 *
 * 类职责：
 * 统一管理缓存相关的响应头名称、默认 TTL 与本地缓存容量。
 */
public class CacheConstants {

    public static final String HEADER_X_CACHE = "X-Cache";

    public static final String HEADER_CDN_CACHE_CONTROL = "CDN-Cache-Control";

    public static final String CACHE_HIT = "HIT";

    public static final String CACHE_MISS = "MISS";

    /**
     * 默认缓存时长（秒），对应 5 分钟
     */
    public static final int DEFAULT_TTL_SECONDS = 300;

    /**
     * 本地响应缓存最大条目数
     */
    public static final long LOCAL_MAX_ENTRIES = 10_000L;

    /**
     * 用户维度缓存时，请求属性中的用户标识（由认证层写入）
     */
    public static final String USER_ID_ATTRIBUTE = "userId";

    /**
     * 无法识别用户时的缓存身份
     */
    public static final String ANONYMOUS = "anonymous";

    private CacheConstants() {
        // 禁止实例化
    }
}
