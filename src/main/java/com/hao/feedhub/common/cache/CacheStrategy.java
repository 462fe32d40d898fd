package com.hao.feedhub.common.cache;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 缓存策略枚举
 *
 * 类职责：
 * 定义各类内容的固定缓存响应头组合（浏览器 / CDN / Vary）。
 *
 * 核心实现思路：
 * - cdnCacheControl、vary 为 null 表示不输出该头。
 * - userScoped=true 的策略缓存键会拼接用户身份，不同用户互不命中。
 */
@Getter
@AllArgsConstructor
public enum CacheStrategy {

    /** 带版本号的静态资源 */
    IMMUTABLE("public, max-age=31536000, immutable", "public, max-age=31536000", "Accept-Encoding", false),

    /** 公共列表（更新不频繁） */
    PUBLIC_LIST("public, max-age=60, stale-while-revalidate=120", "public, max-age=120", "Accept-Encoding", false),

    /** 职位列表 */
    JOBS("public, max-age=60, stale-while-revalidate=120", "public, max-age=180", "Accept-Encoding", false),

    /** 帖子列表 */
    POSTS("public, max-age=30, stale-while-revalidate=60", "public, max-age=60", "Accept-Encoding", false),

    /** 公开资料页 */
    PUBLIC_PROFILE("public, max-age=300, stale-while-revalidate=600", "public, max-age=600", "Accept-Encoding", false),

    /** 用户私有动态内容（个人 Feed） */
    PRIVATE_DYNAMIC("private, max-age=30, must-revalidate", null, "Authorization, Accept-Encoding", true),

    /** 禁止缓存 */
    NO_CACHE("no-cache, no-store, must-revalidate", "no-store", null, false);

    private final String cacheControl;
    private final String cdnCacheControl;
    private final String vary;
    private final boolean userScoped;
}
