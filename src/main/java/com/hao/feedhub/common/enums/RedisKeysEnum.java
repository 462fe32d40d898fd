package com.hao.feedhub.common.enums;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Redis键枚举定义
 *
 * 类职责：
 * 统一管理 Redis 业务键前缀与频道名称，避免硬编码散落在各处。
 *
 * 设计目的：
 * 1. 规范键命名，便于运维与排障。
 * 2. 限流、缓存、推送三类数据共用一个 Redis 时互不冲突。
 *
 * 核心实现思路：
 * - 枚举承载键与描述信息。
 * - 提供拼接方法统一生成业务键。
 */
@Getter
@AllArgsConstructor
public enum RedisKeysEnum {

    // ============================
    // 1. 限流计数（字符串）
    // ============================
    /**
     * 客户端固定窗口计数器前缀
     * 类型：字符串
     * 用法：拼接 client:bucket -> "rate_limit:10.0.0.1:28512345"
     */
    RATE_LIMIT_PREFIX("rate_limit:", "客户端限流计数前缀"),

    // ============================
    // 2. 接口响应缓存（字符串）
    // ============================
    /**
     * 接口响应缓存前缀
     * 类型：字符串（JSON）
     * 用法：拼接 path?query -> "api:/api/jobs/list?category=it"
     */
    API_CACHE_PREFIX("api:", "接口响应缓存前缀"),

    // ============================
    // 3. 实时推送（发布订阅）
    // ============================
    /**
     * 跨进程推送频道
     * 类型：发布订阅频道
     * 用法：PUBLISH feedhub:hub:events {envelope}
     */
    HUB_CHANNEL("feedhub:hub:events", "实时推送跨进程频道");

    private final String key;
    private final String desc;

    /**
     * 拼接业务键
     *
     * @param suffix 业务后缀
     * @return 拼接后的完整键
     */
    public String join(Object suffix) {
        return this.key + suffix;
    }
}
