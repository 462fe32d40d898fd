package com.hao.feedhub.integration.ratelimit;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * 限流判定结果
 *
 * 类职责：
 * 携带一次限流检查的结论以及拼装响应头所需的窗口信息。
 */
@Getter
@ToString
@AllArgsConstructor
public class RateLimitDecision {

    /** 是否放行 */
    private final boolean allowed;

    /** 窗口内最大请求数 */
    private final int limit;

    /** 窗口长度（秒） */
    private final int windowSeconds;

    /** 当前窗口剩余秒数，拒绝时作为 Retry-After */
    private final long retryAfterSeconds;
}
