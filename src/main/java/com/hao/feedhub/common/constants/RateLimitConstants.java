package com.hao.feedhub.common.constants;

/**
 * 限流阈值常量定义
 *
 * 类职责：
 * 集中管理客户端限流的默认阈值与豁免路径，避免魔法数字，便于统一调整与维护。
 *
 * 使用说明：
 * 配合 application.yml 中 rate.limit.* 配置使用，配置缺失时以此处为准。
 */
public class RateLimitConstants {

    /**
     * 单客户端窗口内最大请求数
     * 业务场景：按 IP 统计，100 次/60 秒足以覆盖正常刷新与无限滚动。
     */
    public static final String DEFAULT_REQUESTS = "100";

    /**
     * 固定窗口长度（秒）
     */
    public static final String DEFAULT_WINDOW_SECONDS = "60";

    /**
     * 健康检查等路径不参与限流
     */
    public static final String DEFAULT_EXCLUDE_PATHS = "/health,/health/ping,/live,/ready,/metrics";

    /**
     * 本地限流表最大客户端数，防止随机 IP 扫描撑爆内存
     */
    public static final long LOCAL_MAX_CLIENTS = 100_000L;

    /**
     * 限流拒绝提示
     */
    public static final String REJECT_DETAIL = "Too many requests. Please try again later.";

    public static final String HEADER_LIMIT = "X-RateLimit-Limit";

    public static final String HEADER_WINDOW = "X-RateLimit-Window";

    private RateLimitConstants() {
        // 禁止实例化
    }
}
