package com.hao.feedhub.integration.ratelimit;

/**
 * 固定窗口桶计算
 *
 * 窗口按 epoch 对齐：bucket = floor(now / window)。
 * Redis 与本地两种后端共用此算法，保证窗口边界一致。
 */
final class FixedWindow {

    private FixedWindow() {
    }

    static long bucketOf(long nowMillis, int windowSeconds) {
        return Math.floorDiv(nowMillis, windowSeconds * 1000L);
    }

    /**
     * 当前窗口剩余秒数，向上取整，范围 [1, windowSeconds]
     */
    static long retryAfterSeconds(long nowMillis, int windowSeconds) {
        long windowMillis = windowSeconds * 1000L;
        long bucketEnd = (bucketOf(nowMillis, windowSeconds) + 1) * windowMillis;
        long remainingMillis = bucketEnd - nowMillis;
        long seconds = (remainingMillis + 999) / 1000;
        return Math.max(1, Math.min(windowSeconds, seconds));
    }
}
