package com.hao.feedhub.common.pagination;

import java.util.Locale;

/**
 * 游标翻页方向
 */
public enum PageDirection {

    NEXT,

    PREVIOUS;

    /**
     * 解析 direction 参数，空值取默认 NEXT
     *
     * @throws IllegalArgumentException 取值不是 next/previous
     */
    public static PageDirection fromParam(String value) {
        if (value == null || value.isBlank()) {
            return NEXT;
        }
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "next":
                return NEXT;
            case "previous":
                return PREVIOUS;
            default:
                throw new IllegalArgumentException("direction must be next or previous, got: " + value);
        }
    }
}
