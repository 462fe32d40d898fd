package com.hao.feedhub.common.pagination;

import java.util.Locale;

/**
 * 排序方向
 */
public enum SortDirection {

    ASC("ASC", ">"),

    DESC("DESC", "<");

    /** SQL 排序关键字 */
    private final String sql;

    /** 键集分页中“排在游标之后”对应的比较符 */
    private final String afterOperator;

    SortDirection(String sql, String afterOperator) {
        this.sql = sql;
        this.afterOperator = afterOperator;
    }

    public String getSql() {
        return sql;
    }

    public String getAfterOperator() {
        return afterOperator;
    }

    public SortDirection reverse() {
        return this == ASC ? DESC : ASC;
    }

    /**
     * 解析 order_direction 参数，空值取默认 DESC
     *
     * @throws IllegalArgumentException 取值不是 asc/desc
     */
    public static SortDirection fromParam(String value) {
        if (value == null || value.isBlank()) {
            return DESC;
        }
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "asc":
                return ASC;
            case "desc":
                return DESC;
            default:
                throw new IllegalArgumentException("order_direction must be asc or desc, got: " + value);
        }
    }
}
