package com.hao.feedhub.common.pagination;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * 分页请求参数
 *
 * 对应查询参数：cursor、direction、skip、page、limit、order_by_field、order_direction。
 * includeTotal 由调用方决定是否在偏移分页时执行 COUNT(*)。
 */
@Getter
@Builder
@ToString
public class PageRequest {

    private final String cursor;

    private final String direction;

    private final Integer skip;

    private final Integer page;

    private final Integer limit;

    private final String orderByField;

    private final String orderDirection;

    private final boolean includeTotal;
}
