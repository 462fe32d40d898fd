package com.hao.feedhub.common.pagination;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * 偏移查询条件：ORDER BY sortField order, id order OFFSET offset LIMIT limit
 */
@Getter
@ToString
@AllArgsConstructor
public class OffsetQuery {

    private final String sortField;

    private final SortDirection order;

    private final long offset;

    private final int limit;
}
