package com.hao.feedhub.common.pagination;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * 键集查询条件
 *
 * 含义：按 (sortField, id) 以 order 排序，取严格排在 after 之后的前 limit 行。
 * after 为 null 表示从头开始。sortField 已经过白名单校验，可直接拼入 SQL。
 */
@Getter
@ToString
@AllArgsConstructor
public class KeysetQuery {

    private final String sortField;

    private final SortDirection order;

    private final Cursor after;

    private final int limit;

    /**
     * 是否需要复合比较 (sortField, id)；按 id 排序时只比较 id。非 id 排序的游标一定带排序值，由 Paginator 保证
     */
    public boolean isCompositeAfter() {
        return after != null && after.getTs() != null && !Paginator.ID_FIELD.equals(sortField);
    }
}
