package com.hao.feedhub.common.pagination;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * 分页游标
 *
 * 记录上一页边界行的 (排序字段值, id)。按 id 排序时 ts 为 null。
 * 游标无状态，不落库。
 */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor
public class Cursor {

    /** 边界行 ID */
    private final long id;

    /** 边界行排序字段值（时间戳字段），可为 null */
    private final Instant ts;
}
