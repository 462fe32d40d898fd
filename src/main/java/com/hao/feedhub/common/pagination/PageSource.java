package com.hao.feedhub.common.pagination;

import java.util.List;
import java.util.Set;

/**
 * 分页数据源
 * <p>
 * 职责：
 * 由具体资源（帖子、职位）实现，Paginator 只负责参数解析、limit+1 探测与元数据组装。
 *
 * @param <T> 行类型
 */
public interface PageSource<T> {

    /**
     * 可排序字段白名单。除 id 外均为时间戳字段。
     */
    Set<String> sortableFields();

    List<T> fetchKeyset(KeysetQuery query);

    List<T> fetchOffset(OffsetQuery query);

    long count();

    /**
     * 以行在 sortField 上的取值构造游标
     */
    Cursor cursorOf(T row, String sortField);
}
