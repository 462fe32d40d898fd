package com.hao.feedhub.common.pagination;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * 分页器
 *
 * 类职责：
 * 统一入口自动选择分页模式：有 cursor 走游标分页；有 skip/page 走偏移分页；都没有默认游标分页。
 *
 * 设计目的：
 * 1. 无限滚动场景使用键集分页，深翻页性能稳定，数据增长时不跳行不重复。
 * 2. 需要页码跳转的后台场景保留偏移分页。
 *
 * 核心实现思路：
 * - 多取一行（limit+1）判断是否还有下一页，避免额外查询。
 * - 游标比较是真正的复合比较 (sortField, id)，排序字段取值相同时按 id 决胜。
 * - direction=previous 时反转排序与比较方向取数，再把结果翻转回请求的顺序。
 * - 游标损坏按“无游标”处理，limit 始终夹在 [1, maxLimit]。
 */
@Slf4j
public class Paginator {

    public static final String ID_FIELD = "id";
    public static final String DEFAULT_SORT_FIELD = "created_at";
    public static final int DEFAULT_LIMIT = 20;
    public static final int MAX_LIMIT = 100;

    private final int defaultLimit;
    private final int maxLimit;

    public Paginator() {
        this(DEFAULT_LIMIT, MAX_LIMIT);
    }

    public Paginator(int defaultLimit, int maxLimit) {
        this.defaultLimit = defaultLimit;
        this.maxLimit = maxLimit;
    }

    /**
     * 自动选择模式分页
     *
     * @param source 数据源
     * @param request 分页参数
     * @return 分页响应
     * @throws IllegalArgumentException direction / order_direction 取值非法
     */
    public <T> PagedResponse<T> paginate(PageSource<T> source, PageRequest request) {
        boolean hasCursor = request.getCursor() != null && !request.getCursor().isBlank();
        if (!hasCursor && (request.getSkip() != null || request.getPage() != null)) {
            return paginateWithOffset(source, request);
        }
        return paginateWithCursor(source, request);
    }

    /**
     * 游标（键集）分页
     *
     * 实现逻辑：
     * 1. 解析排序方向、翻页方向、排序字段与游标；非 id 排序下不带 ts 的游标视为无游标。
     * 2. 向后翻页：按请求顺序取 limit+1 行；向前翻页：反转顺序取 limit+1 行后再翻转。
     * 3. 丢掉多取的一行，用首尾行生成前后游标。
     */
    public <T> PagedResponse<T> paginateWithCursor(PageSource<T> source, PageRequest request) {
        int limit = clampLimit(request.getLimit());
        SortDirection order = SortDirection.fromParam(request.getOrderDirection());
        PageDirection direction = PageDirection.fromParam(request.getDirection());
        String sortField = resolveSortField(source, request.getOrderByField());
        // 按时间字段排序时，缺少排序值的游标无法定位 (sortField, id)，按无游标处理
        Optional<Cursor> cursor = CursorCodec.decode(request.getCursor())
                .filter(c -> ID_FIELD.equals(sortField) || c.getTs() != null);

        boolean backwards = direction == PageDirection.PREVIOUS && cursor.isPresent();
        SortDirection effectiveOrder = backwards ? order.reverse() : order;

        List<T> rows = new ArrayList<>(source.fetchKeyset(
                new KeysetQuery(sortField, effectiveOrder, cursor.orElse(null), limit + 1)));
        boolean hasMore = rows.size() > limit;
        if (hasMore) {
            rows = new ArrayList<>(rows.subList(0, limit));
        }

        boolean hasNext;
        boolean hasPrevious;
        if (backwards) {
            Collections.reverse(rows);
            hasPrevious = hasMore;
            // 游标所在行本身排在本页之后
            hasNext = !rows.isEmpty();
        } else {
            hasNext = hasMore;
            hasPrevious = cursor.isPresent();
        }

        PaginationMetadata metadata = new PaginationMetadata();
        metadata.setHasNext(hasNext);
        metadata.setHasPrevious(hasPrevious && !rows.isEmpty());
        metadata.setPerPage(limit);
        if (!rows.isEmpty()) {
            if (hasNext) {
                metadata.setNextCursor(CursorCodec.encode(source.cursorOf(rows.get(rows.size() - 1), sortField)));
            }
            if (metadata.isHasPrevious()) {
                metadata.setPreviousCursor(CursorCodec.encode(source.cursorOf(rows.get(0), sortField)));
            }
        }
        return PagedResponse.of(rows, metadata);
    }

    /**
     * 偏移分页
     *
     * 实现逻辑：
     * 1. page 换算为 skip=(page-1)*limit，page<=0 视为第一页。
     * 2. 取 limit+1 行判断是否还有下一页。
     * 3. includeTotal 为 true 时额外执行一次计数。
     */
    public <T> PagedResponse<T> paginateWithOffset(PageSource<T> source, PageRequest request) {
        int limit = clampLimit(request.getLimit());
        SortDirection order = SortDirection.fromParam(request.getOrderDirection());
        String sortField = resolveSortField(source, request.getOrderByField());

        long skip;
        if (request.getPage() != null) {
            skip = (long) Math.max(0, request.getPage() - 1) * limit;
        } else {
            skip = request.getSkip() == null ? 0 : Math.max(0, request.getSkip());
        }

        List<T> rows = new ArrayList<>(source.fetchOffset(new OffsetQuery(sortField, order, skip, limit + 1)));
        boolean hasNext = rows.size() > limit;
        if (hasNext) {
            rows = new ArrayList<>(rows.subList(0, limit));
        }

        PaginationMetadata metadata = new PaginationMetadata();
        metadata.setHasNext(hasNext);
        metadata.setHasPrevious(skip > 0);
        metadata.setPage((int) (skip / limit) + 1);
        metadata.setPerPage(limit);
        if (request.isIncludeTotal()) {
            metadata.setTotal(source.count());
        }
        return PagedResponse.of(rows, metadata);
    }

    int clampLimit(Integer requested) {
        if (requested == null) {
            return defaultLimit;
        }
        return Math.max(1, Math.min(maxLimit, requested));
    }

    private String resolveSortField(PageSource<?> source, String requested) {
        if (requested == null || requested.isBlank()) {
            return source.sortableFields().contains(DEFAULT_SORT_FIELD) ? DEFAULT_SORT_FIELD : ID_FIELD;
        }
        if (!source.sortableFields().contains(requested)) {
            log.debug("排序字段不在白名单_使用默认字段|Sort_field_not_allowed,field={}", requested);
            return source.sortableFields().contains(DEFAULT_SORT_FIELD) ? DEFAULT_SORT_FIELD : ID_FIELD;
        }
        return requested;
    }
}
