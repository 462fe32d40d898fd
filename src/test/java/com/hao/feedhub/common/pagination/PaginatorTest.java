package com.hao.feedhub.common.pagination;

import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.LongStream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * 分页器测试
 *
 * 测试目的：
 * 1. 25 行、limit=20：第一页 20 行 has_next，第二页 5 行 has_previous 且无 has_next。
 * 2. 同一时间戳的多行在翻页时不丢不重（复合键集）。
 * 3. 向前翻页回到第一页，顺序与第一页一致。
 * 4. 偏移分页与 page 换算、total 统计。
 *
 * 设计思路：
 * - 使用内存数据源模拟 SQL 的 ORDER BY (created_at, id) 与复合比较。
 */
@Slf4j
public class PaginatorTest {

    private static final Instant BASE = Instant.parse("2024-01-01T00:00:00Z");

    private Paginator paginator;
    private InMemorySource source;

    @BeforeEach
    void setUp() {
        paginator = new Paginator();
        // id 1..25，每两行共用一个时间戳
        source = new InMemorySource(LongStream.rangeClosed(1, 25)
                .mapToObj(id -> new Row(id, BASE.plusSeconds(60 * (id / 2))))
                .collect(Collectors.toList()));
    }

    @Test
    @DisplayName("游标分页_两页覆盖全部行且不重复")
    void testPaginateWithCursor_TwoPages() {
        PagedResponse<Row> first = paginator.paginate(source, PageRequest.builder().limit(20).build());
        assertEquals(20, first.getData().size());
        assertEquals(25L, first.getData().get(0).id);
        assertEquals(6L, first.getData().get(19).id);
        assertTrue(first.getPagination().isHasNext());
        assertFalse(first.getPagination().isHasPrevious());
        assertNotNull(first.getPagination().getNextCursor());
        assertNull(first.getPagination().getPreviousCursor());
        assertEquals(20, first.getPagination().getPerPage());

        PagedResponse<Row> second = paginator.paginate(source, PageRequest.builder()
                .limit(20).cursor(first.getPagination().getNextCursor()).build());
        log.info("第二页|Second_page,ids={}", ids(second.getData()));
        assertEquals(List.of(5L, 4L, 3L, 2L, 1L), ids(second.getData()));
        assertFalse(second.getPagination().isHasNext());
        assertTrue(second.getPagination().isHasPrevious());
        assertNull(second.getPagination().getNextCursor());
        assertNotNull(second.getPagination().getPreviousCursor());
    }

    @Test
    @DisplayName("向前翻页回到第一页")
    void testPaginateWithCursor_Previous() {
        PagedResponse<Row> first = paginator.paginate(source, PageRequest.builder().limit(20).build());
        PagedResponse<Row> second = paginator.paginate(source, PageRequest.builder()
                .limit(20).cursor(first.getPagination().getNextCursor()).build());

        PagedResponse<Row> back = paginator.paginate(source, PageRequest.builder()
                .limit(20).cursor(second.getPagination().getPreviousCursor()).direction("previous").build());

        assertEquals(ids(first.getData()), ids(back.getData()));
        assertFalse(back.getPagination().isHasPrevious());
        assertTrue(back.getPagination().isHasNext());
    }

    @Test
    @DisplayName("小页翻完全部行_同时间戳行不丢不重")
    void testPaginateWithCursor_TieBreak() {
        List<Long> seen = new ArrayList<>();
        String cursor = null;
        int pages = 0;
        do {
            PagedResponse<Row> page = paginator.paginate(source, PageRequest.builder()
                    .limit(3).cursor(cursor).orderDirection("asc").build());
            seen.addAll(ids(page.getData()));
            cursor = page.getPagination().isHasNext() ? page.getPagination().getNextCursor() : null;
            pages++;
        } while (cursor != null && pages < 20);

        assertEquals(LongStream.rangeClosed(1, 25).boxed().collect(Collectors.toList()), seen);
        assertEquals(9, pages);
    }

    @Test
    @DisplayName("按 id 排序时游标不带时间戳")
    void testPaginateWithCursor_IdSort() {
        PagedResponse<Row> first = paginator.paginate(source, PageRequest.builder()
                .limit(10).orderByField("id").orderDirection("asc").build());
        assertEquals(1L, first.getData().get(0).id);
        Cursor next = CursorCodec.decode(first.getPagination().getNextCursor()).orElseThrow();
        assertEquals(10L, next.getId());
        assertNull(next.getTs());
    }

    @Test
    @DisplayName("按时间排序时不带时间戳的游标按第一页处理")
    void testPaginateWithCursor_TimestampMissing() {
        String idOnly = CursorCodec.encode(new Cursor(10L, null));

        PagedResponse<Row> byTime = paginator.paginate(source, PageRequest.builder().limit(5).cursor(idOnly).build());
        assertEquals(List.of(25L, 24L, 23L, 22L, 21L), ids(byTime.getData()));
        assertFalse(byTime.getPagination().isHasPrevious());

        PagedResponse<Row> byId = paginator.paginate(source, PageRequest.builder()
                .limit(5).orderByField("id").cursor(idOnly).build());
        assertEquals(List.of(9L, 8L, 7L, 6L, 5L), ids(byId.getData()));
        assertTrue(byId.getPagination().isHasPrevious());
    }

    @Test
    @DisplayName("非法游标按第一页处理")
    void testPaginateWithCursor_GarbageCursor() {
        PagedResponse<Row> page = paginator.paginate(source, PageRequest.builder().limit(5).cursor("garbage!!").build());
        assertEquals(List.of(25L, 24L, 23L, 22L, 21L), ids(page.getData()));
        assertFalse(page.getPagination().isHasPrevious());
    }

    @Test
    @DisplayName("偏移分页_page 换算与总数")
    void testPaginateWithOffset_Page() {
        PagedResponse<Row> page = paginator.paginate(source, PageRequest.builder()
                .page(2).limit(10).includeTotal(true).build());
        assertEquals(List.of(15L, 14L, 13L, 12L, 11L, 10L, 9L, 8L, 7L, 6L), ids(page.getData()));
        assertTrue(page.getPagination().isHasNext());
        assertTrue(page.getPagination().isHasPrevious());
        assertEquals(2, page.getPagination().getPage());
        assertEquals(25L, page.getPagination().getTotal());
    }

    @Test
    @DisplayName("偏移分页_最后一页与负数 skip")
    void testPaginateWithOffset_Skip() {
        PagedResponse<Row> last = paginator.paginate(source, PageRequest.builder().skip(20).limit(10).build());
        assertEquals(5, last.getData().size());
        assertFalse(last.getPagination().isHasNext());
        assertNull(last.getPagination().getTotal(), "未要求时不统计总数");

        PagedResponse<Row> negative = paginator.paginate(source, PageRequest.builder().skip(-5).limit(10).build());
        assertEquals(25L, negative.getData().get(0).id);
        assertFalse(negative.getPagination().isHasPrevious());
    }

    @Test
    @DisplayName("limit 被限制在 [1, 100]")
    void testClampLimit() {
        assertEquals(20, paginator.clampLimit(null));
        assertEquals(100, paginator.clampLimit(500));
        assertEquals(1, paginator.clampLimit(0));
    }

    @Test
    @DisplayName("非法排序方向与翻页方向抛参数异常")
    void testPaginate_InvalidEnums() {
        assertThrows(IllegalArgumentException.class, () -> paginator.paginate(source,
                PageRequest.builder().orderDirection("sideways").build()));
        assertThrows(IllegalArgumentException.class, () -> paginator.paginate(source,
                PageRequest.builder().direction("up").build()));
    }

    @Test
    @DisplayName("不在白名单的排序字段回退默认字段")
    void testPaginate_UnknownSortField() {
        PagedResponse<Row> page = paginator.paginate(source, PageRequest.builder()
                .limit(3).orderByField("password; DROP TABLE").build());
        assertEquals(List.of(25L, 24L, 23L), ids(page.getData()));
    }

    private static List<Long> ids(List<Row> rows) {
        return rows.stream().map(r -> r.id).collect(Collectors.toList());
    }

    static final class Row {
        final long id;
        final Instant createdAt;

        Row(long id, Instant createdAt) {
            this.id = id;
            this.createdAt = createdAt;
        }
    }

    /**
     * 内存数据源：排序与键集比较语义同 FeedSqlProvider 生成的 SQL
     */
    static final class InMemorySource implements PageSource<Row> {

        private final List<Row> rows;

        InMemorySource(List<Row> rows) {
            this.rows = rows;
        }

        @Override
        public Set<String> sortableFields() {
            return Set.of("id", "created_at");
        }

        @Override
        public List<Row> fetchKeyset(KeysetQuery query) {
            Comparator<Row> ascending = comparator(query.getSortField());
            Comparator<Row> order = query.getOrder() == SortDirection.ASC ? ascending : ascending.reversed();
            Cursor after = query.getAfter();
            return rows.stream()
                    .filter(row -> after == null || isAfter(row, after, query))
                    .sorted(order)
                    .limit(query.getLimit())
                    .collect(Collectors.toList());
        }

        @Override
        public List<Row> fetchOffset(OffsetQuery query) {
            Comparator<Row> ascending = comparator(query.getSortField());
            Comparator<Row> order = query.getOrder() == SortDirection.ASC ? ascending : ascending.reversed();
            return rows.stream()
                    .sorted(order)
                    .skip(query.getOffset())
                    .limit(query.getLimit())
                    .collect(Collectors.toList());
        }

        @Override
        public long count() {
            return rows.size();
        }

        @Override
        public Cursor cursorOf(Row row, String sortField) {
            return "id".equals(sortField) ? new Cursor(row.id, null) : new Cursor(row.id, row.createdAt);
        }

        private static Comparator<Row> comparator(String sortField) {
            Comparator<Row> byId = Comparator.comparingLong(r -> r.id);
            return "id".equals(sortField) ? byId : Comparator.<Row, Instant>comparing(r -> r.createdAt).thenComparing(byId);
        }

        private static boolean isAfter(Row row, Cursor after, KeysetQuery query) {
            int cmp;
            if (query.isCompositeAfter()) {
                cmp = row.createdAt.compareTo(after.getTs());
                if (cmp == 0) {
                    cmp = Long.compare(row.id, after.getId());
                }
            } else {
                cmp = Long.compare(row.id, after.getId());
            }
            return query.getOrder() == SortDirection.ASC ? cmp > 0 : cmp < 0;
        }
    }
}
