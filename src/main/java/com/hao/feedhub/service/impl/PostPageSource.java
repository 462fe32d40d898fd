package com.hao.feedhub.service.impl;

import com.hao.feedhub.common.pagination.Cursor;
import com.hao.feedhub.common.pagination.KeysetQuery;
import com.hao.feedhub.common.pagination.OffsetQuery;
import com.hao.feedhub.common.pagination.PageSource;
import com.hao.feedhub.common.pagination.Paginator;
import com.hao.feedhub.dal.dao.mapper.PostMapper;
import com.hao.feedhub.dal.model.Post;

import java.util.List;
import java.util.Set;

/**
 * 帖子分页数据源，可按 id、created_at、updated_at 排序
 */
class PostPageSource implements PageSource<Post> {

    private static final Set<String> SORTABLE_FIELDS = Set.of(Paginator.ID_FIELD, "created_at", "updated_at");

    private final PostMapper postMapper;

    PostPageSource(PostMapper postMapper) {
        this.postMapper = postMapper;
    }

    @Override
    public Set<String> sortableFields() {
        return SORTABLE_FIELDS;
    }

    @Override
    public List<Post> fetchKeyset(KeysetQuery query) {
        Cursor after = query.getAfter();
        return postMapper.selectKeyset(query.getSortField(), query.getOrder(),
                after == null ? null : after.getId(),
                query.isCompositeAfter() ? after.getTs() : null,
                query.getLimit());
    }

    @Override
    public List<Post> fetchOffset(OffsetQuery query) {
        return postMapper.selectOffset(query.getSortField(), query.getOrder(), query.getOffset(), query.getLimit());
    }

    @Override
    public long count() {
        return postMapper.countAll();
    }

    @Override
    public Cursor cursorOf(Post row, String sortField) {
        switch (sortField) {
            case "created_at":
                return new Cursor(row.getId(), row.getCreatedAt());
            case "updated_at":
                return new Cursor(row.getId(), row.getUpdatedAt());
            default:
                return new Cursor(row.getId(), null);
        }
    }
}
