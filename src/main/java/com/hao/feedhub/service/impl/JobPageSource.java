package com.hao.feedhub.service.impl;

import com.hao.feedhub.common.pagination.Cursor;
import com.hao.feedhub.common.pagination.KeysetQuery;
import com.hao.feedhub.common.pagination.OffsetQuery;
import com.hao.feedhub.common.pagination.PageSource;
import com.hao.feedhub.common.pagination.Paginator;
import com.hao.feedhub.dal.dao.mapper.JobMapper;
import com.hao.feedhub.dal.model.Job;

import java.util.List;
import java.util.Set;

/**
 * 职位分页数据源，按分类过滤，可按 id、created_at 排序
 */
class JobPageSource implements PageSource<Job> {

    private static final Set<String> SORTABLE_FIELDS = Set.of(Paginator.ID_FIELD, "created_at");

    private final JobMapper jobMapper;
    private final String category;

    JobPageSource(JobMapper jobMapper, String category) {
        this.jobMapper = jobMapper;
        this.category = category;
    }

    @Override
    public Set<String> sortableFields() {
        return SORTABLE_FIELDS;
    }

    @Override
    public List<Job> fetchKeyset(KeysetQuery query) {
        Cursor after = query.getAfter();
        return jobMapper.selectKeyset(category, query.getSortField(), query.getOrder(),
                after == null ? null : after.getId(),
                query.isCompositeAfter() ? after.getTs() : null,
                query.getLimit());
    }

    @Override
    public List<Job> fetchOffset(OffsetQuery query) {
        return jobMapper.selectOffset(category, query.getSortField(), query.getOrder(), query.getOffset(), query.getLimit());
    }

    @Override
    public long count() {
        return jobMapper.count(category);
    }

    @Override
    public Cursor cursorOf(Job row, String sortField) {
        return "created_at".equals(sortField) ? new Cursor(row.getId(), row.getCreatedAt()) : new Cursor(row.getId(), null);
    }
}
