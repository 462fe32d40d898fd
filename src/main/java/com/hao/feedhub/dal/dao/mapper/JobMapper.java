package com.hao.feedhub.dal.dao.mapper;

import com.hao.feedhub.common.pagination.SortDirection;
import com.hao.feedhub.dal.model.Job;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.SelectProvider;

import java.time.Instant;
import java.util.List;

/**
 * 职位数据访问接口，category 为空时不过滤
 */
@Mapper
public interface JobMapper {

    @SelectProvider(type = FeedSqlProvider.class, method = "selectJobsKeyset")
    List<Job> selectKeyset(@Param("category") String category,
                           @Param("sortField") String sortField,
                           @Param("order") SortDirection order,
                           @Param("afterId") Long afterId,
                           @Param("afterTs") Instant afterTs,
                           @Param("limit") int limit);

    @SelectProvider(type = FeedSqlProvider.class, method = "selectJobsOffset")
    List<Job> selectOffset(@Param("category") String category,
                           @Param("sortField") String sortField,
                           @Param("order") SortDirection order,
                           @Param("offset") long offset,
                           @Param("limit") int limit);

    @SelectProvider(type = FeedSqlProvider.class, method = "countJobs")
    long count(@Param("category") String category);
}
