package com.hao.feedhub.dal.dao.mapper;

import com.hao.feedhub.common.pagination.Paginator;
import com.hao.feedhub.common.pagination.SortDirection;
import org.apache.ibatis.jdbc.SQL;

import java.util.Map;
import java.util.Set;

/**
 * 列表查询 SQL 构建器
 *
 * 类职责：
 * 为帖子、职位列表生成键集分页与偏移分页 SQL。
 *
 * 核心实现思路：
 * - 排序字段只能是白名单中的列名，拼接前再校验一次，其余取值全部走 #{} 绑定。
 * - 键集条件使用复合比较：(f op ts) OR (f = ts AND id op lastId)，排序为 f, id，保证同一时间戳的行不丢不重。
 * - 按 id 排序或游标不带排序值时只比较 id。
 */
public class FeedSqlProvider {

    static final String POST_COLUMNS = "id, user_id, content, like_count, comment_count, created_at, updated_at";
    static final String JOB_COLUMNS = "id, title, company, category, location, created_at";

    private static final Set<String> SORTABLE_COLUMNS = Set.of("id", "created_at", "updated_at");

    public String selectPostsKeyset(Map<String, Object> params) {
        SQL sql = new SQL().SELECT(POST_COLUMNS).FROM("posts");
        return keyset(sql, params);
    }

    public String selectPostsOffset(Map<String, Object> params) {
        SQL sql = new SQL().SELECT(POST_COLUMNS).FROM("posts");
        return offset(sql, params);
    }

    public String selectJobsKeyset(Map<String, Object> params) {
        SQL sql = new SQL().SELECT(JOB_COLUMNS).FROM("jobs");
        filterCategory(sql, params);
        return keyset(sql, params);
    }

    public String selectJobsOffset(Map<String, Object> params) {
        SQL sql = new SQL().SELECT(JOB_COLUMNS).FROM("jobs");
        filterCategory(sql, params);
        return offset(sql, params);
    }

    public String countJobs(Map<String, Object> params) {
        SQL sql = new SQL().SELECT("COUNT(*)").FROM("jobs");
        filterCategory(sql, params);
        return sql.toString();
    }

    private static String keyset(SQL sql, Map<String, Object> params) {
        String field = checkedField(params);
        SortDirection order = (SortDirection) params.get("order");
        if (params.get("afterId") != null) {
            String op = order.getAfterOperator();
            if (params.get("afterTs") != null && !Paginator.ID_FIELD.equals(field)) {
                sql.WHERE("(" + field + " " + op + " #{afterTs} OR (" + field + " = #{afterTs} AND id " + op + " #{afterId}))");
            } else {
                sql.WHERE("id " + op + " #{afterId}");
            }
        }
        orderBy(sql, field, order);
        sql.LIMIT("#{limit}");
        return sql.toString();
    }

    private static String offset(SQL sql, Map<String, Object> params) {
        orderBy(sql, checkedField(params), (SortDirection) params.get("order"));
        sql.LIMIT("#{limit}");
        sql.OFFSET("#{offset}");
        return sql.toString();
    }

    private static void orderBy(SQL sql, String field, SortDirection order) {
        if (Paginator.ID_FIELD.equals(field)) {
            sql.ORDER_BY("id " + order.getSql());
        } else {
            sql.ORDER_BY(field + " " + order.getSql(), "id " + order.getSql());
        }
    }

    private static void filterCategory(SQL sql, Map<String, Object> params) {
        if (params.containsKey("category") && params.get("category") != null) {
            sql.WHERE("category = #{category}");
        }
    }

    private static String checkedField(Map<String, Object> params) {
        String field = (String) params.get("sortField");
        if (!SORTABLE_COLUMNS.contains(field)) {
            throw new IllegalArgumentException("unsupported sort field: " + field);
        }
        return field;
    }
}
