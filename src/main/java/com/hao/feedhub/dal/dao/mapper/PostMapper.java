package com.hao.feedhub.dal.dao.mapper;

import com.hao.feedhub.common.pagination.SortDirection;
import com.hao.feedhub.dal.model.Comment;
import com.hao.feedhub.dal.model.Post;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Options;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.SelectProvider;
import org.apache.ibatis.annotations.Update;

import java.time.Instant;
import java.util.List;

/**
 * 帖子数据访问接口
 *
 * 类职责：
 * 提供帖子列表（键集/偏移）、计数与点赞、评论写入。
 *
 * 核心实现思路：
 * - 列表 SQL 由 FeedSqlProvider 动态生成。
 * - 计数自增在数据库内原子完成，避免读改写竞争。
 */
@Mapper
public interface PostMapper {

    @SelectProvider(type = FeedSqlProvider.class, method = "selectPostsKeyset")
    List<Post> selectKeyset(@Param("sortField") String sortField,
                            @Param("order") SortDirection order,
                            @Param("afterId") Long afterId,
                            @Param("afterTs") Instant afterTs,
                            @Param("limit") int limit);

    @SelectProvider(type = FeedSqlProvider.class, method = "selectPostsOffset")
    List<Post> selectOffset(@Param("sortField") String sortField,
                            @Param("order") SortDirection order,
                            @Param("offset") long offset,
                            @Param("limit") int limit);

    @Select("SELECT COUNT(*) FROM posts")
    long countAll();

    @Select("SELECT " + FeedSqlProvider.POST_COLUMNS + " FROM posts WHERE id = #{id}")
    Post selectById(@Param("id") long id);

    @Update("UPDATE posts SET like_count = like_count + 1, updated_at = #{now} WHERE id = #{id}")
    int incrementLikeCount(@Param("id") long id, @Param("now") Instant now);

    @Update("UPDATE posts SET comment_count = comment_count + 1, updated_at = #{now} WHERE id = #{id}")
    int incrementCommentCount(@Param("id") long id, @Param("now") Instant now);

    @Insert("INSERT INTO post_comments (post_id, user_id, content, created_at) "
            + "VALUES (#{postId}, #{userId}, #{content}, #{createdAt})")
    @Options(useGeneratedKeys = true, keyProperty = "id", keyColumn = "id")
    int insertComment(Comment comment);
}
