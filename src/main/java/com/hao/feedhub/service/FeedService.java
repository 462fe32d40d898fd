package com.hao.feedhub.service;

import com.hao.feedhub.common.pagination.PageRequest;
import com.hao.feedhub.common.pagination.PagedResponse;
import com.hao.feedhub.dal.model.Job;
import com.hao.feedhub.dal.model.Post;

import java.util.Map;

/**
 * 动态与职位业务服务接口
 *
 * 类职责：
 * 提供帖子列表、职位列表、点赞与评论能力。
 *
 * 核心实现思路：
 * - 列表读走只读副本，写操作走主库。
 * - 写操作完成后使相关列表缓存失效，并通过推送中心实时广播。
 */
public interface FeedService {

    /**
     * 帖子列表
     *
     * @param request 分页参数
     * @return 分页结果
     */
    PagedResponse<Post> listPosts(PageRequest request);

    /**
     * 职位列表
     *
     * @param category 分类，为空时不过滤
     * @param request 分页参数
     * @return 分页结果
     */
    PagedResponse<Job> listJobs(String category, PageRequest request);

    /**
     * 点赞帖子
     *
     * 实现逻辑：
     * 1. 主库原子自增点赞数。
     * 2. 使帖子列表缓存失效。
     * 3. 全局广播 like_update。
     *
     * @param postId 帖子ID
     * @param userId 点赞用户ID
     * @return success、post_id、like_count
     */
    Map<String, Object> likePost(long postId, String userId);

    /**
     * 评论帖子
     *
     * 实现逻辑：
     * 1. 主库写入评论并自增评论数。
     * 2. 使帖子列表缓存失效。
     * 3. 全局广播 comment_update，并给帖子作者推送通知（作者本人评论除外）。
     *
     * @param postId 帖子ID
     * @param userId 评论用户ID
     * @param content 评论内容
     * @return success、comment
     */
    Map<String, Object> addComment(long postId, String userId, String content);
}
