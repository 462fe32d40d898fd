package com.hao.feedhub.service.impl;

import com.hao.feedhub.common.cache.ApiResponseCache;
import com.hao.feedhub.common.exception.ResourceNotFoundException;
import com.hao.feedhub.common.pagination.PageRequest;
import com.hao.feedhub.common.pagination.PagedResponse;
import com.hao.feedhub.common.pagination.Paginator;
import com.hao.feedhub.dal.dao.mapper.JobMapper;
import com.hao.feedhub.dal.dao.mapper.PostMapper;
import com.hao.feedhub.dal.model.Comment;
import com.hao.feedhub.dal.model.Job;
import com.hao.feedhub.dal.model.Post;
import com.hao.feedhub.integration.datasource.ReadWriteRouter;
import com.hao.feedhub.realtime.NotificationHub;
import com.hao.feedhub.service.FeedService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 动态与职位业务服务实现
 *
 * 类职责：
 * 组合分页器、读写路由、接口缓存与推送中心，实现列表与互动业务。
 *
 * 核心实现思路：
 * - 列表在 ReadWriteRouter.read 作用域内查询，走只读副本。
 * - 点赞、评论在 ReadWriteRouter.write 作用域内执行，写后读同样走主库。
 * - 写成功后先使缓存失效，再推送事件，客户端收到推送后重新拉取拿到的是新数据。
 */
@Slf4j
@Service
public class FeedServiceImpl implements FeedService {

    /** 帖子列表缓存前缀 */
    static final String POSTS_CACHE_PREFIX = "/api/posts";

    private final PostMapper postMapper;
    private final JobMapper jobMapper;
    private final ReadWriteRouter readWriteRouter;
    private final ApiResponseCache apiResponseCache;
    private final NotificationHub notificationHub;
    private final Clock clock;
    private final Paginator paginator = new Paginator();

    public FeedServiceImpl(PostMapper postMapper,
                           JobMapper jobMapper,
                           ReadWriteRouter readWriteRouter,
                           ApiResponseCache apiResponseCache,
                           NotificationHub notificationHub,
                           Clock clock) {
        this.postMapper = postMapper;
        this.jobMapper = jobMapper;
        this.readWriteRouter = readWriteRouter;
        this.apiResponseCache = apiResponseCache;
        this.notificationHub = notificationHub;
        this.clock = clock;
    }

    @Override
    public PagedResponse<Post> listPosts(PageRequest request) {
        return readWriteRouter.read(() -> paginator.paginate(new PostPageSource(postMapper), request));
    }

    @Override
    public PagedResponse<Job> listJobs(String category, PageRequest request) {
        String filter = StringUtils.hasText(category) ? category.trim() : null;
        return readWriteRouter.read(() -> paginator.paginate(new JobPageSource(jobMapper, filter), request));
    }

    @Override
    public Map<String, Object> likePost(long postId, String userId) {
        Post post = readWriteRouter.write(() -> {
            Instant now = clock.instant();
            if (postMapper.incrementLikeCount(postId, now) == 0) {
                throw new ResourceNotFoundException("Post not found");
            }
            return postMapper.selectById(postId);
        });

        apiResponseCache.invalidate(POSTS_CACHE_PREFIX);
        notificationHub.broadcastLikeUpdate(String.valueOf(postId), post.getLikeCount(), userId);
        log.info("帖子点赞|Post_liked,postId={},userId={},likeCount={}", postId, userId, post.getLikeCount());

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("success", true);
        result.put("post_id", postId);
        result.put("like_count", post.getLikeCount());
        return result;
    }

    @Override
    public Map<String, Object> addComment(long postId, String userId, String content) {
        if (!StringUtils.hasText(content)) {
            throw new IllegalArgumentException("content must not be blank");
        }
        long authorId = Long.parseLong(userId);
        Comment comment = new Comment(null, postId, authorId, content.trim(), clock.instant());

        Post post = readWriteRouter.write(() -> {
            if (postMapper.incrementCommentCount(postId, comment.getCreatedAt()) == 0) {
                throw new ResourceNotFoundException("Post not found");
            }
            postMapper.insertComment(comment);
            return postMapper.selectById(postId);
        });

        Map<String, Object> commentData = new LinkedHashMap<>();
        commentData.put("id", comment.getId());
        commentData.put("post_id", postId);
        commentData.put("user_id", authorId);
        commentData.put("content", comment.getContent());
        commentData.put("created_at", comment.getCreatedAt().toString());

        apiResponseCache.invalidate(POSTS_CACHE_PREFIX);
        notificationHub.broadcastCommentUpdate(String.valueOf(postId), post.getCommentCount(), commentData);
        if (post.getUserId() != null && post.getUserId() != authorId) {
            Map<String, Object> notification = new LinkedHashMap<>();
            notification.put("type", "comment");
            notification.put("post_id", postId);
            notification.put("from_user_id", authorId);
            notification.put("message", "New comment on your post");
            notificationHub.sendNotification(String.valueOf(post.getUserId()), notification);
        }
        log.info("帖子评论|Post_commented,postId={},userId={},commentCount={}", postId, userId, post.getCommentCount());

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("success", true);
        result.put("comment", commentData);
        return result;
    }
}
