package com.hao.feedhub.controller;

import com.hao.feedhub.common.aspect.ApiCacheable;
import com.hao.feedhub.common.cache.CacheStrategy;
import com.hao.feedhub.common.pagination.PageRequest;
import com.hao.feedhub.common.pagination.PagedResponse;
import com.hao.feedhub.dal.model.Job;
import com.hao.feedhub.dal.model.Post;
import com.hao.feedhub.service.FeedService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * 动态与职位控制器
 *
 * 类职责：
 * 提供帖子列表、职位列表、点赞与评论接口，负责参数接收与请求转发。
 *
 * 核心实现思路：
 * - 列表接口通过 @ApiCacheable 声明缓存策略，缓存键、ETag、304 由切面统一处理。
 * - 分页参数原样透传给分页器，模式由参数自动判定。
 * - 用户身份从请求头 userId 读取。
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class FeedController {

    private final FeedService feedService;

    // ===========================
    // 1. 列表
    // ===========================

    /**
     * 帖子列表
     *
     * @return 分页结果，短 TTL 的 POSTS 策略
     */
    @GetMapping("/posts/list")
    @ApiCacheable(ttl = 60, strategy = CacheStrategy.POSTS)
    public ResponseEntity<PagedResponse<Post>> listPosts(
            @RequestParam(value = "cursor", required = false) String cursor,
            @RequestParam(value = "direction", required = false) String direction,
            @RequestParam(value = "skip", required = false) Integer skip,
            @RequestParam(value = "page", required = false) Integer page,
            @RequestParam(value = "limit", required = false) Integer limit,
            @RequestParam(value = "order_by_field", required = false) String orderByField,
            @RequestParam(value = "order_direction", required = false) String orderDirection,
            @RequestParam(value = "include_total", defaultValue = "false") boolean includeTotal) {
        PageRequest request = pageRequest(cursor, direction, skip, page, limit, orderByField, orderDirection, includeTotal);
        return ResponseEntity.ok(feedService.listPosts(request));
    }

    /**
     * 职位列表
     *
     * @param category 分类过滤
     * @return 分页结果，JOBS 策略
     */
    @GetMapping("/jobs/list")
    @ApiCacheable(ttl = 180, strategy = CacheStrategy.JOBS)
    public ResponseEntity<PagedResponse<Job>> listJobs(
            @RequestParam(value = "category", required = false) String category,
            @RequestParam(value = "cursor", required = false) String cursor,
            @RequestParam(value = "direction", required = false) String direction,
            @RequestParam(value = "skip", required = false) Integer skip,
            @RequestParam(value = "page", required = false) Integer page,
            @RequestParam(value = "limit", required = false) Integer limit,
            @RequestParam(value = "order_by_field", required = false) String orderByField,
            @RequestParam(value = "order_direction", required = false) String orderDirection,
            @RequestParam(value = "include_total", defaultValue = "false") boolean includeTotal) {
        PageRequest request = pageRequest(cursor, direction, skip, page, limit, orderByField, orderDirection, includeTotal);
        return ResponseEntity.ok(feedService.listJobs(category, request));
    }

    // ===========================
    // 2. 互动
    // ===========================

    @PostMapping("/posts/{postId}/like")
    public Map<String, Object> likePost(@RequestHeader("userId") String userId, @PathVariable long postId) {
        return feedService.likePost(postId, userId);
    }

    @PostMapping("/posts/{postId}/comments")
    public ResponseEntity<Map<String, Object>> addComment(@RequestHeader("userId") String userId,
                                                          @PathVariable long postId,
                                                          @RequestBody Map<String, String> body) {
        Map<String, Object> result = feedService.addComment(postId, userId, body.get("content"));
        return ResponseEntity.status(HttpStatus.CREATED).body(result);
    }

    private static PageRequest pageRequest(String cursor, String direction, Integer skip, Integer page, Integer limit,
                                           String orderByField, String orderDirection, boolean includeTotal) {
        return PageRequest.builder()
                .cursor(cursor)
                .direction(direction)
                .skip(skip)
                .page(page)
                .limit(limit)
                .orderByField(orderByField)
                .orderDirection(orderDirection)
                .includeTotal(includeTotal)
                .build();
    }
}
