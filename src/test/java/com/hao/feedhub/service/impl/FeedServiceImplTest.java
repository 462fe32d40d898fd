package com.hao.feedhub.service.impl;

import com.hao.feedhub.common.cache.ApiResponseCache;
import com.hao.feedhub.common.exception.ResourceNotFoundException;
import com.hao.feedhub.common.pagination.PageRequest;
import com.hao.feedhub.common.pagination.PagedResponse;
import com.hao.feedhub.common.pagination.SortDirection;
import com.hao.feedhub.dal.dao.mapper.JobMapper;
import com.hao.feedhub.dal.dao.mapper.PostMapper;
import com.hao.feedhub.dal.model.Comment;
import com.hao.feedhub.dal.model.Job;
import com.hao.feedhub.dal.model.Post;
import com.hao.feedhub.integration.datasource.DataSourceRoute;
import com.hao.feedhub.integration.datasource.ReadWriteRouter;
import com.hao.feedhub.integration.datasource.ReadWriteRoutingDataSource;
import com.hao.feedhub.realtime.NotificationHub;
import com.hao.feedhub.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import javax.sql.DataSource;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * 动态业务服务测试
 *
 * 测试目的：
 * 1. 列表查询在只读作用域内执行，参数正确传给 Mapper。
 * 2. 点赞、评论在主库作用域执行，成功后使缓存失效并推送事件。
 * 3. 帖子不存在时抛出 ResourceNotFoundException，不触发缓存失效与推送。
 *
 * 设计思路：
 * - Mapper、缓存、推送中心使用 Mockito 模拟。
 * - 读写路由使用真实实例，在 Mapper 回调中记录当时的线程路由。
 */
@ExtendWith(MockitoExtension.class)
class FeedServiceImplTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    @Mock
    private PostMapper postMapper;

    @Mock
    private JobMapper jobMapper;

    @Mock
    private ApiResponseCache apiResponseCache;

    @Mock
    private NotificationHub notificationHub;

    private FeedServiceImpl feedService;

    @BeforeEach
    void setUp() {
        ReadWriteRouter router = new ReadWriteRouter(
                new ReadWriteRoutingDataSource(mock(DataSource.class), mock(DataSource.class)), null, null);
        feedService = new FeedServiceImpl(postMapper, jobMapper, router, apiResponseCache, notificationHub, new MutableClock(NOW));
    }

    @Test
    @DisplayName("帖子列表_只读作用域内查询")
    void testListPosts_ReadRoute() {
        AtomicReference<DataSourceRoute> route = new AtomicReference<>();
        when(postMapper.selectKeyset(eq("created_at"), eq(SortDirection.DESC), isNull(), isNull(), eq(3)))
                .thenAnswer(invocation -> {
                    route.set(ReadWriteRoutingDataSource.currentRoute());
                    return List.of(post(3L, 1L), post(2L, 1L), post(1L, 1L));
                });

        PagedResponse<Post> page = feedService.listPosts(PageRequest.builder().limit(2).build());

        assertEquals(DataSourceRoute.REPLICA, route.get());
        assertEquals(2, page.getData().size());
        assertTrue(page.getPagination().isHasNext());
        assertEquals(DataSourceRoute.PRIMARY, ReadWriteRoutingDataSource.currentRoute());
    }

    @Test
    @DisplayName("职位列表_分类过滤与偏移分页总数")
    void testListJobs_CategoryOffset() {
        when(jobMapper.selectOffset("it", "created_at", SortDirection.DESC, 10L, 11))
                .thenReturn(List.of(new Job(5L, "Engineer", "Acme", "it", "Remote", NOW)));
        when(jobMapper.count("it")).thenReturn(11L);

        PagedResponse<Job> page = feedService.listJobs(" it ", PageRequest.builder()
                .page(2).limit(10).includeTotal(true).build());

        assertEquals(1, page.getData().size());
        assertEquals(11L, page.getPagination().getTotal());
        assertEquals(2, page.getPagination().getPage());
    }

    @Test
    @DisplayName("点赞成功_主库执行后失效缓存并广播")
    void testLikePost_Success() {
        AtomicReference<DataSourceRoute> route = new AtomicReference<>();
        when(postMapper.incrementLikeCount(9L, NOW)).thenAnswer(invocation -> {
            route.set(ReadWriteRoutingDataSource.currentRoute());
            return 1;
        });
        Post updated = post(9L, 5L);
        updated.setLikeCount(11);
        when(postMapper.selectById(9L)).thenReturn(updated);

        Map<String, Object> result = feedService.likePost(9L, "7");

        assertEquals(DataSourceRoute.PRIMARY, route.get());
        assertEquals(true, result.get("success"));
        assertEquals(11L, result.get("like_count"));
        verify(apiResponseCache).invalidate("/api/posts");
        verify(notificationHub).broadcastLikeUpdate("9", 11L, "7");
    }

    @Test
    @DisplayName("点赞不存在的帖子_404 且无副作用")
    void testLikePost_NotFound() {
        when(postMapper.incrementLikeCount(9L, NOW)).thenReturn(0);

        assertThrows(ResourceNotFoundException.class, () -> feedService.likePost(9L, "7"));
        verifyNoInteractions(apiResponseCache, notificationHub);
    }

    @Test
    @DisplayName("评论他人帖子_广播评论数并通知作者")
    void testAddComment_NotifiesAuthor() {
        when(postMapper.incrementCommentCount(9L, NOW)).thenReturn(1);
        doAnswer(invocation -> {
            Comment comment = invocation.getArgument(0);
            comment.setId(100L);
            return 1;
        }).when(postMapper).insertComment(any(Comment.class));
        Post updated = post(9L, 5L);
        updated.setCommentCount(3);
        when(postMapper.selectById(9L)).thenReturn(updated);

        Map<String, Object> result = feedService.addComment(9L, "7", "  nice post ");

        @SuppressWarnings("unchecked")
        Map<String, Object> comment = (Map<String, Object>) result.get("comment");
        assertEquals(100L, comment.get("id"));
        assertEquals("nice post", comment.get("content"));
        verify(apiResponseCache).invalidate("/api/posts");
        verify(notificationHub).broadcastCommentUpdate(eq("9"), eq(3L), anyMap());

        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, Object>> notification = ArgumentCaptor.forClass(Map.class);
        verify(notificationHub).sendNotification(eq("5"), notification.capture());
        assertEquals("comment", notification.getValue().get("type"));
        assertEquals(7L, notification.getValue().get("from_user_id"));
    }

    @Test
    @DisplayName("评论自己的帖子_不通知")
    void testAddComment_OwnPost() {
        when(postMapper.incrementCommentCount(9L, NOW)).thenReturn(1);
        when(postMapper.selectById(9L)).thenReturn(post(9L, 7L));

        feedService.addComment(9L, "7", "self");

        verify(notificationHub, never()).sendNotification(anyString(), anyMap());
    }

    @Test
    @DisplayName("空评论_参数异常")
    void testAddComment_Blank() {
        assertThrows(IllegalArgumentException.class, () -> feedService.addComment(9L, "7", "   "));
        verify(postMapper, never()).incrementCommentCount(anyLong(), any());
    }

    @Test
    @DisplayName("评论不存在的帖子_404")
    void testAddComment_NotFound() {
        when(postMapper.incrementCommentCount(9L, NOW)).thenReturn(0);

        assertThrows(ResourceNotFoundException.class, () -> feedService.addComment(9L, "7", "hi"));
        verify(postMapper, never()).insertComment(any());
        verify(notificationHub, never()).broadcastCommentUpdate(anyString(), anyLong(), anyMap());
        verify(postMapper, never()).selectKeyset(anyString(), any(), any(), any(), anyInt());
    }

    private static Post post(long id, long userId) {
        return new Post(id, userId, "content-" + id, 0, 0, NOW, NOW);
    }
}
