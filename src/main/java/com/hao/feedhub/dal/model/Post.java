package com.hao.feedhub.dal.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * 动态帖子实体
 *
 * 对应 posts 表；like_count / comment_count 为冗余计数，点赞与评论时原子自增。
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class Post {

    /** 帖子ID */
    private Long id;

    /** 发布人ID */
    @JsonProperty("user_id")
    private Long userId;

    /** 正文 */
    private String content;

    /** 点赞数 */
    @JsonProperty("like_count")
    private long likeCount;

    /** 评论数 */
    @JsonProperty("comment_count")
    private long commentCount;

    @JsonProperty("created_at")
    private Instant createdAt;

    @JsonProperty("updated_at")
    private Instant updatedAt;
}
