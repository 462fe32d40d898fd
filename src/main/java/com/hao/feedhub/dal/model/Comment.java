package com.hao.feedhub.dal.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * 帖子评论实体，对应 post_comments 表
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class Comment {

    private Long id;

    @JsonProperty("post_id")
    private Long postId;

    @JsonProperty("user_id")
    private Long userId;

    private String content;

    @JsonProperty("created_at")
    private Instant createdAt;
}
