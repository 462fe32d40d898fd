package com.hao.feedhub.common.pagination;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

/**
 * 分页元数据
 * 空字段不输出。
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PaginationMetadata {

    @JsonProperty("has_next")
    private boolean hasNext;

    @JsonProperty("has_previous")
    private boolean hasPrevious;

    @JsonProperty("next_cursor")
    private String nextCursor;

    @JsonProperty("previous_cursor")
    private String previousCursor;

    private Long total;

    private Integer page;

    @JsonProperty("per_page")
    private Integer perPage;
}
