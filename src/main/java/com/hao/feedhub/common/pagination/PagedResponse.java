package com.hao.feedhub.common.pagination;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 分页响应包装：{success, data, pagination}
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PagedResponse<T> {

    private boolean success;

    private List<T> data;

    private PaginationMetadata pagination;

    public static <T> PagedResponse<T> of(List<T> data, PaginationMetadata pagination) {
        return new PagedResponse<>(true, data, pagination);
    }
}
