package com.hao.feedhub.dal.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * 职位实体，对应 jobs 表
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class Job {

    private Long id;

    private String title;

    private String company;

    /** 职位分类，列表接口按此过滤 */
    private String category;

    private String location;

    @JsonProperty("created_at")
    private Instant createdAt;
}
