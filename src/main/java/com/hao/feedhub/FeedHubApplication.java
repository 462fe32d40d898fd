package com.hao.feedhub;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * FeedHub 服务启动入口
 *
 * 类职责：
 * 负责引导 Spring Boot 应用启动与组件扫描。
 *
 * 设计目的：
 * 1. 统一应用启动入口，限流、缓存、读写路由与实时推送组件均由容器装配。
 * 2. 所有共享状态（限流表、本地缓存、连接索引）都挂在容器单例上，生命周期随容器启停。
 *
 * 核心实现思路：
 * - 组合 @SpringBootApplication 完成自动配置与组件扫描。
 */
@SpringBootApplication
public class FeedHubApplication {

    /**
     * 应用主入口
     *
     * @param args 命令行参数
     */
    public static void main(String[] args) {
        // 核心启动入口：触发 Spring Boot 应用启动
        SpringApplication.run(FeedHubApplication.class, args);
    }
}
