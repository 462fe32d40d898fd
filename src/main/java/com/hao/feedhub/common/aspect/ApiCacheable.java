package com.hao.feedhub.common.aspect;

import com.hao.feedhub.common.cache.CacheStrategy;
import com.hao.feedhub.common.constants.CacheConstants;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * 接口响应缓存注解
 *
 * 注解职责：
 * 标记需要做响应级缓存的 GET 接口，并指定缓存时长与缓存策略。
 *
 * 设计目的：
 * 声明式使用，业务代码不感知缓存键、ETag 与缓存头。
 *
 * 使用约束：
 * 被标记的方法必须返回 ResponseEntity。
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface ApiCacheable {

    /**
     * 缓存时长（秒）
     */
    long ttl() default CacheConstants.DEFAULT_TTL_SECONDS;

    /**
     * 缓存策略，决定响应头与是否按用户隔离
     */
    CacheStrategy strategy() default CacheStrategy.PUBLIC_LIST;
}
