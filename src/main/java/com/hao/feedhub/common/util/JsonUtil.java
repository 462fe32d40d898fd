package com.hao.feedhub.common.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;

/**
 * JSON 工具类
 *
 * 类职责：
 * 提供统一的 Jackson 序列化与反序列化入口。
 *
 * 设计目的：
 * 1. 全局复用线程安全的 ObjectMapper，避免重复创建。
 * 2. 提供“稳定序列化”版本：Map 键与对象属性按字母序输出，同一内容永远得到同一字节串，用于 ETag 计算。
 *
 * 核心实现思路：
 * - toJson / toBean 吞掉异常并返回 null，适合缓存读写等可降级场景。
 * - toStableJson 抛出受检异常，由调用方决定是否跳过缓存。
 */
@Slf4j
public final class JsonUtil {

    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    private static final ObjectMapper STABLE_MAPPER = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .build();

    private JsonUtil() {
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    /**
     * 对象序列化为 JSON
     *
     * @param value 任意对象
     * @return JSON 字符串，失败返回 null
     */
    public static String toJson(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.error("JSON序列化失败|Json_serialize_fail,type={}", value == null ? null : value.getClass().getName(), e);
            return null;
        }
    }

    /**
     * 稳定序列化
     * 同一逻辑内容不论 Map 插入顺序如何，都输出相同字符串。
     *
     * @param value 任意对象
     * @return 稳定排序后的 JSON
     * @throws JsonProcessingException 内容无法序列化
     */
    public static String toStableJson(Object value) throws JsonProcessingException {
        // ORDER_MAP_ENTRIES_BY_KEYS 对嵌套 Map 同样生效
        return STABLE_MAPPER.writeValueAsString(value);
    }

    public static <T> T toBean(String json, Class<T> type) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return MAPPER.readValue(json, type);
        } catch (JsonProcessingException e) {
            log.warn("JSON反序列化失败|Json_deserialize_fail,type={},error={}", type.getSimpleName(), e.getMessage());
            return null;
        }
    }

    public static <T> T toBean(String json, TypeReference<T> type) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return MAPPER.readValue(json, type);
        } catch (JsonProcessingException e) {
            log.warn("JSON反序列化失败|Json_deserialize_fail,type={},error={}", type.getType(), e.getMessage());
            return null;
        }
    }
}
