package com.hao.feedhub.common.cache;

import com.hao.feedhub.common.enums.RedisKeysEnum;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * 接口缓存键构造器
 *
 * 键格式：api:{path}?{k1=v1&k2=v2}[|user:{id}]
 * 参数按参数名排序，同名多值按值排序，保证同一组输入永远得到同一个键。
 * 键保持可读（不做哈希），这样按路径前缀失效才可行。
 */
public final class ApiCacheKeyBuilder {

    private ApiCacheKeyBuilder() {
    }

    public static String build(String path, Map<String, String[]> params, CacheStrategy strategy, String userId) {
        StringBuilder key = new StringBuilder(RedisKeysEnum.API_CACHE_PREFIX.join(path));

        Map<String, String[]> sorted = params == null ? new TreeMap<>() : new TreeMap<>(params);
        if (!sorted.isEmpty()) {
            List<String> pairs = new ArrayList<>();
            for (Map.Entry<String, String[]> e : sorted.entrySet()) {
                String[] values = e.getValue() == null ? new String[]{""} : e.getValue().clone();
                Arrays.sort(values);
                for (String value : values) {
                    pairs.add(e.getKey() + "=" + value);
                }
            }
            key.append('?').append(String.join("&", pairs));
        }

        if (strategy.isUserScoped()) {
            key.append("|user:").append(userId);
        }
        return key.toString();
    }

    /**
     * 路径前缀对应的缓存键前缀，用于写操作后的失效
     */
    public static String prefixOf(String pathPrefix) {
        return RedisKeysEnum.API_CACHE_PREFIX.join(pathPrefix);
    }
}
