package com.hao.feedhub.common.pagination;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.hao.feedhub.common.util.JsonUtil;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.Base64;
import java.util.Iterator;
import java.util.Optional;

/**
 * 游标编解码
 *
 * 类职责：
 * 游标线上格式为 base64url(JSON({"id": int, "ts": iso8601?}))。
 *
 * 核心实现思路：
 * - 解码严格校验：必须是对象、id 必须是 long 范围内的整数、ts 必须是合法时间、不允许多余字段。
 * - JSON 之后不允许再有内容，字段名不允许重复。
 * - 任何不合法输入都返回 Optional.empty()，不抛异常，调用方按“无游标”处理。
 */
@Slf4j
public final class CursorCodec {

    private static final String FIELD_ID = "id";
    private static final String FIELD_TS = "ts";

    private static final ObjectReader STRICT_READER = JsonUtil.mapper().reader()
            .with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
            .with(DeserializationFeature.FAIL_ON_READING_DUP_TREE_KEY)
            .with(JsonParser.Feature.STRICT_DUPLICATE_DETECTION);

    private CursorCodec() {
    }

    public static String encode(Cursor cursor) {
        ObjectNode node = JsonUtil.mapper().createObjectNode();
        node.put(FIELD_ID, cursor.getId());
        if (cursor.getTs() != null) {
            node.put(FIELD_TS, cursor.getTs().toString());
        }
        byte[] json = node.toString().getBytes(StandardCharsets.UTF_8);
        return Base64.getUrlEncoder().encodeToString(json);
    }

    public static Optional<Cursor> decode(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        try {
            byte[] raw = Base64.getUrlDecoder().decode(token.trim());
            JsonNode node = STRICT_READER.readTree(new String(raw, StandardCharsets.UTF_8));
            return Optional.ofNullable(fromNode(node));
        } catch (IllegalArgumentException | JsonProcessingException e) {
            log.debug("游标解析失败_按无游标处理|Cursor_decode_fail,token={},error={}", token, e.getMessage());
            return Optional.empty();
        }
    }

    private static Cursor fromNode(JsonNode node) {
        if (node == null || !node.isObject()) {
            return null;
        }
        Iterator<String> names = node.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            if (!FIELD_ID.equals(name) && !FIELD_TS.equals(name)) {
                return null;
            }
        }

        JsonNode id = node.get(FIELD_ID);
        if (id == null || !id.isIntegralNumber() || !id.canConvertToLong()) {
            return null;
        }

        JsonNode ts = node.get(FIELD_TS);
        if (ts == null || ts.isNull()) {
            return new Cursor(id.longValue(), null);
        }
        if (!ts.isTextual()) {
            return null;
        }
        Instant instant = parseInstant(ts.textValue());
        return instant == null ? null : new Cursor(id.longValue(), instant);
    }

    private static Instant parseInstant(String text) {
        try {
            return Instant.parse(text);
        } catch (DateTimeParseException e) {
            // 兼容带时区偏移的写法，如 2024-05-01T10:00:00+08:00
            try {
                return OffsetDateTime.parse(text).toInstant();
            } catch (DateTimeParseException offsetError) {
                log.debug("游标时间格式非法|Cursor_ts_invalid,ts={}", text);
                return null;
            }
        }
    }
}
