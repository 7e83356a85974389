package com.barmm.ledger.chain;

import com.fasterxml.jackson.core.StreamWriteFeature;
import com.fasterxml.jackson.core.json.JsonWriteFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 规范化哈希。后端、校验客户端、移动端必须逐字节一致：
 * <ul>
 *   <li>JSON 对象，键按码点字典序，无多余空白</li>
 *   <li>非 ASCII 字符一律转义成 {@code \\uXXXX}（小写十六进制，增补平面字符拆成代理对）</li>
 *   <li>小数写成定点文本，至少一位小数（10.0，而不是 10 或 1e1）</li>
 *   <li>日期 {@code yyyy-MM-dd}，时间戳 UTC {@code yyyy-MM-dd'T'HH:mm:ss.SSSSSS'Z'}</li>
 *   <li>prev_hash 缺省写成 {@code ""}，不省略、不写 null</li>
 *   <li>SHA-256(UTF-8)，小写十六进制</li>
 * </ul>
 * 纯函数：无 I/O、无随机数。
 */
public final class CanonicalHasher {
    private CanonicalHasher() {}

    /** 每条链第一条记录的 prev_hash */
    public static final String GENESIS = "";

    public static final DateTimeFormatter TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSSSSS'Z'").withZone(ZoneOffset.UTC);

    // 独立的 mapper：不受 Spring 全局 Jackson 配置影响
    private static final ObjectMapper CANONICAL = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(SerializationFeature.INDENT_OUTPUT)
            .enable(StreamWriteFeature.WRITE_BIGDECIMAL_AS_PLAIN)
            .enable(JsonWriteFeature.ESCAPE_NON_ASCII)
            .disable(JsonWriteFeature.WRITE_HEX_UPPER_CASE)
            .build();

    public static String sha256Hex(String s) {
        try {
            var md = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(md.digest(s.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /** 字段 + prev_hash 的规范 JSON 文本 */
    public static String canonicalize(Map<String, ?> fields, String prevHash) {
        Map<String, Object> all = new LinkedHashMap<>(fields);
        all.put("prev_hash", prevHash == null ? GENESIS : prevHash);
        JsonNode node = CANONICAL.valueToTree(all);
        return JsonCanonicalizer.canonicalize(CANONICAL, node);
    }

    public static String hash(Map<String, ?> fields, String prevHash) {
        return sha256Hex(canonicalize(fields, prevHash));
    }

    /** 按 kind 取固定字段集后计算 record_hash */
    public static String recordHash(String scopeId, RecordPayload payload, String actorId,
                                    Instant createdAt, String prevHash) {
        return hash(hashFields(scopeId, payload, actorId, createdAt), prevHash);
    }

    public static String recordHash(ChainRecord record, String prevHash) {
        return recordHash(record.scopeId(), record.payload(), record.actorId(), record.createdAt(), prevHash);
    }

    public static Map<String, Object> hashFields(String scopeId, RecordPayload payload, String actorId, Instant createdAt) {
        if (payload instanceof ProgressPayload p) {
            return progressFields(scopeId, p.reportedPercent(), p.reportDate(), actorId);
        }
        if (payload instanceof AuditPayload a) {
            return auditFields(actorId, a.action(), a.entityType(), a.entityId(), a.detail(), createdAt);
        }
        throw new IllegalArgumentException("Unsupported payload " + payload);
    }

    /** remarks 与 created_at 不参与进度哈希；report_date 即时间维度 */
    public static Map<String, Object> progressFields(String projectId, BigDecimal reportedPercent,
                                                     LocalDate reportDate, String reportedBy) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("project_id", projectId);
        m.put("reported_percent", decimal(reportedPercent));
        m.put("report_date", date(reportDate));
        m.put("reported_by", reportedBy);
        return m;
    }

    /** 审计链只有一个全局 scope，scope id 不参与哈希 */
    public static Map<String, Object> auditFields(String actorId, String action, String entityType,
                                                  String entityId, Map<String, ?> detail, Instant createdAt) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("actor_id", nullToEmpty(actorId));
        m.put("action", action);
        m.put("entity_type", entityType);
        m.put("entity_id", nullToEmpty(entityId));
        m.put("payload", detail == null ? Map.of() : detail);
        m.put("created_at", timestamp(createdAt));
        return m;
    }

    public static BigDecimal decimal(BigDecimal value) {
        return value == null ? null : JsonCanonicalizer.fixedPoint(value);
    }

    public static String date(LocalDate date) {
        return date == null ? "" : date.toString();
    }

    public static String timestamp(Instant instant) {
        return instant == null ? "" : TIMESTAMP.format(instant);
    }

    /** 把任意 detail 转成纯 JSON 结构（Map/List/String/Number/Boolean），保证存什么就哈希什么 */
    @SuppressWarnings("unchecked")
    public static Map<String, Object> plainDetail(Map<String, ?> detail) {
        if (detail == null || detail.isEmpty()) return Map.of();
        return CANONICAL.convertValue(detail, LinkedHashMap.class);
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
