package com.barmm.ledger.store;

import lombok.Builder;

import java.time.Instant;

/**
 * 审计查询条件，全部可选；结果按 seq 倒序（最新在前）。
 *
 * @param search 对 action / entity_type 的不区分大小写包含匹配
 */
@Builder(toBuilder = true)
public record AuditQuery(String actorId,
                         String action,
                         String entityType,
                         String entityId,
                         Instant from,
                         Instant to,
                         String search,
                         int limit,
                         int offset) {

    public AuditQuery {
        if (limit <= 0) limit = 100;
        if (offset < 0) offset = 0;
    }

    /** 小写、去空白后的原始检索词；未给出时为 null */
    public String searchNeedle() {
        return (search == null || search.isBlank()) ? null : search.trim().toLowerCase();
    }

    /** LIKE 模式，% _ \ 按字面匹配（配合 ESCAPE '\'） */
    public String searchPattern() {
        String needle = searchNeedle();
        if (needle == null) return null;
        String escaped = needle.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
        return "%" + escaped + "%";
    }
}
