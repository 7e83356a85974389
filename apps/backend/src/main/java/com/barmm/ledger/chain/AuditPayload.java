package com.barmm.ledger.chain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 审计负载。detail 参与哈希；ipAddress / userAgent 只作为元数据保存，不参与哈希。
 */
public record AuditPayload(String action,
                           String entityType,
                           String entityId,
                           Map<String, Object> detail,
                           String ipAddress,
                           String userAgent) implements RecordPayload {

    @JsonCreator
    public AuditPayload {
        // detail 里允许 JSON null，所以不用 Map.copyOf
        detail = detail == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(detail));
    }

    public AuditPayload(String action, String entityType, String entityId, Map<String, Object> detail) {
        this(action, entityType, entityId, detail, null, null);
    }

    @JsonIgnore
    @Override
    public ChainKind kind() {
        return ChainKind.AUDIT;
    }
}
