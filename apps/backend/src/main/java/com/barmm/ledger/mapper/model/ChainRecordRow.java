package com.barmm.ledger.mapper.model;

import lombok.Data;

import java.time.Instant;

@Data
public class ChainRecordRow {
    private String id;
    private String kind;        // PROGRESS / AUDIT
    private String scopeId;
    private Long seq;
    private String uniqueKey;   // 进度为 report_date，审计为 null
    private String action;      // 以下三列仅审计使用，冗余出来便于过滤
    private String entityType;
    private String entityId;
    private String payloadJson;
    private String actorId;
    private Instant createdAt;
    private String prevHash;
    private String recordHash;
}
