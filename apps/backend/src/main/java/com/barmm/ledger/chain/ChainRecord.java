package com.barmm.ledger.chain;

import com.fasterxml.jackson.annotation.JsonFormat;

import java.time.Instant;

/**
 * 链上的一条不可变记录。id / seq / createdAt / prevHash / recordHash 只由账本赋值。
 */
public record ChainRecord(String id,
                          ChainKind kind,
                          String scopeId,
                          long seq,
                          RecordPayload payload,
                          String actorId,
                          @JsonFormat(shape = JsonFormat.Shape.STRING,
                                  pattern = "yyyy-MM-dd'T'HH:mm:ss.SSSSSS'Z'", timezone = "UTC")
                          Instant createdAt,
                          String prevHash,
                          String recordHash) {

    public ProgressPayload progress() {
        return (ProgressPayload) payload;
    }

    public AuditPayload audit() {
        return (AuditPayload) payload;
    }

    public ChainScope scope() {
        return new ChainScope(kind, scopeId);
    }
}
