package com.barmm.ledger.chain;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * 校验发现的断点。这是要报告的事实，不是异常。
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = Finding.HashMismatch.class, name = "HASH_MISMATCH"),
        @JsonSubTypes.Type(value = Finding.LinkMismatch.class, name = "LINK_MISMATCH")
})
public sealed interface Finding permits Finding.HashMismatch, Finding.LinkMismatch {

    String recordId();

    long seq();

    /** 按存储内容重算的 hash 与存储的 record_hash 不一致 */
    record HashMismatch(String recordId, long seq, String expectedHash, String actualHash) implements Finding {
    }

    /** 存储的 prev_hash 没有指向上一条的 record_hash */
    record LinkMismatch(String recordId, long seq, String expectedPrevHash, String actualPrevHash) implements Finding {
    }
}
