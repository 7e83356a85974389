package com.barmm.ledger.chain;

import java.util.List;

/**
 * 一次一致性读取得到的整条链（按 seq 升序）及其锚点（可能为 null）。
 */
public record ChainSnapshot(ChainCheckpoint checkpoint, List<ChainRecord> records) {

    public ChainSnapshot {
        records = List.copyOf(records);
    }

    public String anchorHash() {
        return checkpoint == null ? CanonicalHasher.GENESIS : checkpoint.anchorHash();
    }
}
