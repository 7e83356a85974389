package com.barmm.ledger.chain;

import java.util.List;

/**
 * 整链校验报告。
 *
 * @param recordsChecked 本次重放的记录数
 * @param firstBrokenSeq 第一个断点的 seq，没有断点时为 null
 * @param anchorHash     起算点（创世为空串，清理后为锚点 hash）
 * @param tailHash       最后一条存储的 record_hash，空链为 null
 */
public record VerificationResult(ChainKind kind,
                                 String scopeId,
                                 int recordsChecked,
                                 boolean valid,
                                 Long firstBrokenSeq,
                                 List<Finding> findings,
                                 String anchorHash,
                                 String tailHash) {

    public VerificationResult {
        findings = List.copyOf(findings);
    }
}
