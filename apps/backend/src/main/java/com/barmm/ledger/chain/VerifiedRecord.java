package com.barmm.ledger.chain;

/**
 * 历史展示用：记录本身加上逐条校验结果。
 */
public record VerifiedRecord(ChainRecord record, boolean hashValid) {
}
