package com.barmm.ledger.chain;

import java.time.Instant;

/**
 * 保留期清理留下的锚点：被删前缀中最后一条记录的 seq 与 recordHash。
 * 校验从 anchorHash 起算，首条保留记录不会被当作断链。
 */
public record ChainCheckpoint(ChainKind kind,
                              String scopeId,
                              long anchorSeq,
                              String anchorHash,
                              long purgedCount,
                              Instant purgedAt) {
}
