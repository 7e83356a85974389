package com.barmm.ledger.chain;

import java.util.Objects;

/**
 * 一条哈希链的归属：kind + scopeId。
 */
public record ChainScope(ChainKind kind, String scopeId) {

    public ChainScope {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(scopeId, "scopeId");
    }

    /** 锁分段与日志用的键，如 {@code PROGRESS:7f3c...} */
    public String key() {
        return kind.name() + ":" + scopeId;
    }

    @Override
    public String toString() {
        return key();
    }
}
