package com.barmm.ledger.error;

import lombok.Getter;

/**
 * 写入时 (kind, scope_id, seq) 已被别的写者占用：本次什么都没写，可以重读链尾后重来。
 * 只在存储层与 AppendCoordinator 之间流转，不会抛给调用方。
 */
@Getter
public class ChainConflictException extends LedgerException {

    private final String scopeKey;
    private final long seq;

    public ChainConflictException(String scopeKey, long seq) {
        super("Chain position " + seq + " of " + scopeKey + " was taken by a concurrent writer");
        this.scopeKey = scopeKey;
        this.seq = seq;
    }

    public ChainConflictException(String scopeKey, long seq, Throwable cause) {
        super("Chain position " + seq + " of " + scopeKey + " was taken by a concurrent writer", cause);
        this.scopeKey = scopeKey;
        this.seq = seq;
    }

    @Override
    public String code() {
        return "chain_conflict";
    }
}
