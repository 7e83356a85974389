package com.barmm.ledger.chain;

/**
 * 记录负载的标签联合，每种 kind 一个固定 schema。
 */
public sealed interface RecordPayload permits ProgressPayload, AuditPayload {

    ChainKind kind();
}
