package com.barmm.ledger.chain;

public enum ChainKind {
    /** 每个项目一条链，同一项目同一天只允许一条 */
    PROGRESS,
    /** 全局一条链，无业务唯一键 */
    AUDIT
}
