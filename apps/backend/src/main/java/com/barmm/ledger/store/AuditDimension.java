package com.barmm.ledger.store;

public enum AuditDimension {
    ACTION("action"),
    ENTITY_TYPE("entity_type"),
    ACTOR("actor_id");

    private final String column;

    AuditDimension(String column) {
        this.column = column;
    }

    /** 受控的列名，供 SQL 分组使用 */
    public String column() {
        return column;
    }
}
