package com.barmm.ledger.error;

import lombok.Getter;

/**
 * 同一项目同一 report_date 已有进度记录。
 */
@Getter
public class DuplicateRecordException extends LedgerException {

    private final String scopeId;
    private final String uniqueKey;

    public DuplicateRecordException(String scopeId, String uniqueKey) {
        super("Progress already reported for date " + uniqueKey
                + " on project " + scopeId + ". Cannot report twice on the same date.");
        this.scopeId = scopeId;
        this.uniqueKey = uniqueKey;
    }

    @Override
    public String code() {
        return "duplicate_record";
    }
}
