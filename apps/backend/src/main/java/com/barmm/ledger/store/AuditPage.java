package com.barmm.ledger.store;

import com.barmm.ledger.chain.ChainRecord;

import java.util.List;

public record AuditPage(long total, int limit, int offset, List<ChainRecord> items) {
}
