package com.barmm.ledger.audit.dto;

import com.barmm.ledger.chain.ChainRecord;

import java.util.List;

public record EntityHistory(
        String entityType,
        String entityId,
        int totalChanges,
        List<ChainRecord> history
) {}
