package com.barmm.ledger.audit.dto;

import java.time.Instant;

public record PurgeResult(
        int daysToKeep,
        Instant cutoff,
        int purged,
        long totalPurged,
        Long anchorSeq,
        String anchorHash
) {}
