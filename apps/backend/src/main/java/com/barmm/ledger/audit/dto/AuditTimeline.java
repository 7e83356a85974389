package com.barmm.ledger.audit.dto;

import java.time.OffsetDateTime;
import java.util.List;

public record AuditTimeline(
        String granularity,
        List<Bucket> timeline
) {
    /** start 为桶起点，带账本时区偏移 */
    public record Bucket(OffsetDateTime start, long count) {}
}
