package com.barmm.ledger.audit.dto;

import java.util.List;
import java.util.Map;

public record AuditSummary(
        int periodDays,
        long totalActions,
        Map<String, Long> byAction,
        Map<String, Long> byEntityType,
        List<ActorCount> mostActiveActors
) {
    public record ActorCount(String actorId, long count) {}
}
