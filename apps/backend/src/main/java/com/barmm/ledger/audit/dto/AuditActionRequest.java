package com.barmm.ledger.audit.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

import java.util.Map;

public record AuditActionRequest(
        @NotBlank @Size(max = 100) String action,
        @NotBlank @Size(max = 50) String entityType,
        @Size(max = 64) String entityId,
        Map<String, Object> detail
) {}
