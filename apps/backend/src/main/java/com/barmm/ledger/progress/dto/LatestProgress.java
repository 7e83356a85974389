package com.barmm.ledger.progress.dto;

import com.fasterxml.jackson.annotation.JsonFormat;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * 项目最新进度；还没有任何上报时 currentProgress 为 0.0，其余字段为 null。
 */
public record LatestProgress(
        String projectId,
        BigDecimal currentProgress,
        LocalDate lastUpdated,
        String remarks,
        String reportedBy,
        @JsonFormat(shape = JsonFormat.Shape.STRING,
                pattern = "yyyy-MM-dd'T'HH:mm:ss.SSSSSS'Z'", timezone = "UTC")
        Instant recordedAt,
        String recordHash
) {
    public static LatestProgress none(String projectId) {
        return new LatestProgress(projectId, new BigDecimal("0.0"), null, null, null, null, null);
    }
}
