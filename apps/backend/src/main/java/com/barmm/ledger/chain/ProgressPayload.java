package com.barmm.ledger.chain;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.math.BigDecimal;
import java.time.LocalDate;

public record ProgressPayload(BigDecimal reportedPercent, LocalDate reportDate, String remarks)
        implements RecordPayload {

    @JsonIgnore
    @Override
    public ChainKind kind() {
        return ChainKind.PROGRESS;
    }
}
