package com.barmm.ledger.mapper.model;

import lombok.Data;

import java.time.Instant;

@Data
public class ChainCheckpointRow {
    private String kind;
    private String scopeId;
    private Long anchorSeq;
    private String anchorHash;
    private Long purgedCount;
    private Instant purgedAt;
}
