package com.barmm.ledger.mapper.model;

import lombok.Data;

@Data
public class GroupCountRow {
    private String groupKey;
    private Long total;
}
