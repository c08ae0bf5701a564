package com.example.intel.model.doc;

import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

@Getter
@Setter
public class HoldingDoc {
    private String holdingId;    // uuid. 내장 문서라 _id 매핑을 피한다
    private String symbol;
    private Double quantity;
    private Double avgCost;
    private String thesis;
    private Instant updatedAt;
}
