package com.example.intel.analysis;

import com.example.intel.model.StockSnapshot;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** 분석 입력의 보유 종목 한 줄. snapshot은 조회 실패 시 error만 채워져 있거나 null */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class HoldingContext {
    private String symbol;
    private Double quantity;
    private Double avgCost;
    private String thesis;
    private StockSnapshot snapshot;
    private Double profitLossPct;
}
