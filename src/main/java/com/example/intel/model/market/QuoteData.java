package com.example.intel.model.market;

import lombok.Data;

/**
 * 공급자 원본 시세. 가공 전 값이며 MetricDeriver를 거쳐 StockSnapshot/MacroIndicator가 된다.
 */
@Data
public class QuoteData {
    private String symbol;
    private Double price;
    private Double previousClose;
    private Double fiftyTwoWeekHigh;
    private Double fiftyTwoWeekLow;
    private Double trailingPe;
    private Double forwardPe;
    private Double marketCap;
}
