package com.example.intel.model.market;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/** 일봉 시계열(과거 → 최근) */
@Data
public class PriceHistory {
    private String symbol;
    private List<PriceBar> bars = new ArrayList<>();

    public List<Double> closes() {
        List<Double> out = new ArrayList<>(bars.size());
        for (PriceBar b : bars) if (b.getClose() != null) out.add(b.getClose());
        return out;
    }

    public List<Long> volumes() {
        List<Long> out = new ArrayList<>(bars.size());
        for (PriceBar b : bars) if (b.getVolume() != null) out.add(b.getVolume());
        return out;
    }
}
