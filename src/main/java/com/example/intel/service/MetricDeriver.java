package com.example.intel.service;

import com.example.intel.model.MacroIndicator;
import com.example.intel.model.StockSnapshot;
import com.example.intel.model.market.PriceHistory;
import com.example.intel.model.market.QuoteData;

import java.time.Instant;
import java.util.List;

/**
 * 원시 시세 → 파생 지표. 입력이 부족하면 0이 아니라 null을 돌려준다.
 */
public final class MetricDeriver {

    /** 1개월 = 21거래일 */
    public static final int ONE_MONTH_TRADING_DAYS = 21;
    static final int SHORT_VOLUME_WINDOW = 5;
    static final int LONG_VOLUME_WINDOW = 20;

    private MetricDeriver() {}

    public static Double changePct(Double value, Double previousClose) {
        if (value == null || previousClose == null || previousClose <= 0) return null;
        return (value - previousClose) * 100.0 / previousClose;
    }

    public static Double profitLossPct(Double currentPrice, Double avgCost) {
        if (currentPrice == null || avgCost == null || avgCost <= 0) return null;
        return (currentPrice - avgCost) * 100.0 / avgCost;
    }

    /**
     * 최신 종가 대비 lookback 거래일 전 종가의 변동률. 시계열이 짧으면 가장 오래된 종가를 기준으로 한다.
     */
    public static Double performancePct(List<Double> closes, int lookback) {
        if (closes == null || closes.size() < 2) return null;
        int last = closes.size() - 1;
        int baseIdx = Math.max(0, last - lookback);
        Double base = closes.get(baseIdx);
        Double latest = closes.get(last);
        if (base == null || latest == null || base <= 0) return null;
        return (latest - base) * 100.0 / base;
    }

    public static Double perf1m(List<Double> closes) {
        return performancePct(closes, ONE_MONTH_TRADING_DAYS);
    }

    /** 3개월 일봉 시계열의 첫 종가 기준 */
    public static Double perf3m(List<Double> closes) {
        return closes == null ? null : performancePct(closes, closes.size());
    }

    public static Double volumeRatio(List<Long> volumes) {
        if (volumes == null || volumes.size() < LONG_VOLUME_WINDOW) return null;
        double shortMean = tailMean(volumes, SHORT_VOLUME_WINDOW);
        double longMean = tailMean(volumes, LONG_VOLUME_WINDOW);
        if (longMean == 0.0) return null;
        return shortMean / longMean;
    }

    public static Double distanceFromHighPct(Double price, Double high) {
        if (price == null || high == null || high <= 0) return null;
        return (price - high) * 100.0 / high;
    }

    public static StockSnapshot toStockSnapshot(String symbol, QuoteData quote, PriceHistory history, Instant fetchedAt) {
        StockSnapshot s = new StockSnapshot();
        s.setSymbol(symbol);
        s.setFetchedAt(fetchedAt);
        if (quote != null) {
            s.setCurrentPrice(quote.getPrice());
            s.setFiftyTwoWeekHigh(quote.getFiftyTwoWeekHigh());
            s.setFiftyTwoWeekLow(quote.getFiftyTwoWeekLow());
            s.setPeRatio(quote.getTrailingPe());
            s.setForwardPe(quote.getForwardPe());
            s.setMarketCap(quote.getMarketCap());
        }
        if (history != null) {
            List<Double> closes = history.closes();
            s.setPerf1mPct(perf1m(closes));
            s.setPerf3mPct(perf3m(closes));
            s.setVolumeRatio5d20d(volumeRatio(history.volumes()));
        }
        return s;
    }

    public static MacroIndicator toMacroIndicator(QuoteData quote) {
        MacroIndicator m = new MacroIndicator();
        m.setValue(quote.getPrice());
        m.setPreviousClose(quote.getPreviousClose());
        m.setChangePct(changePct(quote.getPrice(), quote.getPreviousClose()));
        return m;
    }

    public static StockSnapshot errorSnapshot(String symbol, String error, Instant fetchedAt) {
        StockSnapshot s = new StockSnapshot();
        s.setSymbol(symbol);
        s.setError(error);
        s.setFetchedAt(fetchedAt);
        return s;
    }

    public static MacroIndicator errorIndicator(String error) {
        MacroIndicator m = new MacroIndicator();
        m.setError(error);
        return m;
    }

    private static double tailMean(List<Long> values, int n) {
        long sum = 0;
        for (int i = values.size() - n; i < values.size(); i++) sum += values.get(i);
        return (double) sum / n;
    }
}
