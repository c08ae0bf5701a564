package com.example.intel.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 한 번의 조회로 만든 시장 데이터 뷰. 생성 후 변경 불가이므로 캐시에 담아 여러 요청이 공유한다.
 */
@Getter
@EqualsAndHashCode
@ToString
@Schema(description = "시장 스냅샷(단일 as-of 시각)")
public final class MarketSnapshot {

    @JsonProperty("stocks")
    @Schema(description = "종목별 스냅샷")
    private final Map<String, StockSnapshot> stocks;
    @JsonProperty("macro")
    @Schema(description = "매크로 지표")
    private final Map<String, MacroIndicator> macro;
    @JsonProperty("news")
    @Schema(description = "종목별 뉴스(최신순)")
    private final Map<String, List<NewsItem>> news;
    @JsonProperty("fetched_at")
    @Schema(description = "조회 시작 시각")
    private final Instant fetchedAt;

    @JsonCreator
    public MarketSnapshot(@JsonProperty("stocks") Map<String, StockSnapshot> stocks,
                          @JsonProperty("macro") Map<String, MacroIndicator> macro,
                          @JsonProperty("news") Map<String, List<NewsItem>> news,
                          @JsonProperty("fetched_at") Instant fetchedAt) {
        this.stocks = freeze(stocks);
        this.macro = freeze(macro);
        this.news = freeze(news);
        this.fetchedAt = fetchedAt;
    }

    public static MarketSnapshot empty(Instant fetchedAt) {
        return new MarketSnapshot(Map.of(), Map.of(), Map.of(), fetchedAt);
    }

    /** 모든 조회가 실패해 데이터가 하나도 없는 경우 */
    @JsonIgnore
    public boolean isEmpty() {
        return stocks.isEmpty() && macro.isEmpty() && news.isEmpty();
    }

    /** 종목, 매크로 지표, 뉴스 중 하나라도 정상 조회된 경우 */
    @JsonIgnore
    public boolean hasMarketData() {
        for (StockSnapshot s : stocks.values()) if (s.getError() == null) return true;
        for (MacroIndicator m : macro.values()) if (m.getError() == null) return true;
        for (List<NewsItem> items : news.values()) if (items != null && !items.isEmpty()) return true;
        return false;
    }

    public StockSnapshot stock(String symbol) {
        return symbol == null ? null : stocks.get(symbol);
    }

    public List<NewsItem> newsFor(String symbol) {
        List<NewsItem> items = symbol == null ? null : news.get(symbol);
        return items == null ? List.of() : items;
    }

    private static <V> Map<String, V> freeze(Map<String, V> src) {
        if (src == null || src.isEmpty()) return Collections.emptyMap();
        return Collections.unmodifiableMap(new LinkedHashMap<>(src));
    }
}
