package com.example.intel.service.news;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 뉴스 검색 확장을 위한 종목 → 주요 경쟁사 매핑. 목록에 없는 종목은 본인만 검색한다.
 */
public final class CompetitorDirectory {

    private static final Map<String, List<String>> COMPETITORS = Map.ofEntries(
            // 메가캡 테크
            Map.entry("AAPL", List.of("MSFT", "GOOG", "SAMSUNG", "META")),
            Map.entry("MSFT", List.of("AAPL", "GOOG", "AMZN", "CRM")),
            Map.entry("GOOG", List.of("MSFT", "META", "AAPL", "AMZN")),
            Map.entry("GOOGL", List.of("MSFT", "META", "AAPL", "AMZN")),
            Map.entry("AMZN", List.of("MSFT", "GOOG", "WMT", "SHOP")),
            Map.entry("META", List.of("GOOG", "SNAP", "PINS", "TIKTOK")),
            Map.entry("NVDA", List.of("AMD", "INTC", "AVGO", "QCOM")),
            Map.entry("TSLA", List.of("RIVN", "GM", "F", "BYD", "LCID")),
            // 반도체
            Map.entry("AMD", List.of("NVDA", "INTC", "QCOM", "AVGO")),
            Map.entry("INTC", List.of("AMD", "NVDA", "TSM", "QCOM")),
            Map.entry("AVGO", List.of("QCOM", "TXN", "NVDA", "MRVL")),
            Map.entry("TSM", List.of("INTC", "SAMSUNG", "GFS", "UMC")),
            // 금융
            Map.entry("JPM", List.of("BAC", "GS", "MS", "C")),
            Map.entry("GS", List.of("MS", "JPM", "BAC", "UBS")),
            Map.entry("V", List.of("MA", "PYPL", "SQ", "ADYEN")),
            Map.entry("MA", List.of("V", "PYPL", "SQ", "ADYEN")),
            // 헬스케어
            Map.entry("UNH", List.of("CVS", "CI", "HUM", "ELV")),
            Map.entry("JNJ", List.of("PFE", "MRK", "ABT", "LLY")),
            Map.entry("LLY", List.of("NVO", "MRK", "PFE", "ABBV")),
            // 에너지
            Map.entry("XOM", List.of("CVX", "COP", "BP", "SHEL")),
            Map.entry("CVX", List.of("XOM", "COP", "BP", "TTE")),
            // 소비재
            Map.entry("WMT", List.of("COST", "TGT", "AMZN", "KR")),
            Map.entry("COST", List.of("WMT", "TGT", "BJ", "KR")),
            Map.entry("DIS", List.of("NFLX", "CMCSA", "WBD", "PARA")),
            Map.entry("NFLX", List.of("DIS", "WBD", "PARA", "CMCSA"))
    );

    private CompetitorDirectory() {}

    public static List<String> competitorsOf(String symbol) {
        if (symbol == null) return List.of();
        return COMPETITORS.getOrDefault(symbol.trim().toUpperCase(Locale.ROOT), List.of());
    }

    /** "AAPL OR MSFT OR ..." 형태의 검색어. 경쟁사는 최대 limit개 */
    public static String searchQuery(String symbol, int limit) {
        StringBuilder sb = new StringBuilder(symbol.trim().toUpperCase(Locale.ROOT));
        List<String> comps = competitorsOf(symbol);
        for (int i = 0; i < comps.size() && i < limit; i++) sb.append(" OR ").append(comps.get(i));
        return sb.toString();
    }
}
