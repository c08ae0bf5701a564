package com.example.intel.analysis;

import com.example.intel.model.MacroIndicator;
import com.example.intel.model.NewsItem;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AnalysisContext {
    private String portfolioId;
    /** 보유 순서 유지 */
    private List<HoldingContext> holdings = new ArrayList<>();
    /** 설정된 지표 이름 순서. 조회 실패 지표도 "unavailable"로 프롬프트에 남긴다 */
    private List<String> macroIndicatorNames = new ArrayList<>();
    private Map<String, MacroIndicator> macro = new LinkedHashMap<>();
    private Map<String, List<NewsItem>> news = new LinkedHashMap<>();

    public List<NewsItem> newsFor(String symbol) {
        List<NewsItem> items = news == null ? null : news.get(symbol);
        return items == null ? List.of() : items;
    }
}
