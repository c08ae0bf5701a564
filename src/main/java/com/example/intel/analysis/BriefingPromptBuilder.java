package com.example.intel.analysis;

import com.example.intel.model.MacroIndicator;
import com.example.intel.model.NewsItem;
import com.example.intel.model.StockSnapshot;
import com.example.intel.service.MetricDeriver;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 분석 요청 프롬프트. 시스템 프롬프트는 prompts/briefing-system.txt, 사용자 메시지는
 * 매크로 → 보유 종목(시세/헤드라인) 순으로 구성한다.
 */
@Component
public class BriefingPromptBuilder {

    static final String SYSTEM_PROMPT_LOCATION = "prompts/briefing-system.txt";
    static final int MAX_HEADLINES = 7;

    private static final Map<String, String> MACRO_LABELS = Map.of(
            "VIX", "VIX (Fear Index)",
            "US_10Y_YIELD", "US 10Y Treasury Yield",
            "DXY", "US Dollar Index (DXY)",
            "CRUDE_OIL", "WTI Crude Oil"
    );

    private final String systemPrompt;

    public BriefingPromptBuilder() {
        this.systemPrompt = load(SYSTEM_PROMPT_LOCATION);
    }

    public String systemPrompt() {
        return systemPrompt;
    }

    public String userMessage(AnalysisContext ctx) {
        List<String> lines = new ArrayList<>();
        lines.add("Here is my current portfolio with LIVE MARKET DATA. Analyze each position and the portfolio as a whole.\n");
        lines.add(macroSection(ctx));

        int i = 1;
        for (HoldingContext h : ctx.getHoldings()) {
            String thesis = (h.getThesis() == null || h.getThesis().isBlank())
                    ? "  Thesis: None provided"
                    : "  Thesis: \"" + h.getThesis() + "\"";
            lines.add("Position " + (i++) + ": " + h.getSymbol() + "\n"
                    + "  Shares: " + plain(h.getQuantity()) + "\n"
                    + "  Avg Cost: " + (h.getAvgCost() == null ? "n/a" : fmt("$%.2f", h.getAvgCost())) + "\n"
                    + thesis);
            lines.add(stockSection(h.getSymbol(), h.getSnapshot(), ctx.newsFor(h.getSymbol())));
        }
        return String.join("\n", lines);
    }

    String macroSection(AnalysisContext ctx) {
        List<String> lines = new ArrayList<>();
        lines.add("=== MACRO ENVIRONMENT (LIVE DATA) ===");
        Map<String, MacroIndicator> macro = ctx.getMacro();
        for (String name : ctx.getMacroIndicatorNames()) {
            String label = MACRO_LABELS.getOrDefault(name, name);
            MacroIndicator m = macro == null ? null : macro.get(name);
            if (m == null || m.getValue() == null) {
                lines.add("  " + label + ": unavailable");
                continue;
            }
            Double change = MetricDeriver.changePct(m.getValue(), m.getPreviousClose());
            String changeStr = change == null ? "" : fmt(" (%+.2f%% vs prev close)", change);
            lines.add("  " + label + ": " + plain(m.getValue()) + changeStr);
        }
        lines.add("");
        return String.join("\n", lines);
    }

    String stockSection(String symbol, StockSnapshot s, List<NewsItem> news) {
        List<String> lines = new ArrayList<>();
        lines.add("  --- Market Data for " + symbol + " ---");

        if (s == null) {
            lines.add("  (Data unavailable)");
        } else if (s.getError() != null) {
            lines.add("  (Data unavailable: " + s.getError() + ")");
        } else {
            Double price = s.getCurrentPrice();
            if (price != null) lines.add(fmt("  Current Price: $%,.2f", price));

            Double high = s.getFiftyTwoWeekHigh();
            Double low = s.getFiftyTwoWeekLow();
            if (high != null && low != null) {
                lines.add(fmt("  52-Week Range: $%,.2f - $%,.2f", low, high));
                Double dist = MetricDeriver.distanceFromHighPct(price, high);
                if (dist != null) lines.add(fmt("  Distance from 52W High: %+.1f%%", dist));
            }

            if (s.getPeRatio() != null) {
                String pe = fmt("  Trailing P/E: %.1f", s.getPeRatio());
                if (s.getForwardPe() != null) pe += fmt("  |  Forward P/E: %.1f", s.getForwardPe());
                lines.add(pe);
            }

            if (s.getMarketCap() != null) lines.add("  Market Cap: " + marketCap(s.getMarketCap()));

            List<String> perf = new ArrayList<>();
            if (s.getPerf1mPct() != null) perf.add(fmt("1M: %+.1f%%", s.getPerf1mPct()));
            if (s.getPerf3mPct() != null) perf.add(fmt("3M: %+.1f%%", s.getPerf3mPct()));
            if (!perf.isEmpty()) lines.add("  Price Performance: " + String.join(" | ", perf));

            Double vr = s.getVolumeRatio5d20d();
            if (vr != null) lines.add(fmt("  Volume (5d/20d avg): %.2fx (%s)", vr, volumeTrend(vr)));
        }

        if (news != null && !news.isEmpty()) {
            lines.add("  Recent Headlines (" + symbol + " + competitors):");
            for (int i = 0; i < news.size() && i < MAX_HEADLINES; i++) {
                NewsItem n = news.get(i);
                String src = (n.getSource() == null || n.getSource().isBlank()) ? "" : " [" + n.getSource() + "]";
                lines.add("    - " + n.getTitle() + src);
            }
        }
        lines.add("");
        return String.join("\n", lines);
    }

    static String volumeTrend(double ratio) {
        if (ratio > 1.2) return "elevated";
        if (ratio < 0.8) return "subdued";
        return "normal";
    }

    static String marketCap(double cap) {
        if (cap >= 1e12) return fmt("$%.2fT", cap / 1e12);
        if (cap >= 1e9) return fmt("$%.1fB", cap / 1e9);
        return fmt("$%.0fM", cap / 1e6);
    }

    private static String plain(Double v) {
        if (v == null) return "n/a";
        return BigDecimal.valueOf(v).stripTrailingZeros().toPlainString();
    }

    private static String fmt(String pattern, Object... args) {
        return String.format(Locale.US, pattern, args);
    }

    private static String load(String location) {
        try (InputStream in = new ClassPathResource(location).getInputStream()) {
            return StreamUtils.copyToString(in, StandardCharsets.UTF_8).trim();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot load prompt " + location, e);
        }
    }
}
