package com.example.intel.analysis;

import com.example.intel.exception.MalformedCollaboratorOutputException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;


/**
 * 분석 응답 텍스트 → AnalysisOutput. 코드 펜스는 제거하고,
 * 문서 전체가 JSON 객체가 아닐 때만 실패한다. 손상된 개별 항목은 건너뛴다.
 */
@Component
public class AnalysisOutputParser {

    private static final Logger log = LoggerFactory.getLogger(AnalysisOutputParser.class);

    private final ObjectMapper objectMapper;

    public AnalysisOutputParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public AnalysisOutput parse(String raw) {
        String cleaned = stripFences(raw);
        JsonNode root;
        try {
            root = objectMapper.readTree(cleaned);
        } catch (JsonProcessingException e) {
            log.error("Failed to parse analysis response as JSON: {}", e.getOriginalMessage());
            log.debug("Raw analysis response (first 500 chars): {}", head(raw, 500));
            throw new MalformedCollaboratorOutputException(
                    "Intelligence service returned malformed response. Please try again.", e);
        }
        if (root == null || !root.isObject()) {
            throw new MalformedCollaboratorOutputException(
                    "Intelligence service returned malformed response. Please try again.", null);
        }

        AnalysisOutput out = new AnalysisOutput();
        JsonNode analyses = root.path("holdings_analyses");
        if (analyses.isArray()) {
            for (JsonNode item : analyses) {
                AnalysisItem parsed = toItem(item);
                if (parsed == null) {
                    log.debug("Skipping malformed holdings_analyses entry: {}", head(item.toString(), 200));
                    continue;
                }
                out.getItems().add(parsed);
            }
        }
        out.setPortfolioSummary(text(root.get("portfolio_summary"), ""));

        JsonNode alerts = root.path("risk_alerts");
        if (alerts.isArray()) {
            for (JsonNode a : alerts) {
                String s = text(a, null);
                if (s != null && !s.isBlank()) out.getRiskAlerts().add(s);
            }
        }
        return out;
    }

    private static AnalysisItem toItem(JsonNode item) {
        if (item == null || !item.isObject()) return null;
        String symbol = text(item.get("symbol"), null);
        String analysis = text(item.get("analysis"), null);
        if (symbol == null || symbol.isBlank() || analysis == null || analysis.isBlank()) return null;
        return new AnalysisItem(symbol.trim(), text(item.get("thesis"), null), analysis, text(item.get("sentiment"), null));
    }

    static String stripFences(String raw) {
        if (raw == null) return "";
        String t = raw.trim();
        if (t.startsWith("```")) {
            int nl = t.indexOf('\n');
            t = nl < 0 ? "" : t.substring(nl + 1);
            if (t.endsWith("```")) t = t.substring(0, t.length() - 3);
            t = t.trim();
        }
        return t;
    }

    private static String text(JsonNode node, String dflt) {
        if (node == null || node.isNull() || node.isMissingNode()) return dflt;
        return node.isValueNode() ? node.asText() : dflt;
    }

    private static String head(String s, int n) {
        if (s == null) return "";
        return s.length() <= n ? s : s.substring(0, n);
    }
}
