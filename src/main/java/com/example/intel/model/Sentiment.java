package com.example.intel.model;

import java.util.Locale;

/**
 * 분석 결과의 감성 태그. 응답에는 원본 문자열을 그대로 싣고, 알 수 없는 값은 대문자 원문으로 표시한다.
 * 새 태그가 추가돼도 기존 클라이언트가 깨지지 않아야 하므로 enum으로 강제 변환하지 않는다.
 */
public enum Sentiment {
    BULLISH("bullish", "BULLISH"),
    BEARISH("bearish", "BEARISH"),
    NEUTRAL("neutral", "NEUTRAL"),
    HIGH_CONVICTION_LONG("high-conviction-long", "HIGH CONVICTION LONG"),
    HIGH_CONVICTION_SHORT("high-conviction-short", "HIGH CONVICTION SHORT");

    private final String tag;
    private final String label;

    Sentiment(String tag, String label) {
        this.tag = tag;
        this.label = label;
    }

    public String tag() { return tag; }
    public String label() { return label; }

    /** 인식 가능한 태그면 해당 상수, 아니면 null */
    public static Sentiment from(String raw) {
        if (raw == null) return null;
        String t = raw.trim().toLowerCase(Locale.ROOT).replace('_', '-').replace(' ', '-');
        for (Sentiment s : values()) {
            if (s.tag.equals(t)) return s;
        }
        return null;
    }

    public static String displayLabel(String raw) {
        Sentiment s = from(raw);
        if (s != null) return s.label;
        return raw == null ? "" : raw.trim().toUpperCase(Locale.ROOT);
    }
}
