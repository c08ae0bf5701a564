package com.example.intel.util;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/** 비정형 JSON(Map/List) 응답에서 값을 꺼내는 헬퍼. 타입이 맞지 않으면 null. */
public final class JsonMaps {

    private JsonMaps() {}

    @SuppressWarnings("unchecked")
    public static Map<String, Object> asMap(Object o) {
        return (o instanceof Map) ? (Map<String, Object>) o : null;
    }

    public static List<Map<String, Object>> asListOfMap(Object o) {
        if (!(o instanceof List<?> src)) return null;
        List<Map<String, Object>> out = new ArrayList<>(src.size());
        for (Object v : src) {
            Map<String, Object> m = asMap(v);
            if (m != null) out.add(m);
        }
        return out;
    }

    public static List<Object> asList(Object o) {
        if (!(o instanceof List<?> src)) return List.of();
        return new ArrayList<>(src);
    }

    /** 숫자 또는 Yahoo 식 {"raw": 1.23, "fmt": "1.23"} 객체를 Double로 */
    public static Double d(Object o) {
        if (o instanceof Number n) {
            double v = n.doubleValue();
            return Double.isNaN(v) || Double.isInfinite(v) ? null : v;
        }
        Map<String, Object> m = asMap(o);
        if (m != null) return d(m.get("raw"));
        if (o instanceof String s && !s.isBlank()) {
            try {
                return Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    public static Long l(Object o) {
        if (o instanceof Number n) return n.longValue();
        Map<String, Object> m = asMap(o);
        if (m != null) return l(m.get("raw"));
        return null;
    }

    public static String s(Object o) {
        return o == null ? null : String.valueOf(o);
    }
}
