package com.example.intel.http;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/** Yahoo 세션 쿠키 보관소. crumb 발급이 쿠키(A1/A3)에 묶여 있어 요청 간에 유지한다. */
public class CookieStore {
    private final Map<String, String> jar = new ConcurrentHashMap<>();

    public void put(String name, String value) {
        if (name != null && !name.isBlank()) {
            jar.put(name.trim(), value == null ? "" : value);
        }
    }

    /** Set-Cookie 헤더 목록을 그대로 흡수 */
    public void absorb(List<String> setCookieLines) {
        if (setCookieLines == null) return;
        for (String line : setCookieLines) {
            String nv = extractNameValue(line);
            if (nv == null) continue;
            int eq = nv.indexOf('=');
            put(nv.substring(0, eq), nv.substring(eq + 1));
        }
    }

    public boolean isEmpty() {
        return jar.isEmpty();
    }

    public void clear() {
        jar.clear();
    }

    /** 요청에 보낼 Cookie 헤더 값 */
    public String asCookieHeader() {
        if (jar.isEmpty()) return "";
        return jar.entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining("; "));
    }

    /**
     * Set-Cookie 한 줄에서 name=value 추출 (path, expires 등 제거)
     * e.g. "A1=abc; Expires=...; Path=/; Secure" -> "A1=abc"
     */
    public static String extractNameValue(String setCookieLine) {
        if (setCookieLine == null) return null;
        int semi = setCookieLine.indexOf(';');
        String first = (semi > 0 ? setCookieLine.substring(0, semi) : setCookieLine).trim();
        int eq = first.indexOf('=');
        return (eq > 0) ? first : null;
    }
}
