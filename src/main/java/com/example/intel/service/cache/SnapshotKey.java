package com.example.intel.service.cache;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * 스냅샷 캐시 키. 조회 순서와 무관하게 같은 종목/지표 집합이면 같은 키가 된다.
 */
public final class SnapshotKey {

    private final List<String> symbols;
    private final Map<String, String> indicators;

    private SnapshotKey(List<String> symbols, Map<String, String> indicators) {
        this.symbols = symbols;
        this.indicators = indicators;
    }

    public static SnapshotKey of(Collection<String> symbols, Map<String, String> indicators) {
        return new SnapshotKey(
                List.copyOf(new TreeSet<>(symbols)),
                Map.copyOf(new TreeMap<>(indicators)));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SnapshotKey other)) return false;
        return symbols.equals(other.symbols) && indicators.equals(other.indicators);
    }

    @Override
    public int hashCode() {
        return 31 * symbols.hashCode() + indicators.hashCode();
    }

    @Override
    public String toString() {
        return "SnapshotKey" + symbols + indicators.keySet();
    }
}
