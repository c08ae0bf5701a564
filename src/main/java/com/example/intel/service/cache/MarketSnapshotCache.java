package com.example.intel.service.cache;

import com.example.intel.config.BriefingProperties;
import com.example.intel.model.MarketSnapshot;
import com.github.benmanes.caffeine.cache.Cache;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * 짧은 신선도 창 안에서 같은 종목/지표 집합의 스냅샷을 공유한다.
 * 만료는 Caffeine TTL과 fetched_at 기준 재검사 두 겹으로 처리한다.
 */
@Component
public class MarketSnapshotCache {

    private final Cache<SnapshotKey, MarketSnapshot> cache;
    private final Duration freshness;
    private final Clock clock;

    public MarketSnapshotCache(Cache<SnapshotKey, MarketSnapshot> cache, BriefingProperties props, Clock clock) {
        this.cache = cache;
        this.freshness = props.getSnapshotFreshness();
        this.clock = clock;
    }

    public MarketSnapshot getFresh(SnapshotKey key) {
        if (!isEnabled()) return null;
        MarketSnapshot s = cache.getIfPresent(key);
        if (s == null) return null;
        Instant notOlderThan = Instant.now(clock).minus(freshness);
        if (s.getFetchedAt() == null || s.getFetchedAt().isBefore(notOlderThan)) {
            cache.invalidate(key);
            return null;
        }
        return s;
    }

    /** 데이터가 하나도 없는 스냅샷은 담지 않는다 */
    public void put(SnapshotKey key, MarketSnapshot snapshot) {
        if (!isEnabled() || snapshot == null || snapshot.isEmpty()) return;
        cache.put(key, snapshot);
    }

    public boolean isEnabled() {
        return freshness != null && !freshness.isZero() && !freshness.isNegative();
    }
}
