package com.example.intel.config;

import com.example.intel.model.MarketSnapshot;
import com.example.intel.service.cache.SnapshotKey;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class CacheConfig {

    @Bean
    public Cache<SnapshotKey, MarketSnapshot> marketSnapshotCaffeine(BriefingProperties props) {
        Duration ttl = props.getSnapshotFreshness();
        // 0이면 즉시 만료되어 사실상 캐시를 쓰지 않는다
        return Caffeine.newBuilder()
                .maximumSize(ttl.isZero() ? 0 : 1_000)
                .expireAfterWrite(ttl.isZero() ? Duration.ofNanos(1) : ttl)
                .build();
    }
}
