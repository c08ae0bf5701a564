package com.example.intel.service.cache;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Redis L2 캐시. 실패는 캐시 미스로 취급하고 호출 흐름을 막지 않는다.
 */
@Service
public class RedisCacheService {

    private static final Logger log = LoggerFactory.getLogger(RedisCacheService.class);

    private final ReactiveStringRedisTemplate redis;
    private final ObjectMapper mapper;

    public RedisCacheService(ReactiveStringRedisTemplate redis, ObjectMapper mapper) {
        this.redis = redis;
        this.mapper = mapper;
    }

    public <T> Mono<T> get(String key, TypeReference<T> type) {
        return redis.opsForValue().get(key)
                .flatMap(json -> Mono.fromCallable(() -> mapper.readValue(json, type)))
                .onErrorResume(e -> {
                    log.debug("L2 cache get {} skipped: {}", key, e.toString());
                    return Mono.empty();
                });
    }

    public Mono<Boolean> set(String key, Object value, Duration ttl) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) return Mono.just(false);
        return Mono.fromCallable(() -> mapper.writeValueAsString(value))
                .flatMap(js -> redis.opsForValue().set(key, js, ttl))
                .onErrorResume(e -> {
                    log.debug("L2 cache set {} skipped: {}", key, e.toString());
                    return Mono.just(false);
                });
    }
}
