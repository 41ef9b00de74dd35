package com.example.ranklimiter.infrastructure.memory;

import lombok.Getter;

import java.time.Duration;

/**
 * Caffeine 엔트리 값 + 이번 쓰기에서 요청한 TTL
 *
 * ttl == null 이면 기존 만료 시각을 유지한다.
 */
@Getter
final class ExpiringValue<V> {

    private final V value;
    private final Duration ttl;

    ExpiringValue(V value, Duration ttl) {
        this.value = value;
        this.ttl = ttl;
    }

    static <V> ExpiringValue<V> keep(V value) {
        return new ExpiringValue<>(value, null);
    }
}
