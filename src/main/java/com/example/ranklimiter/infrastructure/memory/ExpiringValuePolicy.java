package com.example.ranklimiter.infrastructure.memory;

import com.github.benmanes.caffeine.cache.Expiry;

import java.time.Duration;

/**
 * 엔트리별 TTL 정책
 *
 * - 생성: 요청한 TTL (없으면 만료 없음)
 * - 갱신: extendOnly 이면 기존 남은 시간보다 길 때만 교체
 * - 나노초로 표현할 수 없는 TTL은 만료 없음으로 취급
 */
final class ExpiringValuePolicy<V> implements Expiry<String, ExpiringValue<V>> {

    private final boolean extendOnly;

    ExpiringValuePolicy(boolean extendOnly) {
        this.extendOnly = extendOnly;
    }

    @Override
    public long expireAfterCreate(String key, ExpiringValue<V> value, long currentTime) {
        return value.getTtl() == null ? Long.MAX_VALUE : toNanos(value.getTtl());
    }

    @Override
    public long expireAfterUpdate(String key, ExpiringValue<V> value, long currentTime, long currentDuration) {
        if (value.getTtl() == null) {
            return currentDuration;
        }
        long requested = toNanos(value.getTtl());
        return extendOnly ? Math.max(requested, currentDuration) : requested;
    }

    @Override
    public long expireAfterRead(String key, ExpiringValue<V> value, long currentTime, long currentDuration) {
        return currentDuration;
    }

    static long toNanos(Duration ttl) {
        try {
            return ttl.toNanos();
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }
}
