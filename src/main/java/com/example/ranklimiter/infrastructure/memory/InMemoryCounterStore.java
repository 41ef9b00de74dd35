package com.example.ranklimiter.infrastructure.memory;

import com.example.ranklimiter.domain.model.WindowCount;
import com.example.ranklimiter.domain.store.CounterStore;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 단일 프로세스용 CounterStore
 *
 * 키 단위 원자성은 Caffeine asMap().compute()로 보장한다.
 */
public class InMemoryCounterStore implements CounterStore {

    private final Cache<String, ExpiringValue<WindowCount>> windows = Caffeine.newBuilder()
            .expireAfter(new ExpiringValuePolicy<WindowCount>(false))
            .build();
    private final Cache<String, ExpiringValue<Instant>> lastAccepted = Caffeine.newBuilder()
            .expireAfter(new ExpiringValuePolicy<Instant>(false))
            .build();

    @Override
    public WindowCount incrementWindow(String key, Duration batchTime, Instant now) {
        ExpiringValue<WindowCount> updated = windows.asMap().compute(key, (k, current) -> {
            WindowCount next = WindowCount.next(current == null ? null : current.getValue(), batchTime, now);
            // 새 윈도우일 때만 TTL 설정
            return next.getCount() == 1
                    ? new ExpiringValue<>(next, batchTime)
                    : ExpiringValue.keep(next);
        });
        return updated.getValue();
    }

    @Override
    public boolean acquireDelaySlot(String key, Duration delay, Instant now) {
        AtomicBoolean accepted = new AtomicBoolean(false);
        lastAccepted.asMap().compute(key, (k, current) -> {
            if (current == null || !now.isBefore(current.getValue().plus(delay))) {
                accepted.set(true);
                return new ExpiringValue<>(now, delay);
            }
            return ExpiringValue.keep(current.getValue());
        });
        return accepted.get();
    }

    @Override
    public Optional<WindowCount> readWindow(String key) {
        return Optional.ofNullable(windows.getIfPresent(key)).map(ExpiringValue::getValue);
    }

    @Override
    public Optional<Instant> readLastAccepted(String key) {
        return Optional.ofNullable(lastAccepted.getIfPresent(key)).map(ExpiringValue::getValue);
    }

    @Override
    public void deleteByPrefix(String prefix) {
        windows.asMap().keySet().removeIf(key -> key.startsWith(prefix));
        lastAccepted.asMap().keySet().removeIf(key -> key.startsWith(prefix));
    }
}
