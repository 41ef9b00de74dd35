package com.example.ranklimiter.infrastructure.memory;

import com.example.ranklimiter.domain.model.BreachUpdate;
import com.example.ranklimiter.domain.model.IgnoreGrant;
import com.example.ranklimiter.domain.model.IgnoreScope;
import com.example.ranklimiter.domain.model.RankKey;
import com.example.ranklimiter.domain.model.RankState;
import com.example.ranklimiter.domain.store.RankStore;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.UnaryOperator;

/**
 * 단일 프로세스용 RankStore
 *
 * TTL은 늘어나기만 한다 (진행 중인 차단보다 먼저 만료되지 않도록).
 */
public class InMemoryRankStore implements RankStore {

    private final Cache<String, ExpiringValue<RankState>> states = Caffeine.newBuilder()
            .expireAfter(new ExpiringValuePolicy<RankState>(true))
            .build();
    private final Cache<String, ExpiringValue<IgnoreGrant>> ignores = Caffeine.newBuilder()
            .expireAfter(new ExpiringValuePolicy<IgnoreGrant>(false))
            .build();

    @Override
    public RankState load(RankKey key) {
        ExpiringValue<RankState> stored = states.getIfPresent(key.value());
        return stored == null ? RankState.initial() : stored.getValue();
    }

    @Override
    public RankState recordBreach(RankKey key, BreachUpdate update) {
        return update(key, update.getTtl(), update::applyTo);
    }

    @Override
    public RankState shiftIndex(RankKey key, int delta, int lastIndex, Duration ttl) {
        return update(key, ttl, state -> {
            int index = Math.max(0, Math.min(state.getCurrentIndex() + delta, lastIndex));
            return state.toBuilder().currentIndex(index).build();
        });
    }

    @Override
    public RankState setIndex(RankKey key, int index, Duration ttl) {
        return update(key, ttl, state -> state.toBuilder().currentIndex(index).build());
    }

    @Override
    public RankState block(RankKey key, Instant blockedUntil, Duration ttl) {
        return update(key, ttl, state -> state.toBuilder()
                .blockedUntil(blockedUntil)
                .blockedRank(null)
                .blockedRule(null)
                .build());
    }

    @Override
    public void delete(RankKey key) {
        states.invalidate(key.value());
    }

    @Override
    public void grantIgnore(IgnoreScope scope, IgnoreGrant grant, Duration ttl) {
        ignores.put(scope.key(), new ExpiringValue<>(grant, ttl));
    }

    @Override
    public boolean consumeIgnore(IgnoreScope scope, Instant now) {
        AtomicBoolean ignored = new AtomicBoolean(false);
        ignores.asMap().computeIfPresent(scope.key(), (k, current) -> {
            IgnoreGrant grant = current.getValue();
            if (!grant.isActiveAt(now)) {
                return current;
            }
            ignored.set(true);
            if (!grant.isCountBased()) {
                return current;
            }
            IgnoreGrant remaining = grant.consumeOne();
            // 다 쓴 횟수 면제는 삭제
            return remaining.isActiveAt(now) ? ExpiringValue.keep(remaining) : null;
        });
        return ignored.get();
    }

    @Override
    public Optional<IgnoreGrant> loadIgnore(IgnoreScope scope) {
        return Optional.ofNullable(ignores.getIfPresent(scope.key())).map(ExpiringValue::getValue);
    }

    @Override
    public void clearIgnore(IgnoreScope scope) {
        ignores.invalidate(scope.key());
    }

    private RankState update(RankKey key, Duration ttl, UnaryOperator<RankState> change) {
        ExpiringValue<RankState> updated = states.asMap().compute(key.value(), (k, current) -> {
            RankState state = current == null ? RankState.initial() : current.getValue();
            return new ExpiringValue<>(change.apply(state), ttl);
        });
        return updated.getValue();
    }
}
