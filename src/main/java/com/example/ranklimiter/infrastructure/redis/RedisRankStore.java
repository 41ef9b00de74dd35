package com.example.ranklimiter.infrastructure.redis;

import com.example.ranklimiter.domain.model.BreachUpdate;
import com.example.ranklimiter.domain.model.IgnoreGrant;
import com.example.ranklimiter.domain.model.IgnoreScope;
import com.example.ranklimiter.domain.model.RankKey;
import com.example.ranklimiter.domain.model.RankState;
import com.example.ranklimiter.domain.store.RankStore;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Redis 기반 RankStore
 *
 * 키 구조: {prefix}:{endpoint}:{group}:{uniqueId} -> HASH
 *   index, blocked_until(epoch millis), blocked_rank, blocked_rule
 *
 * 모든 스크립트는 갱신 후 상태를 {index, blocked_until, blocked_rank, blocked_rule}로 반환.
 * 없는 필드는 -1 (index는 0).
 * TTL은 늘어나기만 한다.
 *
 * 면제: {prefix}:{scope key} -> HASH {times} 또는 {until(epoch millis)}
 */
public class RedisRankStore implements RankStore {

    private static final String FUNCTIONS = """
            local function state(key)
                local v = redis.call("HMGET", key, "index", "blocked_until", "blocked_rank", "blocked_rule")
                return {tonumber(v[1]) or 0, tonumber(v[2]) or -1, tonumber(v[3]) or -1, tonumber(v[4]) or -1}
            end

            local function extend(key, ttl)
                if redis.call("PTTL", key) < tonumber(ttl) then
                    redis.call("PEXPIRE", key, ttl)
                end
            end
            """;

    private static final String LOAD_SCRIPT = FUNCTIONS + """
            return state(KEYS[1])
            """;

    private static final String BREACH_SCRIPT = FUNCTIONS + """
            local key = KEYS[1]
            local observed = tonumber(ARGV[1])
            local escalate = ARGV[2] == "1"
            local last = tonumber(ARGV[3])
            local blocked_until = tonumber(ARGV[4])

            local current = state(key)
            local index = math.min(current[1], last)

            -- 이번 평가에 쓴 등급이 아직 그대로일 때만 한 단계 상승
            if escalate and index == observed and index < last then
                index = index + 1
            end
            redis.call("HSET", key, "index", index)

            -- 차단 시각은 늘어나기만 한다
            if current[2] < blocked_until then
                redis.call("HSET", key, "blocked_until", ARGV[4], "blocked_rank", ARGV[5], "blocked_rule", ARGV[6])
            end

            extend(key, ARGV[7])
            return state(key)
            """;

    private static final String SHIFT_SCRIPT = FUNCTIONS + """
            local key = KEYS[1]
            local index = state(key)[1] + tonumber(ARGV[1])
            local last = tonumber(ARGV[2])

            if index < 0 then
                index = 0
            end
            if index > last then
                index = last
            end

            redis.call("HSET", key, "index", index)
            extend(key, ARGV[3])
            return state(key)
            """;

    private static final String SET_INDEX_SCRIPT = FUNCTIONS + """
            redis.call("HSET", KEYS[1], "index", ARGV[1])
            extend(KEYS[1], ARGV[2])
            return state(KEYS[1])
            """;

    private static final String BLOCK_SCRIPT = FUNCTIONS + """
            redis.call("HSET", KEYS[1], "blocked_until", ARGV[1])
            redis.call("HDEL", KEYS[1], "blocked_rank", "blocked_rule")
            extend(KEYS[1], ARGV[2])
            return state(KEYS[1])
            """;

    private static final String GRANT_IGNORE_SCRIPT = """
            redis.call("DEL", KEYS[1])
            redis.call("HSET", KEYS[1], ARGV[1], ARGV[2])
            redis.call("PEXPIRE", KEYS[1], ARGV[3])
            return {1}
            """;

    private static final String CONSUME_IGNORE_SCRIPT = """
            local v = redis.call("HMGET", KEYS[1], "times", "until")
            local times = tonumber(v[1])
            local until_ms = tonumber(v[2])

            if times and times > 0 then
                if times == 1 then
                    redis.call("DEL", KEYS[1])
                else
                    redis.call("HSET", KEYS[1], "times", times - 1)
                end
                return {1}
            end

            if until_ms and until_ms >= tonumber(ARGV[1]) then
                return {1}
            end
            return {0}
            """;

    private static final String LOAD_IGNORE_SCRIPT = """
            local v = redis.call("HMGET", KEYS[1], "times", "until")
            return {tonumber(v[1]) or -1, tonumber(v[2]) or -1}
            """;

    private final RedisScriptExecutor scriptExecutor;
    private final String keyPrefix;

    public RedisRankStore(RedisScriptExecutor scriptExecutor, String keyPrefix) {
        this.scriptExecutor = scriptExecutor;
        this.keyPrefix = keyPrefix;
    }

    @Override
    public RankState load(RankKey key) {
        return execute(LOAD_SCRIPT, key, List.of());
    }

    @Override
    public RankState recordBreach(RankKey key, BreachUpdate update) {
        return execute(BREACH_SCRIPT, key, List.of(
                String.valueOf(update.getObservedIndex()),
                update.isEscalate() ? "1" : "0",
                String.valueOf(update.getLastIndex()),
                String.valueOf(update.getBlockedUntil().toEpochMilli()),
                String.valueOf(update.getBlockedRank()),
                String.valueOf(update.getBlockedRule()),
                String.valueOf(update.getTtl().toMillis())
        ));
    }

    @Override
    public RankState shiftIndex(RankKey key, int delta, int lastIndex, Duration ttl) {
        return execute(SHIFT_SCRIPT, key, List.of(
                String.valueOf(delta),
                String.valueOf(lastIndex),
                String.valueOf(ttl.toMillis())
        ));
    }

    @Override
    public RankState setIndex(RankKey key, int index, Duration ttl) {
        return execute(SET_INDEX_SCRIPT, key, List.of(
                String.valueOf(index),
                String.valueOf(ttl.toMillis())
        ));
    }

    @Override
    public RankState block(RankKey key, Instant blockedUntil, Duration ttl) {
        return execute(BLOCK_SCRIPT, key, List.of(
                String.valueOf(blockedUntil.toEpochMilli()),
                String.valueOf(ttl.toMillis())
        ));
    }

    @Override
    public void delete(RankKey key) {
        scriptExecutor.deleteKeys(RedisKeys.join(keyPrefix, key.value()));
    }

    @Override
    public void grantIgnore(IgnoreScope scope, IgnoreGrant grant, Duration ttl) {
        String field = grant.isCountBased() ? "times" : "until";
        String value = grant.isCountBased()
                ? String.valueOf(grant.getRemainingTimes())
                : String.valueOf(grant.getUntil().toEpochMilli());

        scriptExecutor.executeLuaScript(GRANT_IGNORE_SCRIPT, List.of(ignoreKey(scope)),
                List.of(field, value, String.valueOf(ttl.toMillis())));
    }

    @Override
    public boolean consumeIgnore(IgnoreScope scope, Instant now) {
        List<Long> result = scriptExecutor.executeLuaScript(CONSUME_IGNORE_SCRIPT,
                List.of(ignoreKey(scope)), List.of(String.valueOf(now.toEpochMilli())));
        return !result.isEmpty() && result.get(0) == 1L;
    }

    @Override
    public Optional<IgnoreGrant> loadIgnore(IgnoreScope scope) {
        List<Long> result = scriptExecutor.executeLuaScript(LOAD_IGNORE_SCRIPT,
                List.of(ignoreKey(scope)), List.of());
        long times = result.get(0);
        long until = result.get(1);

        if (times > 0) {
            return Optional.of(IgnoreGrant.forTimes((int) times));
        }
        if (until >= 0) {
            return Optional.of(IgnoreGrant.until(Instant.ofEpochMilli(until)));
        }
        return Optional.empty();
    }

    @Override
    public void clearIgnore(IgnoreScope scope) {
        scriptExecutor.deleteKeys(ignoreKey(scope));
    }

    private String ignoreKey(IgnoreScope scope) {
        return RedisKeys.join(keyPrefix, scope.key());
    }

    private RankState execute(String script, RankKey key, List<String> args) {
        List<Long> result = scriptExecutor.executeLuaScript(
                script, List.of(RedisKeys.join(keyPrefix, key.value())), args);
        return toState(result);
    }

    private static RankState toState(List<Long> result) {
        long blockedUntil = result.get(1);
        long blockedRank = result.get(2);
        long blockedRule = result.get(3);

        return RankState.builder()
                .currentIndex(result.get(0).intValue())
                .blockedUntil(blockedUntil < 0 ? null : Instant.ofEpochMilli(blockedUntil))
                .blockedRank(blockedRank < 0 ? null : (int) blockedRank)
                .blockedRule(blockedRule < 0 ? null : (int) blockedRule)
                .build();
    }
}
