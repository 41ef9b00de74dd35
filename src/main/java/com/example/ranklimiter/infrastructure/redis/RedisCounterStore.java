package com.example.ranklimiter.infrastructure.redis;

import com.example.ranklimiter.domain.model.WindowCount;
import com.example.ranklimiter.domain.store.CounterStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Redis 기반 CounterStore
 *
 * 키 구조:
 * - COUNT: {prefix}:{counterKey} -> HASH {count, start}
 * - DELAY: {prefix}:{counterKey} -> STRING (마지막 허용 시각, epoch millis)
 *
 * read-compare-write 전체를 Lua 스크립트 하나로 실행하여 원자성 보장.
 * 시각은 애플리케이션 Clock 기준 값을 인자로 넘긴다 (윈도우 판정은 저장된 시각으로).
 */
@Slf4j
public class RedisCounterStore implements CounterStore {

    private static final String WINDOW_SCRIPT = """
            local key = KEYS[1]
            local window = tonumber(ARGV[1])
            local now = tonumber(ARGV[2])

            local start = tonumber(redis.call("HGET", key, "start"))

            -- 윈도우가 없거나 만료되면 (1, now)로 재시작
            if start == nil or now >= start + window then
                redis.call("HSET", key, "count", 1, "start", ARGV[2])
                redis.call("PEXPIRE", key, ARGV[1])
                return {1, now}
            end

            local count = redis.call("HINCRBY", key, "count", 1)
            return {count, start}
            """;

    private static final String DELAY_SCRIPT = """
            local key = KEYS[1]
            local delay = tonumber(ARGV[1])
            local now = tonumber(ARGV[2])

            local last = tonumber(redis.call("GET", key))

            -- 위반 시 마지막 허용 시각은 그대로 둔다
            if last == nil or now >= last + delay then
                redis.call("SET", key, ARGV[2], "PX", ARGV[1])
                return {1, now}
            end

            return {0, last}
            """;

    private static final String READ_WINDOW_SCRIPT = """
            local values = redis.call("HMGET", KEYS[1], "count", "start")
            if not values[2] then
                return {}
            end
            return {tonumber(values[1]), tonumber(values[2])}
            """;

    private static final String READ_LAST_SCRIPT = """
            local value = redis.call("GET", KEYS[1])
            if not value then
                return {}
            end
            return {tonumber(value)}
            """;

    private final RedisScriptExecutor scriptExecutor;
    private final String keyPrefix;

    public RedisCounterStore(RedisScriptExecutor scriptExecutor, String keyPrefix) {
        this.scriptExecutor = scriptExecutor;
        this.keyPrefix = keyPrefix;
    }

    @Override
    public WindowCount incrementWindow(String key, Duration batchTime, Instant now) {
        List<Long> result = scriptExecutor.executeLuaScript(
                WINDOW_SCRIPT,
                List.of(RedisKeys.join(keyPrefix, key)),
                List.of(
                        String.valueOf(batchTime.toMillis()),
                        String.valueOf(now.toEpochMilli())
                )
        );

        return new WindowCount(result.get(0), Instant.ofEpochMilli(result.get(1)));
    }

    @Override
    public boolean acquireDelaySlot(String key, Duration delay, Instant now) {
        List<Long> result = scriptExecutor.executeLuaScript(
                DELAY_SCRIPT,
                List.of(RedisKeys.join(keyPrefix, key)),
                List.of(
                        String.valueOf(delay.toMillis()),
                        String.valueOf(now.toEpochMilli())
                )
        );

        return result.get(0) == 1;
    }

    @Override
    public Optional<WindowCount> readWindow(String key) {
        List<Long> result = scriptExecutor.executeLuaScript(
                READ_WINDOW_SCRIPT, List.of(RedisKeys.join(keyPrefix, key)), List.of());

        if (result.size() < 2) {
            return Optional.empty();
        }
        return Optional.of(new WindowCount(result.get(0), Instant.ofEpochMilli(result.get(1))));
    }

    @Override
    public Optional<Instant> readLastAccepted(String key) {
        List<Long> result = scriptExecutor.executeLuaScript(
                READ_LAST_SCRIPT, List.of(RedisKeys.join(keyPrefix, key)), List.of());

        return result.isEmpty() ? Optional.empty() : Optional.of(Instant.ofEpochMilli(result.get(0)));
    }

    @Override
    public void deleteByPrefix(String prefix) {
        String pattern = RedisKeys.escapeGlob(RedisKeys.join(keyPrefix, prefix)) + "*";
        List<String> keys = scriptExecutor.findKeys(pattern);

        if (!keys.isEmpty()) {
            scriptExecutor.deleteKeys(keys.toArray(new String[0]));
            log.debug("Deleted {} counters matching {}", keys.size(), pattern);
        }
    }
}
