package com.example.ranklimiter.infrastructure.redis;

import com.example.ranklimiter.common.exception.StoreUnavailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Redis Lua Script 실행 구현체
 *
 * SOLID 원칙:
 * - Single Responsibility: Redis 스크립트 실행만 담당
 * - Dependency Inversion: 인터페이스를 구현하여 추상화 제공
 *
 * - KEYS 명령 대신 SCAN 사용
 * - DefaultRedisScript 캐싱 (EVALSHA 재사용)
 * - Redis 예외는 StoreUnavailableException으로 변환하여 전파
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RedisScriptExecutorImpl implements RedisScriptExecutor {

    private final RedisTemplate<String, String> redisTemplate;

    private final Map<String, DefaultRedisScript<List>> scriptCache = new ConcurrentHashMap<>();

    @Override
    public List<Long> executeLuaScript(String script, List<String> keys, List<String> args) {
        List<Object> raw = executeRawLuaScript(script, keys, args);

        // Redis는 정수를 Long으로 반환
        List<Long> longResult = new ArrayList<>();
        for (Object obj : raw) {
            if (obj instanceof Number) {
                longResult.add(((Number) obj).longValue());
            }
        }
        return longResult;
    }

    @Override
    @SuppressWarnings("unchecked") // DefaultRedisScript<List>의 raw List는 Spring API 제약
    public List<Object> executeRawLuaScript(String script, List<String> keys, List<String> args) {
        DefaultRedisScript<List> redisScript = scriptCache.computeIfAbsent(script, s -> {
            DefaultRedisScript<List> newScript = new DefaultRedisScript<>();
            newScript.setScriptText(s);
            newScript.setResultType(List.class);
            return newScript;
        });

        try {
            List<Object> result = redisTemplate.execute(redisScript, keys, args.toArray());
            return result == null ? Collections.emptyList() : result;

        } catch (DataAccessException e) {
            log.error("Failed to execute Lua script on keys {}", keys, e);
            throw new StoreUnavailableException("Redis script execution failed", e);
        }
    }

    @Override
    public void deleteKeys(String... keys) {
        if (keys == null || keys.length == 0) {
            return;
        }
        try {
            redisTemplate.delete(List.of(keys));
        } catch (DataAccessException e) {
            log.error("Failed to delete {} keys", keys.length, e);
            throw new StoreUnavailableException("Redis delete failed", e);
        }
    }

    /**
     * KEYS는 O(N)으로 전체 keyspace를 블로킹 스캔하여 프로덕션 위험.
     * SCAN은 커서 기반으로 점진적 탐색하여 서버 블로킹 없음.
     */
    @Override
    public List<String> findKeys(String pattern) {
        List<String> result = new ArrayList<>();
        ScanOptions options = ScanOptions.scanOptions().match(pattern).count(100).build();

        try {
            redisTemplate.execute((RedisCallback<Void>) connection -> {
                try (Cursor<byte[]> cursor = connection.keyCommands().scan(options)) {
                    while (cursor.hasNext()) {
                        result.add(new String(cursor.next(), StandardCharsets.UTF_8));
                    }
                }
                return null;
            });
        } catch (DataAccessException e) {
            log.error("Failed to scan keys with pattern {}", pattern, e);
            throw new StoreUnavailableException("Redis scan failed", e);
        }

        return result;
    }
}
