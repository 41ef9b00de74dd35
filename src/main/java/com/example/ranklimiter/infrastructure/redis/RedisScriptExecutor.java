package com.example.ranklimiter.infrastructure.redis;

import java.util.List;

/**
 * Redis Lua Script 실행을 추상화한 인터페이스
 * 
 * SOLID 원칙:
 * - Dependency Inversion: Redis 구현 세부사항을 숨김
 * - Single Responsibility: Lua 스크립트 실행만 담당
 *
 * 모든 메서드는 Redis 장애 시 StoreUnavailableException을 던진다.
 */
public interface RedisScriptExecutor {
    
    /**
     * Lua 스크립트를 실행하고 숫자 결과만 반환
     * 
     * @param script Lua 스크립트
     * @param keys Redis 키 목록
     * @param args 스크립트 인자 목록
     * @return 실행 결과 (빈 배열 응답이면 빈 리스트)
     */
    List<Long> executeLuaScript(String script, List<String> keys, List<String> args);

    /**
     * Lua 스크립트를 실행하고 원본 결과 반환
     */
    List<Object> executeRawLuaScript(String script, List<String> keys, List<String> args);
    
    /**
     * 키 삭제
     * 
     * @param keys 삭제할 키 목록
     */
    void deleteKeys(String... keys);
    
    /**
     * 패턴으로 키 검색 (SCAN)
     * 
     * @param pattern 검색 패턴
     * @return 매칭되는 키 목록
     */
    List<String> findKeys(String pattern);
}
