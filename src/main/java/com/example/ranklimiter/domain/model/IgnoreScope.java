package com.example.ranklimiter.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * 면제 적용 범위
 *
 * - CALLER: 특정 요청자의 특정 엔드포인트
 * - ENDPOINT: 엔드포인트의 모든 요청자
 */
@Getter
@EqualsAndHashCode
public final class IgnoreScope {

    public enum Level {
        CALLER,
        ENDPOINT
    }

    private final Level level;
    private final String endpoint;
    private final CallerIdentity identity;

    private IgnoreScope(Level level, String endpoint, CallerIdentity identity) {
        this.level = level;
        this.endpoint = endpoint;
        this.identity = identity;
    }

    public static IgnoreScope caller(String endpoint, CallerIdentity identity) {
        return new IgnoreScope(Level.CALLER, endpoint, identity);
    }

    public static IgnoreScope endpoint(String endpoint) {
        return new IgnoreScope(Level.ENDPOINT, endpoint, null);
    }

    /**
     * 저장소 키. 엔드포인트 범위는 구성 요소가 둘뿐이라 요청자 키와 겹치지 않는다.
     */
    public String key() {
        return level == Level.CALLER
                ? RankKey.of(endpoint, identity).ignoreKey()
                : RankKey.escape(endpoint) + ":ignore";
    }

    @Override
    public String toString() {
        return level + "[" + key() + "]";
    }
}
