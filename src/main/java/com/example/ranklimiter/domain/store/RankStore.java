package com.example.ranklimiter.domain.store;

import com.example.ranklimiter.domain.model.BreachUpdate;
import com.example.ranklimiter.domain.model.IgnoreGrant;
import com.example.ranklimiter.domain.model.IgnoreScope;
import com.example.ranklimiter.domain.model.RankKey;
import com.example.ranklimiter.domain.model.RankState;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * 요청자별 등급/차단 상태 저장소
 *
 * 없는 키는 {@link RankState#initial()}로 읽힌다.
 * 규칙 평가 면제(IgnoreGrant)도 같은 저장소에 보관한다.
 */
public interface RankStore {

    RankState load(RankKey key);

    /**
     * 위반 반영 (원자적). 규칙은 {@link BreachUpdate#applyTo(RankState)} 참고
     */
    RankState recordBreach(RankKey key, BreachUpdate update);

    /**
     * 등급을 delta만큼 이동, [0, lastIndex] 범위로 고정
     */
    RankState shiftIndex(RankKey key, int delta, int lastIndex, Duration ttl);

    RankState setIndex(RankKey key, int index, Duration ttl);

    /**
     * 규칙 평가 없이 차단. 원인 규칙은 남기지 않는다.
     */
    RankState block(RankKey key, Instant blockedUntil, Duration ttl);

    void delete(RankKey key);

    /**
     * 면제 설정. 기존 면제는 교체된다.
     */
    void grantIgnore(IgnoreScope scope, IgnoreGrant grant, Duration ttl);

    /**
     * 면제가 유효하면 true (원자적). 횟수 기반이면 1회 차감하고, 다 쓰면 삭제한다.
     */
    boolean consumeIgnore(IgnoreScope scope, Instant now);

    Optional<IgnoreGrant> loadIgnore(IgnoreScope scope);

    void clearIgnore(IgnoreScope scope);
}
