package com.example.ranklimiter.application.service;

import com.example.ranklimiter.domain.model.CallerIdentity;
import com.example.ranklimiter.domain.model.IgnoreGrant;
import com.example.ranklimiter.domain.model.IgnoreScope;
import com.example.ranklimiter.domain.model.RankLadder;
import com.example.ranklimiter.domain.model.RankState;
import com.example.ranklimiter.domain.model.Verdict;

import java.time.Duration;
import java.util.Optional;

/**
 * Rank Limiter 서비스 인터페이스
 * 
 * SOLID 원칙:
 * - Interface Segregation: 필요한 메서드만 정의
 * - Dependency Inversion: 구현이 아닌 추상화에 의존
 *
 * 모든 메서드는 저장소 장애 시 StoreUnavailableException을 그대로 전파한다.
 */
public interface RankLimiterService {
    
    /**
     * 요청 허용 여부 판정
     * 
     * @param endpoint 저장소 네임스페이스 (보호 대상 연산)
     * @param identity 요청자
     * @param ladder 에스컬레이션 래더
     * @return Allowed 또는 Blocked(retryAfter)
     */
    Verdict checkLimit(String endpoint, CallerIdentity identity, RankLadder ladder);

    /**
     * 현재 등급/차단 상태 조회 (부작용 없음)
     */
    RankState inspect(String endpoint, CallerIdentity identity);

    /**
     * 등급을 0으로 되돌림. 진행 중인 차단은 유지
     */
    RankState resetRank(String endpoint, CallerIdentity identity);

    /**
     * 등급을 by만큼 이동 (음수 가능), 래더 범위로 고정
     */
    RankState shiftRank(String endpoint, CallerIdentity identity, int by, RankLadder ladder);

    /**
     * 규칙 평가 없이 duration 동안 차단
     */
    RankState block(String endpoint, CallerIdentity identity, Duration duration);

    /**
     * 등급 상태와 카운터 전부 삭제
     */
    void reset(String endpoint, CallerIdentity identity);

    /**
     * 규칙 평가 면제 (요청자 단위 또는 엔드포인트 전체)
     *
     * @param times 면제할 요청 수 (duration과 둘 중 하나)
     * @param duration 면제 기간 (times와 둘 중 하나)
     */
    IgnoreGrant ignore(IgnoreScope scope, Integer times, Duration duration);

    /**
     * 유효한 면제 조회 (차감하지 않음)
     */
    Optional<IgnoreGrant> inspectIgnore(IgnoreScope scope);

    void clearIgnore(IgnoreScope scope);
}
