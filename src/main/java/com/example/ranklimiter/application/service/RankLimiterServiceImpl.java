package com.example.ranklimiter.application.service;

import com.example.ranklimiter.domain.engine.DecisionEngine;
import com.example.ranklimiter.domain.model.CallerIdentity;
import com.example.ranklimiter.domain.model.IgnoreGrant;
import com.example.ranklimiter.domain.model.IgnoreScope;
import com.example.ranklimiter.domain.model.RankLadder;
import com.example.ranklimiter.domain.model.RankState;
import com.example.ranklimiter.domain.model.Verdict;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;

/**
 * Rank Limiter 서비스 구현체
 * 
 * SOLID 원칙:
 * - Single Responsibility: 판정은 DecisionEngine에 위임하고 호출 기록만 담당
 * - Dependency Inversion: 저장소는 엔진 뒤에 숨겨짐
 *
 * 저장소 장애를 여기서 허용/차단으로 바꾸지 않는다 (호스트 정책).
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RankLimiterServiceImpl implements RankLimiterService {
    
    private final DecisionEngine decisionEngine;
    
    @Override
    public Verdict checkLimit(String endpoint, CallerIdentity identity, RankLadder ladder) {
        Verdict verdict = decisionEngine.evaluate(identity, ladder, endpoint);

        if (log.isDebugEnabled()) {
            log.debug("Rank limit check - Endpoint: {}, Caller: {}/{}, Allowed: {}, Rank: {}",
                    endpoint, identity.getGroup(), identity.getUniqueId(),
                    verdict.isAllowed(), verdict.getRankIndex());
            if (verdict.isIgnored()) {
                log.debug("Rank limit ignored - Endpoint: {}, Caller: {}/{}",
                        endpoint, identity.getGroup(), identity.getUniqueId());
            }
        }

        return verdict;
    }

    @Override
    public RankState inspect(String endpoint, CallerIdentity identity) {
        return decisionEngine.inspect(identity, endpoint);
    }

    @Override
    public RankState resetRank(String endpoint, CallerIdentity identity) {
        return decisionEngine.resetRank(identity, endpoint);
    }

    @Override
    public RankState shiftRank(String endpoint, CallerIdentity identity, int by, RankLadder ladder) {
        return decisionEngine.shiftRank(identity, endpoint, by, ladder);
    }

    @Override
    public RankState block(String endpoint, CallerIdentity identity, Duration duration) {
        return decisionEngine.block(identity, endpoint, duration);
    }

    @Override
    public void reset(String endpoint, CallerIdentity identity) {
        decisionEngine.reset(identity, endpoint);
    }

    @Override
    public IgnoreGrant ignore(IgnoreScope scope, Integer times, Duration duration) {
        return decisionEngine.ignore(scope, times, duration);
    }

    @Override
    public Optional<IgnoreGrant> inspectIgnore(IgnoreScope scope) {
        return decisionEngine.inspectIgnore(scope);
    }

    @Override
    public void clearIgnore(IgnoreScope scope) {
        decisionEngine.clearIgnore(scope);
    }
}
