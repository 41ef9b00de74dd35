package com.example.ranklimiter.domain.engine;

import com.example.ranklimiter.common.exception.InvalidConfigurationException;
import com.example.ranklimiter.domain.model.BreachUpdate;
import com.example.ranklimiter.domain.model.CallerIdentity;
import com.example.ranklimiter.domain.model.IgnoreGrant;
import com.example.ranklimiter.domain.model.IgnoreScope;
import com.example.ranklimiter.domain.model.LimitRule;
import com.example.ranklimiter.domain.model.Rank;
import com.example.ranklimiter.domain.model.RankKey;
import com.example.ranklimiter.domain.model.RankLadder;
import com.example.ranklimiter.domain.model.RankState;
import com.example.ranklimiter.domain.model.RuleGroup;
import com.example.ranklimiter.domain.model.RuleOutcome;
import com.example.ranklimiter.domain.model.Verdict;
import com.example.ranklimiter.domain.model.WindowCount;
import com.example.ranklimiter.domain.store.CounterStore;
import com.example.ranklimiter.domain.store.RankStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 등급 기반 허용/차단 판정 엔진
 *
 * 흐름:
 * 1. RankState 조회 (없으면 0번 등급)
 * 2. 차단 중이면 규칙 평가 없이 남은 시간으로 즉시 차단
 * 2-1. 면제 중이면 (엔드포인트 전체 → 요청자 순) 규칙 평가 없이 허용
 * 3. 현재 등급의 규칙 그룹을 모두 평가 (short-circuit 없음, 모든 카운터 갱신)
 * 4. 하나라도 위반이면 최대 blockTime으로 차단 + 다음 등급으로 에스컬레이션
 *
 * 엔진은 상태를 갖지 않는다. 같은 요청자에 대한 동시 요청 조정은
 * 전적으로 저장소의 키 단위 원자성에 맡긴다.
 */
@Slf4j
public class DecisionEngine {

    private final CounterStore counterStore;
    private final RankStore rankStore;
    private final Clock clock;
    private final Duration rankTtl;

    public DecisionEngine(CounterStore counterStore, RankStore rankStore, Clock clock, Duration rankTtl) {
        if (rankTtl == null || rankTtl.isZero() || rankTtl.isNegative()) {
            throw new InvalidConfigurationException("Rank TTL must be positive: " + rankTtl);
        }
        this.counterStore = counterStore;
        this.rankStore = rankStore;
        this.clock = clock;
        this.rankTtl = rankTtl;
    }

    public Verdict evaluate(CallerIdentity identity, RankLadder ladder, String endpoint) {
        RankKey key = RankKey.of(endpoint, identity);
        Instant now = clock.instant();
        RankState state = rankStore.load(key);

        if (state.isBlockedAt(now)) {
            LimitRule cause = ladder.ruleAt(state.getBlockedRank(), state.getBlockedRule());
            if (log.isDebugEnabled()) {
                log.debug("Already blocked - Key: {}, Until: {}", key, state.getBlockedUntil());
            }
            // 차단을 일으킨 등급 기준 (수동 차단이면 현재 등급)
            int rankIndex = state.getBlockedRank() != null
                    ? ladder.clamp(state.getBlockedRank())
                    : ladder.clamp(state.getCurrentIndex());
            return Verdict.blocked(
                    rankIndex,
                    state.remainingBlock(now),
                    state.getBlockedUntil(),
                    cause
            );
        }

        if (isIgnored(endpoint, identity, now)) {
            int rankIndex = ladder.clamp(state.getCurrentIndex());
            if (log.isDebugEnabled()) {
                log.debug("Ignored - Key: {}, Rank: {}", key, rankIndex);
            }
            return Verdict.ignored(rankIndex);
        }

        Rank rank = ladder.rankAt(state.getCurrentIndex());
        List<Integer> breached = evaluateGroup(key, rank, identity.getGroup(), now);

        if (breached.isEmpty()) {
            if (log.isDebugEnabled()) {
                log.debug("Allowed - Key: {}, Rank: {}", key, rank.getIndex());
            }
            return Verdict.allowed(rank.getIndex());
        }

        return applyBreach(key, ladder, rank, breached, now);
    }

    private boolean isIgnored(String endpoint, CallerIdentity identity, Instant now) {
        return rankStore.consumeIgnore(IgnoreScope.endpoint(endpoint), now)
                || rankStore.consumeIgnore(IgnoreScope.caller(endpoint, identity), now);
    }

    /**
     * 그룹 내 적용 가능한 모든 규칙을 평가하고 위반한 규칙 인덱스 반환
     */
    private List<Integer> evaluateGroup(RankKey key, Rank rank, String group, Instant now) {
        RuleGroup ruleGroup = rank.getRuleGroup();
        List<Integer> breached = new ArrayList<>();

        for (int i = 0; i < ruleGroup.size(); i++) {
            LimitRule rule = ruleGroup.get(i);
            if (!rule.appliesTo(group)) {
                continue;
            }
            String counterKey = key.counterKey(rank.getIndex(), i);
            if (evaluateRule(rule, counterKey, now) == RuleOutcome.BREACH) {
                breached.add(i);
            }
        }
        return breached;
    }

    RuleOutcome evaluateRule(LimitRule rule, String counterKey, Instant now) {
        return switch (rule.getMode()) {
            case COUNT -> {
                WindowCount window = counterStore.incrementWindow(counterKey, rule.getBatchTime(), now);
                yield window.getCount() <= rule.getHits() ? RuleOutcome.PASS : RuleOutcome.BREACH;
            }
            case DELAY -> counterStore.acquireDelaySlot(counterKey, rule.getDelay(), now)
                    ? RuleOutcome.PASS
                    : RuleOutcome.BREACH;
        };
    }

    private Verdict applyBreach(RankKey key, RankLadder ladder, Rank rank, List<Integer> breached, Instant now) {
        RuleGroup ruleGroup = rank.getRuleGroup();

        // 가장 긴 차단 시간을 가진 첫 규칙이 원인
        int causeIndex = breached.get(0);
        boolean escalate = false;
        for (int ruleIndex : breached) {
            LimitRule rule = ruleGroup.get(ruleIndex);
            if (rule.getBlockTime().compareTo(ruleGroup.get(causeIndex).getBlockTime()) > 0) {
                causeIndex = ruleIndex;
            }
            escalate |= rule.isIncreaseRank();
        }

        LimitRule cause = ruleGroup.get(causeIndex);
        Duration blockTime = cause.getBlockTime();
        Instant blockedUntil = now.plus(blockTime);

        RankState updated = rankStore.recordBreach(key, BreachUpdate.builder()
                .observedIndex(rank.getIndex())
                .escalate(escalate)
                .lastIndex(ladder.lastIndex())
                .blockedUntil(blockedUntil)
                .blockedRank(rank.getIndex())
                .blockedRule(causeIndex)
                .ttl(ttlFor(blockTime))
                .build());

        log.info("Blocked - Key: {}, Rank: {} -> {}, Rule: [{}], Block: {}",
                key, rank.getIndex(), updated.getCurrentIndex(), cause.describe(), blockTime);

        return Verdict.blocked(rank.getIndex(), blockTime, blockedUntil, cause);
    }

    public RankState inspect(CallerIdentity identity, String endpoint) {
        return rankStore.load(RankKey.of(endpoint, identity));
    }

    public RankState resetRank(CallerIdentity identity, String endpoint) {
        RankKey key = RankKey.of(endpoint, identity);
        RankState state = rankStore.setIndex(key, 0, rankTtl);
        log.info("Rank reset - Key: {}", key);
        return state;
    }

    public RankState shiftRank(CallerIdentity identity, String endpoint, int by, RankLadder ladder) {
        RankKey key = RankKey.of(endpoint, identity);
        RankState state = rankStore.shiftIndex(key, by, ladder.lastIndex(), rankTtl);
        log.info("Rank shifted by {} - Key: {}, Rank: {}", by, key, state.getCurrentIndex());
        return state;
    }

    public RankState block(CallerIdentity identity, String endpoint, Duration duration) {
        if (duration == null || duration.isZero() || duration.isNegative()) {
            throw new InvalidConfigurationException("Block duration must be positive: " + duration);
        }
        RankKey key = RankKey.of(endpoint, identity);
        Instant blockedUntil = clock.instant().plus(duration);
        RankState state = rankStore.block(key, blockedUntil, ttlFor(duration));
        log.info("Manually blocked - Key: {}, Until: {}", key, blockedUntil);
        return state;
    }

    /**
     * 규칙 평가 면제 설정. times(횟수)와 duration(기간) 중 정확히 하나만 지정
     */
    public IgnoreGrant ignore(IgnoreScope scope, Integer times, Duration duration) {
        if ((times == null) == (duration == null)) {
            throw new InvalidConfigurationException("Exactly one of ignore times or duration must be set");
        }

        IgnoreGrant grant;
        Duration ttl;
        if (times != null) {
            grant = IgnoreGrant.forTimes(times);
            ttl = rankTtl;
        } else {
            if (duration.isZero() || duration.isNegative()) {
                throw new InvalidConfigurationException("Ignore duration must be positive: " + duration);
            }
            grant = IgnoreGrant.until(clock.instant().plus(duration));
            ttl = ttlFor(duration);
        }

        rankStore.grantIgnore(scope, grant, ttl);
        log.info("Ignore granted - Scope: {}, Grant: {}", scope, grant);
        return grant;
    }

    public Optional<IgnoreGrant> inspectIgnore(IgnoreScope scope) {
        Instant now = clock.instant();
        return rankStore.loadIgnore(scope).filter(grant -> grant.isActiveAt(now));
    }

    public void clearIgnore(IgnoreScope scope) {
        rankStore.clearIgnore(scope);
        log.info("Ignore cleared - Scope: {}", scope);
    }

    /**
     * RankState, 요청자 면제, 모든 규칙 카운터 삭제
     */
    public void reset(CallerIdentity identity, String endpoint) {
        RankKey key = RankKey.of(endpoint, identity);
        counterStore.deleteByPrefix(key.counterPrefix());
        rankStore.clearIgnore(IgnoreScope.caller(endpoint, identity));
        rankStore.delete(key);
        log.info("Standing reset - Key: {}", key);
    }

    private Duration ttlFor(Duration blockTime) {
        return blockTime.compareTo(rankTtl) > 0 ? blockTime : rankTtl;
    }
}
