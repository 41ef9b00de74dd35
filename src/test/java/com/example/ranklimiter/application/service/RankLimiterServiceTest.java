package com.example.ranklimiter.application.service;

import com.example.ranklimiter.common.exception.StoreUnavailableException;
import com.example.ranklimiter.domain.engine.DecisionEngine;
import com.example.ranklimiter.domain.model.CallerIdentity;
import com.example.ranklimiter.domain.model.LimitRule;
import com.example.ranklimiter.domain.model.RankLadder;
import com.example.ranklimiter.domain.model.RuleGroup;
import com.example.ranklimiter.domain.model.Verdict;
import com.example.ranklimiter.domain.model.WindowCount;
import com.example.ranklimiter.domain.store.CounterStore;
import com.example.ranklimiter.infrastructure.memory.InMemoryCounterStore;
import com.example.ranklimiter.infrastructure.memory.InMemoryRankStore;
import com.example.ranklimiter.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.RedisConnectionFailureException;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

/**
 * RankLimiterService 테스트
 */
class RankLimiterServiceTest {

    private MutableClock clock;
    private RankLimiterService service;

    private final CallerIdentity caller = CallerIdentity.of("10.0.0.1");
    private final RankLadder ladder = RankLadder.of(
            RuleGroup.of(LimitRule.count(2, Duration.ofSeconds(60), Duration.ofSeconds(60))),
            RuleGroup.of(LimitRule.count(1, Duration.ofSeconds(60), Duration.ofSeconds(600))));

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        service = new RankLimiterServiceImpl(new DecisionEngine(
                new InMemoryCounterStore(), new InMemoryRankStore(), clock, Duration.ofHours(24)));
    }

    @Test
    @DisplayName("한도 초과 시 차단 후 등급 상승")
    void checkLimitTest() {
        // when
        service.checkLimit("api", caller, ladder);
        service.checkLimit("api", caller, ladder);
        Verdict verdict = service.checkLimit("api", caller, ladder);

        // then
        assertThat(verdict.isBlocked()).isTrue();
        assertThat(verdict.getRetryAfterSeconds()).isEqualTo(60);
        assertThat(service.inspect("api", caller).getCurrentIndex()).isEqualTo(1);
    }

    @Test
    @DisplayName("관리 연산: 수동 차단, 등급 이동, 초기화")
    void adminOperationsTest() {
        // when & then
        assertThat(service.block("api", caller, Duration.ofSeconds(30)).getBlockedUntil())
                .isEqualTo(clock.instant().plusSeconds(30));
        assertThat(service.checkLimit("api", caller, ladder).isBlocked()).isTrue();

        assertThat(service.shiftRank("api", caller, 1, ladder).getCurrentIndex()).isEqualTo(1);
        assertThat(service.resetRank("api", caller).getCurrentIndex()).isZero();

        service.reset("api", caller);
        assertThat(service.checkLimit("api", caller, ladder).isAllowed()).isTrue();
    }

    @Test
    @DisplayName("저장소 장애는 판정으로 바꾸지 않고 그대로 전파")
    void storeFailurePropagatesTest() {
        // given
        CounterStore failing = new InMemoryCounterStore() {
            @Override
            public WindowCount incrementWindow(String key, Duration batchTime, Instant now) {
                throw new StoreUnavailableException("Redis is down",
                        new RedisConnectionFailureException("connection refused"));
            }
        };
        RankLimiterService failingService = new RankLimiterServiceImpl(
                new DecisionEngine(failing, new InMemoryRankStore(), clock, Duration.ofHours(24)));

        // when & then
        assertThatThrownBy(() -> failingService.checkLimit("api", caller, ladder))
                .isInstanceOf(StoreUnavailableException.class)
                .hasMessageContaining("Redis is down");
    }
}
