package com.example.ranklimiter.presentation.interceptor;

import com.example.ranklimiter.application.service.LadderRegistry;
import com.example.ranklimiter.application.service.RankLimiterServiceImpl;
import com.example.ranklimiter.common.annotation.Limit;
import com.example.ranklimiter.common.annotation.LimitGroup;
import com.example.ranklimiter.common.annotation.RankLimit;
import com.example.ranklimiter.common.exception.RateLimitedException;
import com.example.ranklimiter.common.exception.StoreUnavailableException;
import com.example.ranklimiter.config.RankLimitProperties;
import com.example.ranklimiter.domain.engine.DecisionEngine;
import com.example.ranklimiter.domain.factory.RankLadderFactory;
import com.example.ranklimiter.domain.model.WindowCount;
import com.example.ranklimiter.domain.store.CounterStore;
import com.example.ranklimiter.infrastructure.memory.InMemoryCounterStore;
import com.example.ranklimiter.infrastructure.memory.InMemoryRankStore;
import com.example.ranklimiter.presentation.identity.SpelCallerIdentityResolver;
import com.example.ranklimiter.support.MutableClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.aop.aspectj.annotation.AspectJProxyFactory;
import org.springframework.data.redis.RedisConnectionFailureException;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

/**
 * RankLimitAspect 테스트 (웹 요청 밖, 프록시 직접 생성)
 */
class RankLimitAspectTest {

    public static class OrderService {

        @RankLimit(identifierExpression = "#userId",
                ranks = @LimitGroup(@Limit(hits = 1, batchTime = "1m", blockTime = "30s")))
        public String placeOrder(String userId) {
            return "ordered by " + userId;
        }
    }

    private OrderService proxy(CounterStore counterStore, boolean failOpen) {
        RankLimitProperties properties = new RankLimitProperties();
        properties.setFailOpen(failOpen);

        DecisionEngine engine = new DecisionEngine(counterStore, new InMemoryRankStore(),
                new MutableClock(Instant.parse("2026-01-01T00:00:00Z")), Duration.ofHours(1));
        RankLimitAspect aspect = new RankLimitAspect(
                new RankLimiterServiceImpl(engine),
                new LadderRegistry(new RankLadderFactory(), properties),
                new SpelCallerIdentityResolver(),
                properties);

        AspectJProxyFactory factory = new AspectJProxyFactory(new OrderService());
        factory.setProxyTargetClass(true);
        factory.addAspect(aspect);
        return factory.getProxy();
    }

    private static CounterStore failingStore() {
        return new InMemoryCounterStore() {
            @Override
            public WindowCount incrementWindow(String key, Duration batchTime, Instant now) {
                throw new StoreUnavailableException("Redis is down",
                        new RedisConnectionFailureException("connection refused"));
            }
        };
    }

    @Test
    @DisplayName("한도 초과 시 RateLimitedException, 엔드포인트는 클래스#메서드")
    void blocksOverLimitTest() {
        // given
        OrderService service = proxy(new InMemoryCounterStore(), false);
        assertThat(service.placeOrder("alice")).isEqualTo("ordered by alice");

        // when & then
        assertThatThrownBy(() -> service.placeOrder("alice"))
                .isInstanceOfSatisfying(RateLimitedException.class, e -> {
                    assertThat(e.getEndpoint()).isEqualTo("OrderService#placeOrder");
                    assertThat(e.getVerdict().getRetryAfterSeconds()).isEqualTo(30);
                });

        // 다른 사용자는 독립
        assertThat(service.placeOrder("bob")).isEqualTo("ordered by bob");
    }

    @Test
    @DisplayName("fail-open이 꺼져 있으면 저장소 장애 전파")
    void failClosedTest() {
        // given
        OrderService service = proxy(failingStore(), false);

        // when & then
        assertThatThrownBy(() -> service.placeOrder("alice"))
                .isInstanceOf(StoreUnavailableException.class);
    }

    @Test
    @DisplayName("fail-open이 켜져 있으면 저장소 장애 시 요청 통과")
    void failOpenTest() {
        // given
        OrderService service = proxy(failingStore(), true);

        // when & then
        assertThat(service.placeOrder("alice")).isEqualTo("ordered by alice");
    }
}
