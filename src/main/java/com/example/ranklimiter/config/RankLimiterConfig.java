package com.example.ranklimiter.config;

import com.example.ranklimiter.domain.engine.DecisionEngine;
import com.example.ranklimiter.domain.store.CounterStore;
import com.example.ranklimiter.domain.store.RankStore;
import com.example.ranklimiter.infrastructure.memory.InMemoryCounterStore;
import com.example.ranklimiter.infrastructure.memory.InMemoryRankStore;
import com.example.ranklimiter.infrastructure.redis.RedisCounterStore;
import com.example.ranklimiter.infrastructure.redis.RedisRankStore;
import com.example.ranklimiter.infrastructure.redis.RedisScriptExecutor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * 엔진/저장소 빈 구성
 *
 * rank-limit.store 값에 따라 Redis 또는 In-memory 저장소를 선택한다.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(RankLimitProperties.class)
public class RankLimiterConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public DecisionEngine decisionEngine(CounterStore counterStore,
                                         RankStore rankStore,
                                         Clock clock,
                                         RankLimitProperties properties) {
        return new DecisionEngine(counterStore, rankStore, clock, properties.getRankTtl());
    }

    @Bean
    @ConditionalOnProperty(prefix = "rank-limit", name = "store", havingValue = "redis", matchIfMissing = true)
    public CounterStore redisCounterStore(RedisScriptExecutor scriptExecutor, RankLimitProperties properties) {
        log.info("Using Redis counter store (prefix={})", properties.getKeyPrefix());
        return new RedisCounterStore(scriptExecutor, properties.getKeyPrefix());
    }

    @Bean
    @ConditionalOnProperty(prefix = "rank-limit", name = "store", havingValue = "redis", matchIfMissing = true)
    public RankStore redisRankStore(RedisScriptExecutor scriptExecutor, RankLimitProperties properties) {
        return new RedisRankStore(scriptExecutor, properties.getKeyPrefix());
    }

    @Bean
    @ConditionalOnProperty(prefix = "rank-limit", name = "store", havingValue = "memory")
    public CounterStore inMemoryCounterStore() {
        log.info("Using in-memory counter store");
        return new InMemoryCounterStore();
    }

    @Bean
    @ConditionalOnProperty(prefix = "rank-limit", name = "store", havingValue = "memory")
    public RankStore inMemoryRankStore() {
        return new InMemoryRankStore();
    }
}
