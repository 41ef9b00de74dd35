package com.example.ranklimiter.domain.engine;

import com.example.ranklimiter.domain.model.CallerIdentity;
import com.example.ranklimiter.domain.model.LimitRule;
import com.example.ranklimiter.domain.model.RankLadder;
import com.example.ranklimiter.domain.model.RuleGroup;
import com.example.ranklimiter.domain.model.Verdict;
import com.example.ranklimiter.infrastructure.memory.InMemoryCounterStore;
import com.example.ranklimiter.infrastructure.memory.InMemoryRankStore;
import com.example.ranklimiter.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

/**
 * 같은 요청자에 대한 동시 요청 테스트
 */
class DecisionEngineConcurrencyTest {

    private static final int THREADS = 16;
    private static final int REQUESTS = 64;

    private ExecutorService executor;
    private DecisionEngine engine;
    private final CallerIdentity caller = CallerIdentity.of("10.0.0.1");

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(THREADS);
        engine = new DecisionEngine(new InMemoryCounterStore(), new InMemoryRankStore(),
                new MutableClock(Instant.parse("2026-01-01T00:00:00Z")), Duration.ofHours(1));
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    @DisplayName("동시 요청에서도 허용 수는 hits를 넘지 않고 등급은 한 번만 오른다")
    void concurrentRequestsTest() throws Exception {
        // given
        RankLadder ladder = RankLadder.of(
                RuleGroup.of(LimitRule.count(10, Duration.ofSeconds(60), Duration.ofSeconds(60))),
                RuleGroup.of(LimitRule.count(5, Duration.ofSeconds(60), Duration.ofSeconds(600))),
                RuleGroup.of(LimitRule.count(1, Duration.ofSeconds(60), Duration.ofSeconds(3600))));
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Verdict>> futures = new ArrayList<>();

        // when
        for (int i = 0; i < REQUESTS; i++) {
            futures.add(executor.submit(() -> {
                start.await();
                return engine.evaluate(caller, ladder, "orders");
            }));
        }
        start.countDown();

        int allowed = 0;
        for (Future<Verdict> future : futures) {
            if (future.get(10, TimeUnit.SECONDS).isAllowed()) {
                allowed++;
            }
        }

        // then
        assertThat(allowed).isEqualTo(10);
        assertThat(engine.inspect(caller, "orders").getCurrentIndex()).isEqualTo(1);
    }
}
