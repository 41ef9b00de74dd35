package com.example.ranklimiter.infrastructure.memory;

import com.example.ranklimiter.domain.model.WindowCount;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

/**
 * InMemoryCounterStore 테스트
 */
class InMemoryCounterStoreTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");
    private static final Duration MINUTE = Duration.ofMinutes(1);

    private InMemoryCounterStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryCounterStore();
    }

    @Test
    @DisplayName("없는 키는 빈 값")
    void absentKeyTest() {
        // then
        assertThat(store.readWindow("missing")).isEmpty();
        assertThat(store.readLastAccepted("missing")).isEmpty();
    }

    @Test
    @DisplayName("윈도우 안에서는 증가, 윈도우가 지나면 (1, now)로 재시작")
    void incrementWindowTest() {
        // when
        store.incrementWindow("k", MINUTE, T0);
        WindowCount second = store.incrementWindow("k", MINUTE, T0.plusSeconds(30));
        WindowCount restarted = store.incrementWindow("k", MINUTE, T0.plusSeconds(60));

        // then
        assertThat(second).isEqualTo(new WindowCount(2, T0));
        assertThat(restarted).isEqualTo(new WindowCount(1, T0.plusSeconds(60)));
        assertThat(store.readWindow("k")).contains(restarted);
    }

    @Test
    @DisplayName("delay 미만 간격은 거부하고 마지막 허용 시각 유지")
    void acquireDelaySlotTest() {
        // when
        boolean first = store.acquireDelaySlot("d", Duration.ofSeconds(10), T0);
        boolean tooSoon = store.acquireDelaySlot("d", Duration.ofSeconds(10), T0.plusSeconds(9));
        boolean later = store.acquireDelaySlot("d", Duration.ofSeconds(10), T0.plusSeconds(10));

        // then
        assertThat(first).isTrue();
        assertThat(tooSoon).isFalse();
        assertThat(later).isTrue();
        assertThat(store.readLastAccepted("d")).contains(T0.plusSeconds(10));
    }

    @Test
    @DisplayName("접두사로 시작하는 키만 삭제")
    void deleteByPrefixTest() {
        // given
        store.incrementWindow("login:default:a:counter:0:0", MINUTE, T0);
        store.acquireDelaySlot("login:default:a:counter:0:1", MINUTE, T0);
        store.incrementWindow("login:default:ab:counter:0:0", MINUTE, T0);

        // when
        store.deleteByPrefix("login:default:a:counter:");

        // then
        assertThat(store.readWindow("login:default:a:counter:0:0")).isEmpty();
        assertThat(store.readLastAccepted("login:default:a:counter:0:1")).isEmpty();
        assertThat(store.readWindow("login:default:ab:counter:0:0")).isPresent();
    }
}
