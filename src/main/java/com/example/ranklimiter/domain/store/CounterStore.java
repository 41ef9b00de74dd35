package com.example.ranklimiter.domain.store;

import com.example.ranklimiter.domain.model.WindowCount;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * 규칙별 카운터/타임스탬프 저장소
 *
 * 모든 read-then-write 연산은 키 단위로 원자적이어야 한다.
 * 키가 없으면 "카운트 0 / 이전 요청 없음"과 같다.
 * TTL은 정리 용도이며, 윈도우 판정은 저장된 타임스탬프로 한다.
 */
public interface CounterStore {

    /**
     * 윈도우가 없거나 만료됐으면 (1, now)로 재시작(TTL = batchTime), 아니면 카운트 +1
     *
     * @return 증가 후 카운트와 윈도우 시작 시각
     */
    WindowCount incrementWindow(String key, Duration batchTime, Instant now);

    /**
     * 마지막으로 허용된 요청 이후 delay 이상 지났으면 now를 기록(TTL = delay)하고 true.
     * 아니면 기존 타임스탬프를 그대로 두고 false.
     */
    boolean acquireDelaySlot(String key, Duration delay, Instant now);

    Optional<WindowCount> readWindow(String key);

    Optional<Instant> readLastAccepted(String key);

    /**
     * prefix로 시작하는 카운터 전부 삭제
     */
    void deleteByPrefix(String prefix);
}
