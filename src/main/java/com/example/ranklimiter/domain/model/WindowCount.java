package com.example.ranklimiter.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;
import java.time.Instant;

/**
 * COUNT 모드 규칙의 카운터 상태
 */
@Getter
@ToString
@EqualsAndHashCode
public final class WindowCount {

    private final long count;
    private final Instant windowStart;

    public WindowCount(long count, Instant windowStart) {
        this.count = count;
        this.windowStart = windowStart;
    }

    /**
     * 윈도우가 비어있거나 만료됐으면 (1, now)로 새로 시작, 아니면 +1
     */
    public static WindowCount next(WindowCount current, Duration batchTime, Instant now) {
        if (current == null || !now.isBefore(current.windowStart.plus(batchTime))) {
            return new WindowCount(1, now);
        }
        return new WindowCount(current.count + 1, current.windowStart);
    }
}
