package com.example.ranklimiter.domain.model;

import com.example.ranklimiter.common.exception.InvalidConfigurationException;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * 규칙 평가 면제
 *
 * 횟수 기반(remainingTimes) 또는 시각 기반(until) 중 하나만 가진다.
 * 면제된 요청은 규칙 카운터를 갱신하지 않는다.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class IgnoreGrant {

    private final Integer remainingTimes;
    private final Instant until;

    private IgnoreGrant(Integer remainingTimes, Instant until) {
        this.remainingTimes = remainingTimes;
        this.until = until;
    }

    public static IgnoreGrant forTimes(int times) {
        if (times <= 0) {
            throw new InvalidConfigurationException("Ignore times must be positive: " + times);
        }
        return new IgnoreGrant(times, null);
    }

    public static IgnoreGrant until(Instant until) {
        if (until == null) {
            throw new InvalidConfigurationException("Ignore end time is required");
        }
        return new IgnoreGrant(null, until);
    }

    public boolean isCountBased() {
        return remainingTimes != null;
    }

    /**
     * 종료 시각 자체도 면제 구간에 포함
     */
    public boolean isActiveAt(Instant now) {
        if (isCountBased()) {
            return remainingTimes > 0;
        }
        return !now.isAfter(until);
    }

    public IgnoreGrant consumeOne() {
        return isCountBased() ? new IgnoreGrant(remainingTimes - 1, null) : this;
    }
}
