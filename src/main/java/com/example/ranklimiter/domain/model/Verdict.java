package com.example.ranklimiter.domain.model;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;
import java.time.Instant;

/**
 * 판정 결과 불변 Value Object (Allowed | Blocked)
 *
 * - Allowed: retryAfter = 0 (ignored = 면제로 규칙 평가 없이 허용)
 * - Blocked: retryAfter = 남은 차단 시간, cause = 원인 규칙 (수동 차단이면 null)
 */
@Getter
@Builder
@ToString
@EqualsAndHashCode
public class Verdict {

    public static final String MANUAL_BLOCK_REASON = "Manually rate-limited";
    public static final String MANUAL_BLOCK_ERROR_TYPE = "ratelimit.manual_block";

    private final boolean allowed;
    private final boolean ignored;
    private final int rankIndex;
    private final Duration retryAfter;
    private final Instant blockedUntil;
    private final LimitRule cause;

    public static Verdict allowed(int rankIndex) {
        return Verdict.builder()
                .allowed(true)
                .rankIndex(rankIndex)
                .retryAfter(Duration.ZERO)
                .build();
    }

    public static Verdict ignored(int rankIndex) {
        return Verdict.builder()
                .allowed(true)
                .ignored(true)
                .rankIndex(rankIndex)
                .retryAfter(Duration.ZERO)
                .build();
    }

    public static Verdict blocked(int rankIndex, Duration retryAfter, Instant blockedUntil, LimitRule cause) {
        return Verdict.builder()
                .allowed(false)
                .rankIndex(rankIndex)
                .retryAfter(retryAfter)
                .blockedUntil(blockedUntil)
                .cause(cause)
                .build();
    }

    public boolean isBlocked() {
        return !allowed;
    }

    /**
     * Retry-After 헤더 값 (초 단위 올림)
     */
    public long getRetryAfterSeconds() {
        long millis = retryAfter.toMillis();
        return (millis + 999) / 1000;
    }

    public String getReason() {
        if (allowed) {
            return null;
        }
        return cause != null ? cause.getReason() : MANUAL_BLOCK_REASON;
    }

    public String getMessage() {
        return cause != null ? cause.getMessage() : null;
    }

    public String getErrorType() {
        if (allowed) {
            return null;
        }
        return cause != null ? cause.getMode().getErrorType() : MANUAL_BLOCK_ERROR_TYPE;
    }
}
