package com.example.ranklimiter.domain.model;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;
import java.time.Instant;

/**
 * 요청자의 현재 등급과 차단 상태
 *
 * 키가 없으면 {@link #initial()}과 같다 (0번 등급, 차단 없음).
 * blockedRank/blockedRule은 차단을 일으킨 규칙 위치이며 수동 차단이면 null.
 */
@Getter
@Builder(toBuilder = true)
@ToString
@EqualsAndHashCode
public class RankState {

    private final int currentIndex;
    private final Instant blockedUntil;
    private final Integer blockedRank;
    private final Integer blockedRule;

    public static RankState initial() {
        return RankState.builder().currentIndex(0).build();
    }

    public boolean isBlockedAt(Instant now) {
        return blockedUntil != null && now.isBefore(blockedUntil);
    }

    public Duration remainingBlock(Instant now) {
        if (!isBlockedAt(now)) {
            return Duration.ZERO;
        }
        return Duration.between(now, blockedUntil);
    }
}
