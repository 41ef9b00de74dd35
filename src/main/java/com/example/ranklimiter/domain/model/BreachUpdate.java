package com.example.ranklimiter.domain.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;
import java.time.Instant;

/**
 * 위반 발생 시 RankStore에 원자적으로 반영할 내용
 *
 * observedIndex: 이번 평가에 사용한 등급. 저장된 등급이 이 값과 같을 때만 올린다.
 */
@Getter
@Builder
@ToString
public class BreachUpdate {

    private final int observedIndex;
    private final boolean escalate;
    private final int lastIndex;
    private final Instant blockedUntil;
    private final int blockedRank;
    private final int blockedRule;
    private final Duration ttl;

    /**
     * 저장된 상태에 위반을 반영한 결과
     *
     * 모든 저장소 구현이 같은 규칙을 따르도록 여기 한 곳에 둔다.
     * (Redis 구현은 같은 규칙을 Lua로 수행)
     */
    public RankState applyTo(RankState stored) {
        int index = Math.min(stored.getCurrentIndex(), lastIndex);
        if (escalate && index == observedIndex && index < lastIndex) {
            index++;
        }

        RankState.RankStateBuilder next = stored.toBuilder().currentIndex(index);
        if (stored.getBlockedUntil() == null || stored.getBlockedUntil().isBefore(blockedUntil)) {
            next.blockedUntil(blockedUntil)
                    .blockedRank(blockedRank)
                    .blockedRule(blockedRule);
        }
        return next.build();
    }
}
