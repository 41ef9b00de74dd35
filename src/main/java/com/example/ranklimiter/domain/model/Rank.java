package com.example.ranklimiter.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 에스컬레이션 래더의 한 단계
 */
@Getter
@ToString
@EqualsAndHashCode
public final class Rank {

    private final int index;
    private final RuleGroup ruleGroup;

    Rank(int index, RuleGroup ruleGroup) {
        this.index = index;
        this.ruleGroup = ruleGroup;
    }
}
