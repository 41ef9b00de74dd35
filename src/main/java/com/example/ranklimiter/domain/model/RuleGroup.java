package com.example.ranklimiter.domain.model;

import com.example.ranklimiter.common.exception.InvalidConfigurationException;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * AND로 결합되는 규칙 묶음
 *
 * 하나라도 위반되면 그룹 전체가 위반이다.
 * 규칙 순서는 카운터 키(rule index)에 그대로 쓰이므로 변경하면 안 된다.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class RuleGroup {

    private final List<LimitRule> rules;

    private RuleGroup(List<LimitRule> rules) {
        if (rules == null || rules.isEmpty()) {
            throw new InvalidConfigurationException("Rule group must contain at least one rule");
        }
        this.rules = List.copyOf(rules);
    }

    public static RuleGroup of(LimitRule... rules) {
        return new RuleGroup(List.of(rules));
    }

    public static RuleGroup of(List<LimitRule> rules) {
        return new RuleGroup(rules);
    }

    public int size() {
        return rules.size();
    }

    public LimitRule get(int ruleIndex) {
        return rules.get(ruleIndex);
    }
}
