package com.example.ranklimiter.domain.model;

import com.example.ranklimiter.common.exception.InvalidConfigurationException;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.List;

/**
 * 순서가 있는 Rank 목록
 *
 * 0번이 가장 느슨하고, 위반할 때마다 다음 단계로 올라간다.
 * 마지막 단계에 도달하면 그 단계를 계속 반복한다.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class RankLadder {

    private final List<Rank> ranks;

    private RankLadder(List<RuleGroup> groups) {
        if (groups == null || groups.isEmpty()) {
            throw new InvalidConfigurationException("Rank ladder must contain at least one rank");
        }
        List<Rank> built = new ArrayList<>(groups.size());
        for (int i = 0; i < groups.size(); i++) {
            built.add(new Rank(i, groups.get(i)));
        }
        this.ranks = List.copyOf(built);
    }

    public static RankLadder of(List<RuleGroup> groups) {
        return new RankLadder(groups);
    }

    public static RankLadder of(RuleGroup... groups) {
        return new RankLadder(List.of(groups));
    }

    /**
     * 단일 규칙은 크기 1짜리 그룹으로 취급
     */
    public static RankLadder single(LimitRule rule) {
        return new RankLadder(List.of(RuleGroup.of(rule)));
    }

    public int size() {
        return ranks.size();
    }

    public int lastIndex() {
        return ranks.size() - 1;
    }

    public int clamp(int index) {
        return Math.max(0, Math.min(index, lastIndex()));
    }

    /**
     * 범위를 벗어난 인덱스는 마지막 단계로 고정
     */
    public Rank rankAt(int index) {
        return ranks.get(clamp(index));
    }

    /**
     * 차단 원인 규칙 조회. 래더 설정이 바뀌어 더 이상 존재하지 않으면 null
     */
    public LimitRule ruleAt(Integer rankIndex, Integer ruleIndex) {
        if (rankIndex == null || ruleIndex == null
                || rankIndex < 0 || rankIndex >= ranks.size()) {
            return null;
        }
        RuleGroup group = ranks.get(rankIndex).getRuleGroup();
        return ruleIndex >= 0 && ruleIndex < group.size() ? group.get(ruleIndex) : null;
    }
}
