package com.example.ranklimiter.domain.model;

import com.example.ranklimiter.common.exception.InvalidConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * RankLadder / RuleGroup 테스트
 */
class RankLadderTest {

    private final LimitRule loose = LimitRule.count(10, Duration.ofSeconds(60), Duration.ofSeconds(60));
    private final LimitRule strict = LimitRule.count(1, Duration.ofSeconds(60), Duration.ofSeconds(600));

    @Test
    @DisplayName("빈 래더는 InvalidConfigurationException 발생")
    void emptyLadderTest() {
        // when & then
        assertThatThrownBy(() -> RankLadder.of(List.of()))
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("at least one rank");
    }

    @Test
    @DisplayName("빈 규칙 그룹은 InvalidConfigurationException 발생")
    void emptyGroupTest() {
        // when & then
        assertThatThrownBy(() -> RuleGroup.of(List.of()))
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("at least one rule");
    }

    @Test
    @DisplayName("단일 규칙은 크기 1짜리 래더")
    void singleRuleTest() {
        // when
        RankLadder ladder = RankLadder.single(loose);

        // then
        assertThat(ladder.size()).isEqualTo(1);
        assertThat(ladder.rankAt(0).getRuleGroup().getRules()).containsExactly(loose);
    }

    @Test
    @DisplayName("범위를 넘는 인덱스는 마지막 등급으로 고정")
    void clampTest() {
        // given
        RankLadder ladder = RankLadder.of(RuleGroup.of(loose), RuleGroup.of(strict));

        // then
        assertThat(ladder.lastIndex()).isEqualTo(1);
        assertThat(ladder.rankAt(7).getIndex()).isEqualTo(1);
        assertThat(ladder.clamp(-3)).isZero();
    }

    @Test
    @DisplayName("존재하지 않는 규칙 위치 조회는 null")
    void ruleAtTest() {
        // given
        RankLadder ladder = RankLadder.of(RuleGroup.of(loose), RuleGroup.of(strict));

        // then
        assertThat(ladder.ruleAt(1, 0)).isEqualTo(strict);
        assertThat(ladder.ruleAt(2, 0)).isNull();
        assertThat(ladder.ruleAt(0, 1)).isNull();
        assertThat(ladder.ruleAt(null, null)).isNull();
    }
}
