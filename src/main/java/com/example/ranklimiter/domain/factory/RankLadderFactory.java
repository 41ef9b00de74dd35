package com.example.ranklimiter.domain.factory;

import com.example.ranklimiter.common.annotation.Limit;
import com.example.ranklimiter.common.annotation.LimitGroup;
import com.example.ranklimiter.common.exception.InvalidConfigurationException;
import com.example.ranklimiter.config.RankLimitProperties.RankProperties;
import com.example.ranklimiter.config.RankLimitProperties.RuleProperties;
import com.example.ranklimiter.domain.model.LimitRule;
import com.example.ranklimiter.domain.model.RankLadder;
import com.example.ranklimiter.domain.model.RuleGroup;
import org.springframework.boot.convert.DurationStyle;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * 애노테이션/설정 선언으로부터 RankLadder를 생성하는 팩토리
 *
 * 생성 과정에서 모든 규칙이 검증되므로, 여기서 만든 래더는 항상 유효하다.
 */
@Component
public class RankLadderFactory {

    public RankLadder fromAnnotation(LimitGroup[] ranks) {
        List<RuleGroup> groups = new ArrayList<>();
        for (LimitGroup rank : ranks) {
            List<LimitRule> rules = new ArrayList<>();
            for (Limit limit : rank.value()) {
                rules.add(toRule(limit));
            }
            groups.add(RuleGroup.of(rules));
        }
        return RankLadder.of(groups);
    }

    public RankLadder fromProperties(String name, List<RankProperties> ranks) {
        if (ranks == null || ranks.isEmpty()) {
            throw new InvalidConfigurationException("Ladder '" + name + "' must contain at least one rank");
        }
        try {
            List<RuleGroup> groups = new ArrayList<>();
            for (RankProperties rank : ranks) {
                List<LimitRule> rules = new ArrayList<>();
                for (RuleProperties rule : rank.getRules()) {
                    rules.add(toRule(rule));
                }
                groups.add(RuleGroup.of(rules));
            }
            return RankLadder.of(groups);

        } catch (InvalidConfigurationException e) {
            throw new InvalidConfigurationException("Invalid ladder '" + name + "': " + e.getMessage(), e);
        }
    }

    LimitRule toRule(Limit limit) {
        LimitRule.Builder builder = LimitRule.builder()
                .blockTime(parse("blockTime", limit.blockTime()))
                .increaseRank(limit.increaseRank())
                .message(limit.message())
                .reason(limit.reason());

        if (limit.hits() != 0) {
            builder.hits(limit.hits());
        }
        if (!limit.batchTime().isBlank()) {
            builder.batchTime(parse("batchTime", limit.batchTime()));
        }
        if (!limit.delay().isBlank()) {
            builder.delay(parse("delay", limit.delay()));
        }
        if (limit.groups().length > 0) {
            builder.affectedGroups(Arrays.asList(limit.groups()));
        }
        return builder.build();
    }

    LimitRule toRule(RuleProperties properties) {
        LimitRule.Builder builder = LimitRule.builder()
                .increaseRank(properties.isIncreaseRank())
                .message(properties.getMessage())
                .reason(properties.getReason());

        if (properties.getHits() != null) {
            builder.hits(properties.getHits());
        }
        if (properties.getBatchTime() != null) {
            builder.batchTime(properties.getBatchTime());
        }
        if (properties.getDelay() != null) {
            builder.delay(properties.getDelay());
        }
        if (properties.getBlockTime() != null) {
            builder.blockTime(properties.getBlockTime());
        }
        if (properties.getGroups() != null) {
            builder.affectedGroups(properties.getGroups());
        }
        return builder.build();
    }

    private static Duration parse(String name, String value) {
        try {
            return DurationStyle.detectAndParse(value);
        } catch (IllegalArgumentException e) {
            throw new InvalidConfigurationException("Invalid " + name + " '" + value + "'", e);
        }
    }
}
