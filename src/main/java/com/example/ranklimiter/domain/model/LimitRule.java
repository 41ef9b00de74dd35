package com.example.ranklimiter.domain.model;

import com.example.ranklimiter.common.exception.InvalidConfigurationException;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * 단일 제한 조건 + 위반 시 차단 시간을 나타내는 불변 Value Object
 *
 * 두 모드 중 정확히 하나:
 * - COUNT: hits, batchTime 지정. batchTime 윈도우 안에서 최대 hits 회 허용
 * - DELAY: delay 지정. 마지막으로 허용된 요청 이후 최소 delay 경과 필요
 *
 * 생성은 {@link #count}, {@link #delay} 또는 {@link #builder()}로만 가능하며
 * build() 시점에 매개변수를 검증한다.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class LimitRule {

    public static final Duration DEFAULT_BLOCK_TIME = Duration.ofSeconds(300);

    private final RuleMode mode;
    private final Integer hits;
    private final Duration batchTime;
    private final Duration delay;
    private final Duration blockTime;
    private final boolean increaseRank;
    private final String message;
    private final String customReason;
    private final Set<String> affectedGroups;

    private LimitRule(Builder builder) {
        this.mode = builder.delay != null ? RuleMode.DELAY : RuleMode.COUNT;
        this.hits = builder.hits;
        this.batchTime = builder.batchTime;
        this.delay = builder.delay;
        this.blockTime = builder.blockTime;
        this.increaseRank = builder.increaseRank;
        this.message = builder.message;
        this.customReason = builder.reason;
        this.affectedGroups = builder.affectedGroups == null
                ? Collections.emptySet()
                : Collections.unmodifiableSet(new LinkedHashSet<>(builder.affectedGroups));
    }

    public static LimitRule count(int hits, Duration batchTime, Duration blockTime) {
        return builder().hits(hits).batchTime(batchTime).blockTime(blockTime).build();
    }

    public static LimitRule delay(Duration delay, Duration blockTime) {
        return builder().delay(delay).blockTime(blockTime).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 그룹 제한이 없으면 모든 그룹에 적용
     */
    public boolean appliesTo(String group) {
        return affectedGroups.isEmpty() || affectedGroups.contains(group);
    }

    public String getReason() {
        return customReason != null ? customReason : mode.getDefaultReason();
    }

    /**
     * COUNT: batchTime, DELAY: delay
     */
    public Duration getStorageTtl() {
        return mode == RuleMode.DELAY ? delay : batchTime;
    }

    public String describe() {
        return switch (mode) {
            case COUNT -> String.format("%d hits per %s, block %s", hits, batchTime, blockTime);
            case DELAY -> String.format("delay %s, block %s", delay, blockTime);
        };
    }

    /**
     * 플루언트 빌더
     *
     * - 각 setter에서 양수 검증
     * - build()에서 모드 조합 검증
     */
    public static final class Builder {
        private Integer hits;
        private Duration batchTime;
        private Duration delay;
        private Duration blockTime = DEFAULT_BLOCK_TIME;
        private boolean increaseRank = true;
        private String message;
        private String reason;
        private Collection<String> affectedGroups;

        private Builder() {
        }

        public Builder hits(int hits) {
            if (hits <= 0) {
                throw new InvalidConfigurationException("Hits must be positive: " + hits);
            }
            this.hits = hits;
            return this;
        }

        public Builder batchTime(Duration batchTime) {
            this.batchTime = requirePositive("Batch time", batchTime);
            return this;
        }

        public Builder delay(Duration delay) {
            this.delay = requirePositive("Delay", delay);
            return this;
        }

        public Builder blockTime(Duration blockTime) {
            this.blockTime = requirePositive("Block time", blockTime);
            return this;
        }

        public Builder increaseRank(boolean increaseRank) {
            this.increaseRank = increaseRank;
            return this;
        }

        public Builder message(String message) {
            this.message = blankToNull(message);
            return this;
        }

        public Builder reason(String reason) {
            this.reason = blankToNull(reason);
            return this;
        }

        public Builder affectedGroups(Collection<String> groups) {
            if (groups != null && groups.isEmpty()) {
                throw new InvalidConfigurationException("Affected groups cannot be an empty list");
            }
            this.affectedGroups = groups;
            return this;
        }

        public LimitRule build() {
            boolean countMode = hits != null || batchTime != null;
            if (delay == null && !countMode) {
                throw new InvalidConfigurationException(
                        "Rule needs either hits and batch time, or delay");
            }
            if (delay != null && countMode) {
                throw new InvalidConfigurationException(
                        "Rule with delay cannot also declare hits or batch time");
            }
            if (countMode && (hits == null || batchTime == null)) {
                throw new InvalidConfigurationException(
                        "Count rule needs both hits and batch time");
            }
            return new LimitRule(this);
        }

        private static Duration requirePositive(String name, Duration value) {
            if (value == null || value.isZero() || value.isNegative()) {
                throw new InvalidConfigurationException(name + " must be positive: " + value);
            }
            return value;
        }

        private static String blankToNull(String value) {
            return value == null || value.isBlank() ? null : value;
        }
    }
}
