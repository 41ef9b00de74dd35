package com.example.ranklimiter.presentation.dto;

import com.example.ranklimiter.domain.model.CallerIdentity;
import com.example.ranklimiter.domain.model.IgnoreGrant;
import com.example.ranklimiter.domain.model.IgnoreScope;
import com.example.ranklimiter.domain.model.LimitRule;
import com.example.ranklimiter.domain.model.RankState;
import com.example.ranklimiter.domain.model.Verdict;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * API 응답 DTO들
 *
 * SOLID 원칙:
 * - Single Responsibility: 각 DTO는 하나의 응답 타입만 표현
 */
public class RankLimitDto {

    /**
     * 에러 응답 DTO
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ErrorResponse {
        private int status;
        private String error;
        private String message;
        private Instant timestamp;
        private RateLimitInfo rateLimitInfo;

        /**
         * 차단 상세 정보
         *
         * - limitedFor: 남은 차단 시간 (초)
         * - hits/delay: 원인 규칙 설정, 수동 차단이면 생략
         */
        @Data
        @Builder
        @NoArgsConstructor
        @AllArgsConstructor
        @JsonInclude(JsonInclude.Include.NON_NULL)
        public static class RateLimitInfo {
            private String reason;
            private String message;
            private long limitedFor;
            private String errorType;
            private Integer hits;
            private Long batchTime;
            private Long delay;
            private int rank;

            public static RateLimitInfo from(Verdict verdict) {
                RateLimitInfoBuilder builder = RateLimitInfo.builder()
                        .reason(verdict.getReason())
                        .message(verdict.getMessage())
                        .limitedFor(verdict.getRetryAfterSeconds())
                        .errorType(verdict.getErrorType())
                        .rank(verdict.getRankIndex());

                LimitRule cause = verdict.getCause();
                if (cause != null) {
                    builder.hits(cause.getHits())
                            .batchTime(seconds(cause.getBatchTime()))
                            .delay(seconds(cause.getDelay()));
                }
                return builder.build();
            }

            private static Long seconds(Duration duration) {
                return duration != null ? duration.getSeconds() : null;
            }
        }
    }

    /**
     * 등급 상태 조회 응답 DTO
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class RankStateResponse {
        private String endpoint;
        private String uniqueId;
        private String group;
        private int currentIndex;
        private boolean blocked;
        private Instant blockedUntil;
        private long retryAfterSeconds;
        private BlockedBy blockedBy;

        /**
         * 차단 원인 규칙 위치. 수동 차단이면 null
         */
        @Data
        @Builder
        @NoArgsConstructor
        @AllArgsConstructor
        public static class BlockedBy {
            private int rank;
            private int rule;
        }

        public static RankStateResponse of(String endpoint, CallerIdentity identity,
                                           RankState state, Instant now) {
            long remainingMillis = state.remainingBlock(now).toMillis();

            return RankStateResponse.builder()
                    .endpoint(endpoint)
                    .uniqueId(identity.getUniqueId())
                    .group(identity.getGroup())
                    .currentIndex(state.getCurrentIndex())
                    .blocked(state.isBlockedAt(now))
                    .blockedUntil(state.getBlockedUntil())
                    .retryAfterSeconds((remainingMillis + 999) / 1000)
                    .blockedBy(state.getBlockedRank() != null && state.getBlockedRule() != null
                            ? new BlockedBy(state.getBlockedRank(), state.getBlockedRule())
                            : null)
                    .build();
        }
    }

    /**
     * 면제 상태 응답 DTO
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class IgnoreResponse {
        private String endpoint;
        private String level;
        private String uniqueId;
        private String group;
        private boolean active;
        private Integer remainingTimes;
        private Instant ignoredUntil;

        public static IgnoreResponse of(IgnoreScope scope, Optional<IgnoreGrant> grant) {
            CallerIdentity identity = scope.getIdentity();

            return IgnoreResponse.builder()
                    .endpoint(scope.getEndpoint())
                    .level(scope.getLevel().name())
                    .uniqueId(identity != null ? identity.getUniqueId() : null)
                    .group(identity != null ? identity.getGroup() : null)
                    .active(grant.isPresent())
                    .remainingTimes(grant.map(IgnoreGrant::getRemainingTimes).orElse(null))
                    .ignoredUntil(grant.map(IgnoreGrant::getUntil).orElse(null))
                    .build();
        }
    }
}
