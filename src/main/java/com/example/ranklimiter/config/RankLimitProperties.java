package com.example.ranklimiter.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * rank-limit.* 설정
 *
 * 예:
 * <pre>
 * rank-limit:
 *   store: redis
 *   ladders:
 *     default:
 *       - rules:
 *           - hits: 10
 *             batch-time: 1m
 *             block-time: 1m
 * </pre>
 */
@Data
@ConfigurationProperties(prefix = "rank-limit")
public class RankLimitProperties {

    /** 저장소 구현 선택 */
    private StoreType store = StoreType.REDIS;

    /** 저장소 장애 시 요청 허용 여부 (호스트 정책) */
    private boolean failOpen = false;

    private String keyPrefix = "rank_limit";

    /** RankState 보관 기간. 쓰기마다 갱신되며 진행 중 차단보다 짧아지지 않는다. */
    private Duration rankTtl = Duration.ofHours(24);

    /** 이름 -> 등급 목록 */
    private Map<String, List<RankProperties>> ladders = new LinkedHashMap<>();

    public enum StoreType {
        REDIS,
        MEMORY
    }

    @Data
    public static class RankProperties {
        private List<RuleProperties> rules = new ArrayList<>();
    }

    @Data
    public static class RuleProperties {
        private Integer hits;
        private Duration batchTime;
        private Duration delay;
        private Duration blockTime;
        private boolean increaseRank = true;
        private String message;
        private String reason;
        private List<String> groups;
    }
}
