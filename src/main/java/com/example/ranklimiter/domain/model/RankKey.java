package com.example.ranklimiter.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * (endpoint, group, uniqueId) 저장소 키
 *
 * RankState: {endpoint}:{group}:{uniqueId}
 * CounterState: {endpoint}:{group}:{uniqueId}:counter:{rank}:{rule}
 * 면제: {endpoint}:{group}:{uniqueId}:ignore
 *
 * 각 구성 요소의 ':' 와 '\' 는 '\' 로 이스케이프한다 (IPv6 주소, 헤더에서 온 그룹 등).
 */
@Getter
@EqualsAndHashCode
public final class RankKey {

    private static final char SEPARATOR = ':';
    private static final char ESCAPE = '\\';

    private final String endpoint;
    private final String group;
    private final String uniqueId;

    private RankKey(String endpoint, String group, String uniqueId) {
        this.endpoint = endpoint;
        this.group = group;
        this.uniqueId = uniqueId;
    }

    public static RankKey of(String endpoint, CallerIdentity identity) {
        return new RankKey(endpoint, identity.getGroup(), identity.getUniqueId());
    }

    public String value() {
        return escape(endpoint) + SEPARATOR + escape(group) + SEPARATOR + escape(uniqueId);
    }

    public String counterPrefix() {
        return value() + ":counter:";
    }

    public String counterKey(int rankIndex, int ruleIndex) {
        return counterPrefix() + rankIndex + SEPARATOR + ruleIndex;
    }

    public String ignoreKey() {
        return value() + ":ignore";
    }

    static String escape(String component) {
        if (component.indexOf(SEPARATOR) < 0 && component.indexOf(ESCAPE) < 0) {
            return component;
        }
        StringBuilder escaped = new StringBuilder(component.length() + 4);
        for (char c : component.toCharArray()) {
            if (c == SEPARATOR || c == ESCAPE) {
                escaped.append(ESCAPE);
            }
            escaped.append(c);
        }
        return escaped.toString();
    }

    @Override
    public String toString() {
        return value();
    }
}
