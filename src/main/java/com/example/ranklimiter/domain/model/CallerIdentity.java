package com.example.ranklimiter.domain.model;

import com.example.ranklimiter.common.exception.IdentityMissingException;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 요청마다 인증 단계가 만들어 주는 요청자 식별 정보
 *
 * uniqueId: 실제 요청자를 안정적으로 구분하는 값 (IP, API key 등)
 * group: 독립적으로 등급이 관리되는 모집단 (예: anonymous / member)
 */
@Getter
@ToString
@EqualsAndHashCode
public final class CallerIdentity {

    public static final String DEFAULT_GROUP = "default";

    private final String uniqueId;
    private final String group;

    private CallerIdentity(String uniqueId, String group) {
        if (uniqueId == null || uniqueId.isBlank()) {
            throw new IdentityMissingException("Caller unique id is missing");
        }
        this.uniqueId = uniqueId;
        this.group = group == null || group.isBlank() ? DEFAULT_GROUP : group;
    }

    public static CallerIdentity of(String uniqueId, String group) {
        return new CallerIdentity(uniqueId, group);
    }

    public static CallerIdentity of(String uniqueId) {
        return new CallerIdentity(uniqueId, DEFAULT_GROUP);
    }
}
