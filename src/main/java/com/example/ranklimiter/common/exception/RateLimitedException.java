package com.example.ranklimiter.common.exception;

import com.example.ranklimiter.domain.model.Verdict;
import lombok.Getter;

/**
 * 차단 판정을 HTTP 계층으로 전달하는 예외
 *
 * 엔진 자체는 예외가 아닌 Verdict를 반환한다.
 * 웹 환경에서 429 응답으로 바꾸기 위해 Aspect에서만 던진다.
 */
@Getter
public class RateLimitedException extends RuntimeException {

    private final String endpoint;
    private final Verdict verdict;

    public RateLimitedException(String endpoint, Verdict verdict) {
        super(verdict.getMessage() != null ? verdict.getMessage() : verdict.getReason());
        this.endpoint = endpoint;
        this.verdict = verdict;
    }
}
