package com.example.ranklimiter.domain.model;

/**
 * LimitRule의 동작 모드 (태그)
 */
public enum RuleMode {

    /** batchTime 동안 최대 hits 회 */
    COUNT("ratelimit.hits_exceeded", "Max hits per time exceeded"),

    /** 허용된 요청 사이 최소 delay */
    DELAY("ratelimit.delay_exceeded", "Delay between requests exceeded");

    private final String errorType;
    private final String defaultReason;

    RuleMode(String errorType, String defaultReason) {
        this.errorType = errorType;
        this.defaultReason = defaultReason;
    }

    public String getErrorType() {
        return errorType;
    }

    public String getDefaultReason() {
        return defaultReason;
    }
}
