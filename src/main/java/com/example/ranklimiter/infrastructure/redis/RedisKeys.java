package com.example.ranklimiter.infrastructure.redis;

/**
 * Redis 키 조립 유틸
 */
final class RedisKeys {

    private RedisKeys() {
    }

    static String join(String prefix, String key) {
        return prefix + ":" + key;
    }

    /**
     * SCAN MATCH 패턴에서 glob 특수문자를 이스케이프
     */
    static String escapeGlob(String value) {
        StringBuilder escaped = new StringBuilder(value.length());
        for (char c : value.toCharArray()) {
            if (c == '*' || c == '?' || c == '[' || c == ']' || c == '\\') {
                escaped.append('\\');
            }
            escaped.append(c);
        }
        return escaped.toString();
    }
}
