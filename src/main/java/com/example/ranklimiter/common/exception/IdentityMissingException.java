package com.example.ranklimiter.common.exception;

/**
 * 요청자 식별자를 만들 수 없을 때 발생
 */
public class IdentityMissingException extends RuntimeException {

    public IdentityMissingException(String message) {
        super(message);
    }

    public IdentityMissingException(String message, Throwable cause) {
        super(message, cause);
    }
}
