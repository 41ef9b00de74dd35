package com.example.ranklimiter.common.exception;

/**
 * 저장소(Redis 등) 호출 실패
 *
 * 엔진은 이 예외를 삼키지 않고 그대로 전파한다.
 * fail-open / fail-closed 여부는 호스트(RankLimitAspect)가 결정한다.
 */
public class StoreUnavailableException extends RuntimeException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
