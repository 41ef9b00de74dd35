package com.example.ranklimiter.common.exception;

/**
 * 잘못된 규칙/래더 설정 예외
 *
 * 요청 처리 중이 아니라 설정 시점(규칙 생성, 애플리케이션 기동)에 발생한다.
 * 예상치 못한 IllegalArgumentException과 구분하기 위해 별도 타입으로 둔다.
 *
 * 사용 예:
 * - LimitRule 빌더 파라미터 검증
 * - 빈 RankLadder, ladder/ranks 동시 선언된 @RankLimit
 */
public class InvalidConfigurationException extends RuntimeException {

    public InvalidConfigurationException(String message) {
        super(message);
    }

    public InvalidConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
