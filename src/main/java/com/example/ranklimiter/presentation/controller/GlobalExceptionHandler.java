package com.example.ranklimiter.presentation.controller;

import com.example.ranklimiter.common.exception.IdentityMissingException;
import com.example.ranklimiter.common.exception.InvalidConfigurationException;
import com.example.ranklimiter.common.exception.RateLimitedException;
import com.example.ranklimiter.common.exception.StoreUnavailableException;
import com.example.ranklimiter.domain.model.Verdict;
import com.example.ranklimiter.presentation.dto.RankLimitDto;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.time.Instant;

/**
 * 전역 예외 처리 핸들러
 * 
 * SOLID 원칙:
 * - Single Responsibility: 예외 처리 및 에러 응답 생성만 담당
 *
 * 상태 코드:
 * - 429: 차단 (Retry-After, X-RateLimit-Reset, X-RateLimit-Rank 헤더)
 * - 400: 잘못된 설정/파라미터
 * - 401: 요청자 식별 불가
 * - 503: 저장소 장애 (fail-open 비활성화 시)
 * - 500: 그 외 (내부 메시지 마스킹)
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    static final String INTERNAL_ERROR_MESSAGE = "An internal server error occurred. Please try again later.";
    static final String STORE_UNAVAILABLE_MESSAGE = "Rate limit store is temporarily unavailable.";
    
    /**
     * 차단 예외 처리
     */
    @ExceptionHandler(RateLimitedException.class)
    public ResponseEntity<RankLimitDto.ErrorResponse> handleRateLimited(RateLimitedException ex) {
        Verdict verdict = ex.getVerdict();
        
        RankLimitDto.ErrorResponse response = RankLimitDto.ErrorResponse.builder()
                .status(HttpStatus.TOO_MANY_REQUESTS.value())
                .error("Too Many Requests")
                .message(ex.getMessage())
                .timestamp(Instant.now())
                .rateLimitInfo(RankLimitDto.ErrorResponse.RateLimitInfo.from(verdict))
                .build();
        
        ResponseEntity.BodyBuilder builder = ResponseEntity
                .status(HttpStatus.TOO_MANY_REQUESTS)
                .header(HttpHeaders.RETRY_AFTER, String.valueOf(verdict.getRetryAfterSeconds()))
                .header("X-RateLimit-Rank", String.valueOf(verdict.getRankIndex()));
        if (verdict.getBlockedUntil() != null) {
            builder.header("X-RateLimit-Reset", String.valueOf(verdict.getBlockedUntil().getEpochSecond()));
        }
        return builder.body(response);
    }

    /**
     * 잘못된 래더/규칙 설정 또는 관리 API 파라미터
     */
    @ExceptionHandler(InvalidConfigurationException.class)
    public ResponseEntity<RankLimitDto.ErrorResponse> handleInvalidRequest(InvalidConfigurationException ex) {
        return error(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    @ExceptionHandler({MissingServletRequestParameterException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<RankLimitDto.ErrorResponse> handleBadParameter(Exception ex) {
        return error(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    @ExceptionHandler(IdentityMissingException.class)
    public ResponseEntity<RankLimitDto.ErrorResponse> handleIdentityMissing(IdentityMissingException ex) {
        log.warn("Caller could not be identified: {}", ex.getMessage());
        return error(HttpStatus.UNAUTHORIZED, ex.getMessage());
    }

    @ExceptionHandler(StoreUnavailableException.class)
    public ResponseEntity<RankLimitDto.ErrorResponse> handleStoreUnavailable(StoreUnavailableException ex) {
        log.error("Rank limit store unavailable", ex);
        return error(HttpStatus.SERVICE_UNAVAILABLE, STORE_UNAVAILABLE_MESSAGE);
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<RankLimitDto.ErrorResponse> handleNotFound(NoResourceFoundException ex) {
        return error(HttpStatus.NOT_FOUND, ex.getMessage());
    }
    
    /**
     * 일반 예외 처리
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<RankLimitDto.ErrorResponse> handleGenericException(Exception ex) {
        log.error("Unexpected error occurred", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, INTERNAL_ERROR_MESSAGE);
    }

    private ResponseEntity<RankLimitDto.ErrorResponse> error(HttpStatus status, String message) {
        RankLimitDto.ErrorResponse response = RankLimitDto.ErrorResponse.builder()
                .status(status.value())
                .error(status.getReasonPhrase())
                .message(message)
                .timestamp(Instant.now())
                .build();
        
        return ResponseEntity
                .status(status)
                .body(response);
    }
}
