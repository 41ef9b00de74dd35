package com.example.ranklimiter.presentation.controller;

import com.example.ranklimiter.common.exception.IdentityMissingException;
import com.example.ranklimiter.common.exception.InvalidConfigurationException;
import com.example.ranklimiter.common.exception.RateLimitedException;
import com.example.ranklimiter.common.exception.StoreUnavailableException;
import com.example.ranklimiter.domain.model.LimitRule;
import com.example.ranklimiter.domain.model.Verdict;
import com.example.ranklimiter.presentation.dto.RankLimitDto;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

/**
 * GlobalExceptionHandler 테스트
 */
class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler();
    }

    @Test
    @DisplayName("InvalidConfigurationException 발생 시 400 응답 반환")
    void handleInvalidRequestExceptionTest() {
        // given
        InvalidConfigurationException exception =
                new InvalidConfigurationException("Block duration must be positive: PT0S");

        // when
        ResponseEntity<RankLimitDto.ErrorResponse> response =
                handler.handleInvalidRequest(exception);

        // then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().getStatus()).isEqualTo(400);
        assertThat(response.getBody().getError()).isEqualTo("Bad Request");
        assertThat(response.getBody().getMessage()).contains("Block duration must be positive");
    }

    @Test
    @DisplayName("RateLimitedException 발생 시 429 응답 및 헤더 반환")
    void handleRateLimitedExceptionTest() {
        // given
        LimitRule rule = LimitRule.builder()
                .hits(5)
                .batchTime(Duration.ofSeconds(10))
                .blockTime(Duration.ofSeconds(30))
                .message("Too many pings")
                .build();
        Instant blockedUntil = Instant.parse("2026-01-01T00:00:30Z");
        Verdict verdict = Verdict.blocked(1, Duration.ofMillis(29_500), blockedUntil, rule);
        RateLimitedException exception = new RateLimitedException("ping", verdict);

        // when
        ResponseEntity<RankLimitDto.ErrorResponse> response =
                handler.handleRateLimited(exception);

        // then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.TOO_MANY_REQUESTS);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().getStatus()).isEqualTo(429);
        assertThat(response.getBody().getError()).isEqualTo("Too Many Requests");
        assertThat(response.getBody().getMessage()).isEqualTo("Too many pings");

        RankLimitDto.ErrorResponse.RateLimitInfo info = response.getBody().getRateLimitInfo();
        assertThat(info.getReason()).isEqualTo("Max hits per time exceeded");
        assertThat(info.getErrorType()).isEqualTo("ratelimit.hits_exceeded");
        assertThat(info.getLimitedFor()).isEqualTo(30);
        assertThat(info.getHits()).isEqualTo(5);
        assertThat(info.getBatchTime()).isEqualTo(10);
        assertThat(info.getDelay()).isNull();
        assertThat(info.getRank()).isEqualTo(1);

        // 헤더 검증
        assertThat(response.getHeaders().getFirst("Retry-After")).isEqualTo("30");
        assertThat(response.getHeaders().getFirst("X-RateLimit-Rank")).isEqualTo("1");
        assertThat(response.getHeaders().getFirst("X-RateLimit-Reset"))
                .isEqualTo(String.valueOf(blockedUntil.getEpochSecond()));
    }

    @Test
    @DisplayName("수동 차단은 사유만 담고 규칙 정보는 생략")
    void handleManualBlockTest() {
        // given
        Verdict verdict = Verdict.blocked(0, Duration.ofSeconds(60), null, null);

        // when
        ResponseEntity<RankLimitDto.ErrorResponse> response =
                handler.handleRateLimited(new RateLimitedException("ping", verdict));

        // then
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().getMessage()).isEqualTo(Verdict.MANUAL_BLOCK_REASON);
        assertThat(response.getBody().getRateLimitInfo().getErrorType()).isEqualTo("ratelimit.manual_block");
        assertThat(response.getBody().getRateLimitInfo().getHits()).isNull();
        assertThat(response.getHeaders().get("X-RateLimit-Reset")).isNull();
    }

    @Test
    @DisplayName("IdentityMissingException 발생 시 401 응답 반환")
    void handleIdentityMissingTest() {
        // when
        ResponseEntity<RankLimitDto.ErrorResponse> response =
                handler.handleIdentityMissing(new IdentityMissingException("Caller unique id is missing"));

        // then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.UNAUTHORIZED);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().getStatus()).isEqualTo(401);
    }

    @Test
    @DisplayName("StoreUnavailableException 발생 시 503 응답 및 내부 정보 마스킹")
    void handleStoreUnavailableTest() {
        // given
        StoreUnavailableException exception = new StoreUnavailableException(
                "Redis script failed at redis-internal:6379",
                new RedisConnectionFailureException("connection refused"));

        // when
        ResponseEntity<RankLimitDto.ErrorResponse> response =
                handler.handleStoreUnavailable(exception);

        // then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().getMessage()).doesNotContain("redis-internal");
    }

    @Test
    @DisplayName("일반 Exception 발생 시 500 응답 및 마스킹된 메시지 반환")
    void handleGenericExceptionTest() {
        // given
        Exception exception = new RuntimeException("Internal database connection failed");

        // when
        ResponseEntity<RankLimitDto.ErrorResponse> response =
                handler.handleGenericException(exception);

        // then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().getStatus()).isEqualTo(500);
        assertThat(response.getBody().getError()).isEqualTo("Internal Server Error");
        // 내부 메시지가 노출되지 않음
        assertThat(response.getBody().getMessage())
                .isEqualTo("An internal server error occurred. Please try again later.")
                .doesNotContain("database connection");
    }

    @Test
    @DisplayName("IllegalArgumentException은 500으로 처리되어 내부 정보 노출 방지")
    void illegalArgumentExceptionNotHandledAs400Test() {
        // given
        IllegalArgumentException exception =
                new IllegalArgumentException("Internal validation failed: secret detail");

        // when
        ResponseEntity<RankLimitDto.ErrorResponse> response =
                handler.handleGenericException(exception);

        // then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().getMessage())
                .isEqualTo("An internal server error occurred. Please try again later.")
                .doesNotContain("secret detail");
    }
}
