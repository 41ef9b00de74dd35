package com.example.ranklimiter.presentation.controller;

import com.example.ranklimiter.application.service.LadderRegistry;
import com.example.ranklimiter.application.service.RankLimiterService;
import com.example.ranklimiter.common.annotation.Limit;
import com.example.ranklimiter.common.annotation.LimitGroup;
import com.example.ranklimiter.common.annotation.RankLimit;
import com.example.ranklimiter.common.exception.InvalidConfigurationException;
import com.example.ranklimiter.domain.model.CallerIdentity;
import com.example.ranklimiter.domain.model.IgnoreGrant;
import com.example.ranklimiter.domain.model.IgnoreScope;
import com.example.ranklimiter.domain.model.RankLadder;
import com.example.ranklimiter.domain.model.RankState;
import com.example.ranklimiter.presentation.dto.RankLimitDto;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Rank Limiter REST Controller
 * 
 * SOLID 원칙:
 * - Single Responsibility: HTTP 요청 처리만 담당
 * - Dependency Inversion: Service 인터페이스에 의존
 */
@Slf4j
@RestController
@RequestMapping("/api/rank-limit")
@RequiredArgsConstructor
public class RankLimitController {
    
    private final RankLimiterService rankLimiterService;
    private final LadderRegistry ladderRegistry;
    private final Clock clock;
    
    /**
     * 단일 규칙: 10초에 5회, 위반 시 30초 차단
     */
    @GetMapping("/ping")
    @RankLimit(endpoint = "ping", ranks = {
            @LimitGroup(@Limit(hits = 5, batchTime = "10s", blockTime = "30s"))
    })
    public ResponseEntity<Map<String, Object>> ping(HttpServletRequest request) {
        return createSuccessResponse("ping", request.getRemoteAddr());
    }
    
    /**
     * 2단계 래더: 위반할 때마다 다음 등급(더 엄격, 더 긴 차단)으로 이동
     */
    @GetMapping("/escalating")
    @RankLimit(endpoint = "escalating", ranks = {
            @LimitGroup(@Limit(hits = 2, batchTime = "10s", blockTime = "10s")),
            @LimitGroup(@Limit(hits = 1, batchTime = "10s", blockTime = "60s"))
    })
    public ResponseEntity<Map<String, Object>> escalating(HttpServletRequest request) {
        return createSuccessResponse("escalating", request.getRemoteAddr());
    }
    
    /**
     * AND 그룹: anonymous 그룹 전용 횟수 제한 + 모든 그룹 공통 요청 간격 제한
     * 간격 위반은 등급을 올리지 않는다.
     */
    @GetMapping("/grouped")
    @RankLimit(endpoint = "grouped",
            groupExpression = "#request.getHeader('X-Caller-Group') ?: 'anonymous'",
            ranks = {
                    @LimitGroup({
                            @Limit(hits = 3, batchTime = "60s", blockTime = "120s", groups = "anonymous"),
                            @Limit(delay = "1s", blockTime = "5s", increaseRank = false,
                                    message = "Please wait a second between requests")
                    })
            })
    public ResponseEntity<Map<String, Object>> grouped(HttpServletRequest request) {
        return createSuccessResponse("grouped", request.getRemoteAddr());
    }
    
    /**
     * rank-limit.ladders.default 래더 사용
     */
    @GetMapping("/named")
    @RankLimit(endpoint = "named", ladder = "default",
            identifierExpression = "#request.getHeader('X-Api-Key') ?: #request.remoteAddr")
    public ResponseEntity<Map<String, Object>> named(HttpServletRequest request) {
        return createSuccessResponse("named", request.getRemoteAddr());
    }
    
    /**
     * 요청자의 현재 등급/차단 상태 조회
     */
    @GetMapping("/{endpoint}/state")
    public ResponseEntity<RankLimitDto.RankStateResponse> getState(
            @PathVariable String endpoint,
            @RequestParam(required = false) String uniqueId,
            @RequestParam(required = false) String group,
            HttpServletRequest request) {
        
        CallerIdentity identity = identityOf(uniqueId, group, request);
        RankState state = rankLimiterService.inspect(endpoint, identity);
        
        return ResponseEntity.ok(RankLimitDto.RankStateResponse.of(endpoint, identity, state, clock.instant()));
    }
    
    /**
     * 특정 엔드포인트에 대한 요청자 상태 초기화 (등급 + 카운터)
     */
    @DeleteMapping("/{endpoint}/reset")
    public ResponseEntity<Map<String, Object>> reset(
            @PathVariable String endpoint,
            @RequestParam(required = false) String uniqueId,
            @RequestParam(required = false) String group,
            HttpServletRequest request) {
        
        CallerIdentity identity = identityOf(uniqueId, group, request);
        rankLimiterService.reset(endpoint, identity);
        
        return ResponseEntity.ok(Map.of(
                "message", "Rank limit reset successfully",
                "endpoint", endpoint,
                "uniqueId", identity.getUniqueId(),
                "group", identity.getGroup()
        ));
    }
    
    /**
     * 수동 차단
     */
    @PostMapping("/{endpoint}/block")
    public ResponseEntity<RankLimitDto.RankStateResponse> block(
            @PathVariable String endpoint,
            @RequestParam long seconds,
            @RequestParam(required = false) String uniqueId,
            @RequestParam(required = false) String group,
            HttpServletRequest request) {
        
        CallerIdentity identity = identityOf(uniqueId, group, request);
        RankState state = rankLimiterService.block(endpoint, identity, Duration.ofSeconds(seconds));
        
        return ResponseEntity.ok(RankLimitDto.RankStateResponse.of(endpoint, identity, state, clock.instant()));
    }
    
    /**
     * 등급 이동 (by가 음수면 하향). 래더가 등록된 엔드포인트만 가능
     */
    @PostMapping("/{endpoint}/rank")
    public ResponseEntity<RankLimitDto.RankStateResponse> shiftRank(
            @PathVariable String endpoint,
            @RequestParam int by,
            @RequestParam(required = false) String uniqueId,
            @RequestParam(required = false) String group,
            HttpServletRequest request) {
        
        RankLadder ladder = ladderRegistry.ladderForEndpoint(endpoint)
                .orElseThrow(() -> new InvalidConfigurationException(
                        "No rank ladder registered for endpoint: " + endpoint));
        CallerIdentity identity = identityOf(uniqueId, group, request);
        RankState state = rankLimiterService.shiftRank(endpoint, identity, by, ladder);
        
        return ResponseEntity.ok(RankLimitDto.RankStateResponse.of(endpoint, identity, state, clock.instant()));
    }
    
    /**
     * 요청자 면제: times 회 또는 seconds 초 동안 규칙 평가 없이 허용
     */
    @PostMapping("/{endpoint}/ignore")
    public ResponseEntity<RankLimitDto.IgnoreResponse> ignoreCaller(
            @PathVariable String endpoint,
            @RequestParam(required = false) Integer times,
            @RequestParam(required = false) Long seconds,
            @RequestParam(required = false) String uniqueId,
            @RequestParam(required = false) String group,
            HttpServletRequest request) {
        
        IgnoreScope scope = IgnoreScope.caller(endpoint, identityOf(uniqueId, group, request));
        return ignore(scope, times, seconds);
    }
    
    /**
     * 엔드포인트 전체 면제 (모든 요청자)
     */
    @PostMapping("/{endpoint}/ignore-all")
    public ResponseEntity<RankLimitDto.IgnoreResponse> ignoreEndpoint(
            @PathVariable String endpoint,
            @RequestParam(required = false) Integer times,
            @RequestParam(required = false) Long seconds) {
        
        return ignore(IgnoreScope.endpoint(endpoint), times, seconds);
    }
    
    @GetMapping("/{endpoint}/ignore")
    public ResponseEntity<RankLimitDto.IgnoreResponse> getCallerIgnore(
            @PathVariable String endpoint,
            @RequestParam(required = false) String uniqueId,
            @RequestParam(required = false) String group,
            HttpServletRequest request) {
        
        IgnoreScope scope = IgnoreScope.caller(endpoint, identityOf(uniqueId, group, request));
        return ResponseEntity.ok(RankLimitDto.IgnoreResponse.of(scope, rankLimiterService.inspectIgnore(scope)));
    }
    
    @GetMapping("/{endpoint}/ignore-all")
    public ResponseEntity<RankLimitDto.IgnoreResponse> getEndpointIgnore(@PathVariable String endpoint) {
        IgnoreScope scope = IgnoreScope.endpoint(endpoint);
        return ResponseEntity.ok(RankLimitDto.IgnoreResponse.of(scope, rankLimiterService.inspectIgnore(scope)));
    }
    
    @DeleteMapping("/{endpoint}/ignore")
    public ResponseEntity<RankLimitDto.IgnoreResponse> clearCallerIgnore(
            @PathVariable String endpoint,
            @RequestParam(required = false) String uniqueId,
            @RequestParam(required = false) String group,
            HttpServletRequest request) {
        
        IgnoreScope scope = IgnoreScope.caller(endpoint, identityOf(uniqueId, group, request));
        rankLimiterService.clearIgnore(scope);
        return ResponseEntity.ok(RankLimitDto.IgnoreResponse.of(scope, Optional.empty()));
    }
    
    @DeleteMapping("/{endpoint}/ignore-all")
    public ResponseEntity<RankLimitDto.IgnoreResponse> clearEndpointIgnore(@PathVariable String endpoint) {
        IgnoreScope scope = IgnoreScope.endpoint(endpoint);
        rankLimiterService.clearIgnore(scope);
        return ResponseEntity.ok(RankLimitDto.IgnoreResponse.of(scope, Optional.empty()));
    }
    
    /**
     * 홈페이지 (API 문서)
     */
    @GetMapping("/")
    public ResponseEntity<Map<String, Object>> home() {
        return ResponseEntity.ok(Map.of(
                "title", "등급 기반 Rate Limiter API",
                "description", "위반할수록 더 엄격한 규칙과 더 긴 차단이 적용되는 에스컬레이션 데모",
                "endpoints", Map.of(
                        "GET /api/rank-limit/ping", "단일 규칙 (10초 5회)",
                        "GET /api/rank-limit/escalating", "2단계 에스컬레이션",
                        "GET /api/rank-limit/grouped", "횟수 + 요청 간격 AND 그룹 (X-Caller-Group 헤더)",
                        "GET /api/rank-limit/named", "설정 파일 래더 (default)",
                        "GET /api/rank-limit/{endpoint}/state", "등급/차단 상태 조회",
                        "DELETE /api/rank-limit/{endpoint}/reset", "상태 초기화",
                        "POST /api/rank-limit/{endpoint}/block?seconds=", "수동 차단",
                        "POST /api/rank-limit/{endpoint}/rank?by=", "등급 이동",
                        "POST /api/rank-limit/{endpoint}/ignore?times=|seconds=", "요청자 면제",
                        "POST /api/rank-limit/{endpoint}/ignore-all?times=|seconds=", "엔드포인트 전체 면제"
                ),
                "tips", List.of(
                        "같은 엔드포인트를 빠르게 여러 번 호출해보세요",
                        "429 응답의 Retry-After, X-RateLimit-Rank 헤더를 확인하세요",
                        "차단이 풀린 뒤 다시 위반하면 더 오래 차단됩니다"
                )
        ));
    }

    private ResponseEntity<RankLimitDto.IgnoreResponse> ignore(IgnoreScope scope, Integer times, Long seconds) {
        Duration duration = seconds != null ? Duration.ofSeconds(seconds) : null;
        IgnoreGrant grant = rankLimiterService.ignore(scope, times, duration);
        return ResponseEntity.ok(RankLimitDto.IgnoreResponse.of(scope, Optional.of(grant)));
    }

    private CallerIdentity identityOf(String uniqueId, String group, HttpServletRequest request) {
        return CallerIdentity.of(uniqueId != null ? uniqueId : request.getRemoteAddr(), group);
    }
    
    private ResponseEntity<Map<String, Object>> createSuccessResponse(String endpoint, String identifier) {
        return ResponseEntity.ok(Map.of(
                "message", "요청 성공!",
                "endpoint", endpoint,
                "identifier", identifier,
                "timestamp", Instant.now(clock)
        ));
    }
}
