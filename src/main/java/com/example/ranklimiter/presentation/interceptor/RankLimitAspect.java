package com.example.ranklimiter.presentation.interceptor;

import com.example.ranklimiter.application.service.LadderRegistry;
import com.example.ranklimiter.application.service.RankLimiterService;
import com.example.ranklimiter.common.annotation.RankLimit;
import com.example.ranklimiter.common.exception.RateLimitedException;
import com.example.ranklimiter.common.exception.StoreUnavailableException;
import com.example.ranklimiter.config.RankLimitProperties;
import com.example.ranklimiter.domain.model.CallerIdentity;
import com.example.ranklimiter.domain.model.RankLadder;
import com.example.ranklimiter.domain.model.Verdict;
import com.example.ranklimiter.presentation.identity.CallerIdentityResolver;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.springframework.stereotype.Component;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;
import org.springframework.web.servlet.HandlerMapping;

import java.lang.reflect.Method;

/**
 * Rank Limit AOP Aspect
 * 
 * SOLID 원칙:
 * - Single Responsibility: 판정 결과를 HTTP 흐름에 반영하는 것만 담당
 * - Open/Closed: 식별자 추출은 CallerIdentityResolver로 교체 가능
 * - Dependency Inversion: Service 인터페이스에 의존
 *
 * 저장소 장애 시 rank-limit.fail-open 에 따라 통과시키거나 503으로 전파한다.
 */
@Slf4j
@Aspect
@Component
@RequiredArgsConstructor
public class RankLimitAspect {
    
    private final RankLimiterService rankLimiterService;
    private final LadderRegistry ladderRegistry;
    private final CallerIdentityResolver identityResolver;
    private final RankLimitProperties properties;
    
    @Around("@annotation(rankLimit)")
    public Object checkRankLimit(ProceedingJoinPoint joinPoint, RankLimit rankLimit) throws Throwable {
        MethodSignature signature = (MethodSignature) joinPoint.getSignature();
        Method method = signature.getMethod();
        HttpServletRequest request = currentRequest();

        // 1. 래더/엔드포인트/식별자 결정
        RankLadder ladder = ladderRegistry.ladderFor(method, rankLimit);
        String endpoint = resolveEndpoint(rankLimit, method, request);
        ladderRegistry.bindEndpoint(endpoint, ladder);
        CallerIdentity identity = identityResolver.resolve(
                rankLimit, request, signature.getParameterNames(), joinPoint.getArgs());
        
        // 2. 판정
        Verdict verdict;
        try {
            verdict = rankLimiterService.checkLimit(endpoint, identity, ladder);
        } catch (StoreUnavailableException e) {
            if (!properties.isFailOpen()) {
                throw e;
            }
            log.warn("Store unavailable, letting request through - Endpoint: {}, Caller: {}",
                    endpoint, identity.getUniqueId(), e);
            return joinPoint.proceed();
        }
        
        // 3. 결과 처리
        if (verdict.isBlocked()) {
            log.warn("Rank limit exceeded - Endpoint: {}, Caller: {}/{}, Rank: {}, Retry after: {}s",
                    endpoint, identity.getGroup(), identity.getUniqueId(),
                    verdict.getRankIndex(), verdict.getRetryAfterSeconds());
            throw new RateLimitedException(endpoint, verdict);
        }
        
        // 4. 원래 메서드 실행
        return joinPoint.proceed();
    }

    /**
     * 명시된 endpoint, 없으면 "HTTP메서드:매핑패턴", 웹 요청 밖이면 "클래스#메서드"
     */
    private String resolveEndpoint(RankLimit rankLimit, Method method, HttpServletRequest request) {
        if (!rankLimit.endpoint().isBlank()) {
            return rankLimit.endpoint();
        }
        if (request == null) {
            return method.getDeclaringClass().getSimpleName() + "#" + method.getName();
        }
        Object pattern = request.getAttribute(HandlerMapping.BEST_MATCHING_PATTERN_ATTRIBUTE);
        String path = pattern != null ? pattern.toString() : request.getRequestURI();
        return request.getMethod() + ":" + path;
    }

    private HttpServletRequest currentRequest() {
        ServletRequestAttributes attributes =
                (ServletRequestAttributes) RequestContextHolder.getRequestAttributes();
        return attributes != null ? attributes.getRequest() : null;
    }
}
